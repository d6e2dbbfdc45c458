package com.phonepe.agentrecall.core.ranking;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Weights of the composite relevance score. Weights are not required to sum to one.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class RankingWeights {
    public static final RankingWeights DEFAULT = RankingWeights.builder().build();

    @Builder.Default
    double taskCriticality = 0.45;
    @Builder.Default
    double semanticSimilarity = 0.25;
    @Builder.Default
    double importance = 0.20;
    @Builder.Default
    double recencyDecay = 0.10;

    public boolean isValid() {
        return taskCriticality >= 0 && semanticSimilarity >= 0 && importance >= 0 && recencyDecay >= 0;
    }
}

package com.phonepe.agentrecall.core.ranking;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Weighted contribution of each signal to a composite score
 */
@Value
@Builder
@Jacksonized
public class ScoreComponents {
    double taskCriticality;
    double semanticSimilarity;
    double importance;
    double recency;

    public double total() {
        return taskCriticality + semanticSimilarity + importance + recency;
    }
}

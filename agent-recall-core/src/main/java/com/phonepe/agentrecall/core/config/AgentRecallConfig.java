package com.phonepe.agentrecall.core.config;

import com.phonepe.agentrecall.core.drift.DriftThresholds;
import com.phonepe.agentrecall.core.freshness.SLOConfig;
import com.phonepe.agentrecall.core.ranking.RankingWeights;
import com.phonepe.agentrecall.core.validation.MemoryValidationConfig;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Top level configuration. Every field has a default, so partial documents only need to name what they change.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class AgentRecallConfig {
    public static final AgentRecallConfig DEFAULT = AgentRecallConfig.builder().build();

    @Builder.Default
    RankingWeights rankingWeights = RankingWeights.DEFAULT;
    @Builder.Default
    SLOConfig slo = SLOConfig.DEFAULT;
    @Builder.Default
    DriftThresholds driftThresholds = DriftThresholds.DEFAULT;
    @Builder.Default
    MemoryValidationConfig validation = MemoryValidationConfig.DEFAULT;
    /**
     * Page size used by expiry sweeps
     */
    @Builder.Default
    int expiryBatchSize = 500;
    @Builder.Default
    int defaultSearchLimit = 10;
    /**
     * Upper bound on a store search. No bound when null.
     */
    Duration searchTimeout;

    public List<String> validate() {
        final var errors = new ArrayList<String>();
        if (rankingWeights == null || !rankingWeights.isValid()) {
            errors.add("ranking weights must be non-negative");
        }
        if (slo == null) {
            errors.add("slo configuration is required");
        }
        else {
            errors.addAll(slo.validate());
        }
        if (driftThresholds == null) {
            errors.add("drift thresholds are required");
        }
        else {
            errors.addAll(driftThresholds.validate());
        }
        if (validation == null) {
            errors.add("validation configuration is required");
        }
        else {
            errors.addAll(validation.validate());
        }
        if (expiryBatchSize <= 0) {
            errors.add("expiry_batch_size must be positive");
        }
        if (defaultSearchLimit <= 0) {
            errors.add("default_search_limit must be positive");
        }
        if (searchTimeout != null && (searchTimeout.isNegative() || searchTimeout.isZero())) {
            errors.add("search_timeout must be positive");
        }
        return errors;
    }
}

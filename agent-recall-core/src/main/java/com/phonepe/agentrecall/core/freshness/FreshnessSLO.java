package com.phonepe.agentrecall.core.freshness;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Thresholds that decide whether retrieved memories are fresh and relevant enough
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class FreshnessSLO {
    public static final FreshnessSLO DEFAULT = FreshnessSLO.builder().build();

    /**
     * Age after which a memory is stale. 90 days by default.
     */
    @Builder.Default
    double maxAgeHours = 2160;
    @Builder.Default
    double relevanceThreshold = 0.3;
    @Builder.Default
    double recallTargetPercent = 95;
}

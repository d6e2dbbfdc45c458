package com.phonepe.agentrecall.core.freshness;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class StalenessMetrics {
    /**
     * 0 for brand new, 1 once the SLO maximum age is reached
     */
    double stalenessScore;
    boolean stale;
    double ageDays;
    double ageHours;
    /**
     * Set only for stale memories
     */
    String staleReason;
    /**
     * Negative once stale
     */
    double timeUntilStaleHours;
}

package com.phonepe.agentrecall.core.drift;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Topic coherence of a set of memories. All scores are in [0,1].
 */
@Value
@Builder
@Jacksonized
public class DriftMetrics {
    /**
     * Higher means more drift
     */
    double driftScore;
    boolean driftDetected;
    int topicChanges;
    /**
     * Higher means more coherent
     */
    double coherenceScore;
    /**
     * Share of tagged memories sharing no tag with any other memory
     */
    double fragmentationScore;
    Instant lastCheckedAt;
}

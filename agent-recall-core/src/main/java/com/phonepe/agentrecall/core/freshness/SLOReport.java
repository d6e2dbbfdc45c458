package com.phonepe.agentrecall.core.freshness;

import com.phonepe.agentrecall.core.recall.RecallFailureReason;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of recall quality over a reporting period
 */
@Value
@Builder
@Jacksonized
public class SLOReport {
    String reportId;
    Instant periodStart;
    Instant periodEnd;
    int totalQueries;
    /**
     * Queries with at least one result that is not stale
     */
    int freshQueries;
    /**
     * Queries with at least one result meeting the relevance threshold
     */
    int relevantQueries;
    int successfulRecalls;
    int crossSessionAttempts;
    int crossSessionSuccesses;
    int totalFailures;
    @Singular("failureCount")
    Map<RecallFailureReason, Integer> failuresByReason;
    double avgStalenessScore;
    Double avgDriftScore;
    @Singular("namespaceCompliance")
    List<SLOComplianceStatus> namespaceCompliance;
    Instant generatedAt;
}

package com.phonepe.agentrecall.core.freshness;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Compliance of one namespace against its SLO configuration
 */
@Value
@Builder
@Jacksonized
public class SLOComplianceStatus {
    String namespaceKey;
    boolean compliant;
    double freshnessCompliancePercent;
    double relevanceCompliancePercent;
    double recallCompliancePercent;
    double crossSessionSuccessPercent;
    int failureCount;
    Instant evaluatedAt;
    SLOConfig sloConfig;
    @Singular
    List<SLOViolation> violations;
}

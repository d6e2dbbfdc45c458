package com.phonepe.agentrecall.core.freshness;

import lombok.Value;

import java.util.List;

/**
 * Outcome of checking a batch of results against one SLO
 */
@Value
public class ComplianceEvaluation {
    int compliant;
    int total;
    /**
     * Only meaningful for freshness
     */
    double averageStaleness;
    List<SLOViolation> violations;

    public double compliancePercent() {
        return total == 0 ? 100.0 : (compliant * 100.0) / total;
    }
}

package com.phonepe.agentrecall.core.freshness;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SLOViolation {
    SLOType sloType;
    double actualValue;
    double requiredValue;
    ViolationSeverity severity;
    String description;
}

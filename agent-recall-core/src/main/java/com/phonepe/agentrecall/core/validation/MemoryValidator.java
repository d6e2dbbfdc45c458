package com.phonepe.agentrecall.core.validation;

/**
 * Decides at creation time whether content is accepted, and whether it should be quarantined
 */
@FunctionalInterface
public interface MemoryValidator {
    MemoryValidationResult validate(MemoryValidationInput input);
}

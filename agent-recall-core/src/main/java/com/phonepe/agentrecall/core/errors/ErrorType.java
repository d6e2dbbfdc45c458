package com.phonepe.agentrecall.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kinds of failure raised by memory lifecycle operations
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    NOT_FOUND("Not found: %s", false),
    ALREADY_IN_STATE("Already in requested state: %s", false),
    INVALID_TRANSITION("Invalid lifecycle transition: %s", false),
    VALIDATION_REJECTED("Memory entry rejected by validation: %s", false),
    VERSION_NOT_FOUND("Version not found: %s", false),
    NAMESPACE_MISMATCH("Namespace mismatch: %s", false),
    INVALID_ARGUMENT("Invalid argument: %s", false),
    PARTIAL_FAILURE("Operation partially applied: %s", true),
    ;

    private final String message;
    private final boolean retryable;
}

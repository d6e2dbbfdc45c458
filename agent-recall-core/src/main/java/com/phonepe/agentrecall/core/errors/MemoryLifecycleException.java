package com.phonepe.agentrecall.core.errors;

import lombok.Getter;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Raised synchronously by lifecycle operations. Nothing at this layer retries.
 */
@Getter
public class MemoryLifecycleException extends RuntimeException {
    private final ErrorType errorType;
    private final String memoryId;

    public MemoryLifecycleException(ErrorType errorType, String memoryId, String detail) {
        this(errorType, memoryId, detail, null);
    }

    public MemoryLifecycleException(ErrorType errorType, String memoryId, String detail, Throwable cause) {
        super(errorType.getMessage().formatted(detail), cause);
        this.errorType = errorType;
        this.memoryId = memoryId;
    }

    public static MemoryLifecycleException notFound(String memoryId) {
        return new MemoryLifecycleException(ErrorType.NOT_FOUND, memoryId, "Memory %s not found".formatted(memoryId));
    }

    public static MemoryLifecycleException quarantinedNotFound(String memoryId) {
        return new MemoryLifecycleException(ErrorType.NOT_FOUND,
                                            memoryId,
                                            "Quarantined memory %s not found".formatted(memoryId));
    }

    public static MemoryLifecycleException alreadyDeleted(String memoryId) {
        return new MemoryLifecycleException(ErrorType.ALREADY_IN_STATE,
                                            memoryId,
                                            "Memory %s is already deleted".formatted(memoryId));
    }

    public static MemoryLifecycleException alreadyQuarantined(String memoryId) {
        return new MemoryLifecycleException(ErrorType.ALREADY_IN_STATE,
                                            memoryId,
                                            "Memory %s is already quarantined".formatted(memoryId));
    }

    public static MemoryLifecycleException deletedMemory(String operation, String memoryId) {
        return new MemoryLifecycleException(ErrorType.INVALID_TRANSITION,
                                            memoryId,
                                            "Cannot %s deleted memory %s".formatted(operation, memoryId));
    }

    public static MemoryLifecycleException rejected(String reason) {
        return new MemoryLifecycleException(ErrorType.VALIDATION_REJECTED, null, reason);
    }

    public static MemoryLifecycleException noHistory(String memoryId) {
        return new MemoryLifecycleException(ErrorType.VERSION_NOT_FOUND,
                                            memoryId,
                                            "Memory %s has no previous versions to rollback to".formatted(memoryId));
    }

    public static MemoryLifecycleException versionNotFound(String memoryId, int version, Collection<Integer> available) {
        return new MemoryLifecycleException(ErrorType.VERSION_NOT_FOUND,
                                            memoryId,
                                            "Version %d not found for memory %s. Available versions: %s"
                                                    .formatted(version,
                                                               memoryId,
                                                               available.stream()
                                                                       .map(String::valueOf)
                                                                       .collect(Collectors.joining(", "))));
    }

    public static MemoryLifecycleException namespaceMismatch(String memoryId) {
        return new MemoryLifecycleException(ErrorType.NAMESPACE_MISMATCH,
                                            memoryId,
                                            "All memories must be in the same namespace to merge. Offending memory: %s"
                                                    .formatted(memoryId));
    }

    public static MemoryLifecycleException invalidArgument(String memoryId, String detail) {
        return new MemoryLifecycleException(ErrorType.INVALID_ARGUMENT, memoryId, detail);
    }
}

package com.phonepe.agentrecall.core.store;

import lombok.Getter;

/**
 * Raised by {@link MemoryStore} implementations when the backend cannot serve a request
 */
@Getter
public class MemoryStoreException extends RuntimeException {
    private final StoreErrorCode errorCode;

    public MemoryStoreException(StoreErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MemoryStoreException(StoreErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}

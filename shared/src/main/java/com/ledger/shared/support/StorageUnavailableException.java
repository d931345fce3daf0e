package com.ledger.shared.support;

/**
 * Transient infrastructure failure (store unreachable, connection reset).
 * Retryable with backoff; the caller owns the retry policy.
 */
public class StorageUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

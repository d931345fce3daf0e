package com.ledger.shared.eventstore;

import lombok.Getter;

/**
 * Optimistic concurrency failure: the aggregate's persisted version moved past the version the
 * writer loaded. Nothing was appended. Retryable after reloading the aggregate.
 */
@Getter
public class ConcurrencyConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion) {
        super(String.format("Concurrency conflict on %s: expected version %d, but current version is %d",
                aggregateId, expectedVersion, actualVersion));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}

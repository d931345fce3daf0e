package com.ledger.shared.eventstore;

import java.time.Instant;

/**
 * Cached fold result of an aggregate at {@code version}.
 *
 * Never authoritative: the events after {@code version} must always be read and applied on top.
 */
public record Snapshot<S>(String aggregateId, long version, S state, Instant createdAt) {
}

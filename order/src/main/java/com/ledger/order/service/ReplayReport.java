package com.ledger.order.service;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one replay pass. A non-empty failure list means the rebuilt read models are
 * partial: the listed events were skipped.
 *
 * @param scope     what was replayed: "all", "from:{timestamp}" or "aggregate:{id}"
 * @param total     records read from the event store, undecodable ones included
 * @param succeeded events the projection accepted
 */
public record ReplayReport(String scope, int total, int succeeded, List<Failure> failures, Duration elapsed) {

    public record Failure(String eventId, String aggregateId, String eventType, long version, String message) {
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}

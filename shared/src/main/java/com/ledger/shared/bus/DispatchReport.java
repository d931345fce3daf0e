package com.ledger.shared.bus;

import java.util.List;

/**
 * Outcome of one consumer cycle of the event bus.
 *
 * @param delivered number of channel entries consumed (cursor advanced past them)
 * @param failures  one entry per failed handler invocation or undecodable entry
 * @param skipped   true when the cycle did not run because read models are being rebuilt
 */
public record DispatchReport(int delivered, List<Failure> failures, boolean skipped) {

    public record Failure(long position, String eventId, String eventType, String handler, String message) {
    }

    public static DispatchReport skippedCycle() {
        return new DispatchReport(0, List.of(), true);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}

package com.ledger.shared.eventstore;

import com.ledger.shared.events.DomainEvent;

import java.util.List;

/**
 * Result of reading the global history: the decoded events in replay order, plus every stored
 * record that could not be decoded. A corrupt record never hides the rest of the history.
 */
public record EventHistory<E extends DomainEvent>(List<StoredEvent<E>> events, List<UnreadableRecord> unreadable) {

    /**
     * A stored record that failed to decode. Versions are contiguous from 1, so the record at
     * stream position p holds version p + 1.
     */
    public record UnreadableRecord(String aggregateId, long version, String message) {
    }

    public int size() {
        return events.size() + unreadable.size();
    }

    public boolean isClean() {
        return unreadable.isEmpty();
    }
}

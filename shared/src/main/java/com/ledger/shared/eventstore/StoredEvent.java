package com.ledger.shared.eventstore;

import com.ledger.shared.events.DomainEvent;

/**
 * Persisted envelope: the domain event plus the stream it was appended to.
 * Immutable — the store never rewrites or deletes a stored event.
 */
public record StoredEvent<E extends DomainEvent>(String streamName, E event) {

    public String eventId() {
        return event.eventId();
    }

    public String aggregateId() {
        return event.aggregateId();
    }

    public String eventType() {
        return event.eventType();
    }

    public long version() {
        return event.version();
    }
}

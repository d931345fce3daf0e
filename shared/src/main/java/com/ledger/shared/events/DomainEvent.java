package com.ledger.shared.events;

import java.time.Instant;

/**
 * Base contract for every domain event.
 *
 * An event is an immutable fact about one aggregate. Every event carries:
 *  - eventId:     Globally unique event identifier (UUID v4)
 *  - aggregateId: The aggregate whose history this event belongs to
 *  - eventType:   Canonical type name (use EventTypes constants)
 *  - version:     Position in the aggregate's history, contiguous and starting at 1
 *  - occurredOn:  When the fact happened
 */
public interface DomainEvent {

    String eventId();

    String aggregateId();

    String eventType();

    long version();

    Instant occurredOn();
}

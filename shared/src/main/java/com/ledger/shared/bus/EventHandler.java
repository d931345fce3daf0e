package com.ledger.shared.bus;

import com.ledger.shared.events.DomainEvent;

/**
 * Receives events delivered by the {@link EventBus}.
 *
 * Delivery is at-least-once: an event may be handed over again after a crash or a failed
 * cursor advance, so implementations must tolerate re-delivery.
 */
@FunctionalInterface
public interface EventHandler<E extends DomainEvent> {

    void handle(E event) throws Exception;

    default String name() {
        return getClass().getSimpleName();
    }
}

package com.ledger.order.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ledger.shared.events.DomainEvent;
import com.ledger.shared.events.EventTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Order domain events: immutable facts, persisted as-is in the event store.
 *
 * The JSON form carries the event type name as {@code eventType}, which is also the key
 * the event bus routes on.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "eventType")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OrderEvent.OrderCreated.class, name = EventTypes.ORDER_CREATED),
        @JsonSubTypes.Type(value = OrderEvent.OrderStatusChanged.class, name = EventTypes.ORDER_STATUS_CHANGED),
        @JsonSubTypes.Type(value = OrderEvent.OrderCancelled.class, name = EventTypes.ORDER_CANCELLED),
        @JsonSubTypes.Type(value = OrderEvent.OrderDeleted.class, name = EventTypes.ORDER_DELETED)
})
public sealed interface OrderEvent extends DomainEvent {

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive handling of every event variant; adding a variant breaks every visitor at compile time.
     */
    interface Visitor<R> {
        R visit(OrderCreated event);

        R visit(OrderStatusChanged event);

        R visit(OrderCancelled event);

        R visit(OrderDeleted event);
    }

    record OrderCreated(String eventId, String aggregateId, long version, Instant occurredOn,
                        String customerName, String customerEmail, List<OrderItem> items,
                        BigDecimal totalAmount, Instant orderDate) implements OrderEvent {

        @Override
        public String eventType() {
            return EventTypes.ORDER_CREATED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record OrderStatusChanged(String eventId, String aggregateId, long version, Instant occurredOn,
                              OrderStatus previousStatus, OrderStatus newStatus, Instant changedAt)
            implements OrderEvent {

        @Override
        public String eventType() {
            return EventTypes.ORDER_STATUS_CHANGED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record OrderCancelled(String eventId, String aggregateId, long version, Instant occurredOn,
                          String reason, Instant cancelledAt) implements OrderEvent {

        @Override
        public String eventType() {
            return EventTypes.ORDER_CANCELLED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record OrderDeleted(String eventId, String aggregateId, long version, Instant occurredOn,
                        Instant deletedAt) implements OrderEvent {

        @Override
        public String eventType() {
            return EventTypes.ORDER_DELETED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}

package com.ledger.order.projection;

import com.ledger.order.domain.OrderEvent;
import com.ledger.order.domain.OrderEvent.OrderCancelled;
import com.ledger.order.domain.OrderEvent.OrderCreated;
import com.ledger.order.domain.OrderEvent.OrderDeleted;
import com.ledger.order.domain.OrderEvent.OrderStatusChanged;
import com.ledger.order.domain.OrderStatus;
import com.ledger.order.readmodel.CustomerInfo;
import com.ledger.order.readmodel.OrderView;
import com.ledger.order.readmodel.OrderViewStore;
import com.ledger.order.readmodel.StatusHistoryEntry;
import com.ledger.shared.bus.EventHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Order Projection — folds order events into the per-order views and the summary.
 *
 * Receives events from the event bus (live) and from the replay service (rebuild).
 * Idempotent under re-delivery: an event whose version is at or below the view's
 * lastEventVersion has already been applied and is skipped.
 *
 * A status event for an order without a view is logged and skipped, never retried:
 * the event store is authoritative, the read side is best-effort.
 */
@Slf4j
public class OrderProjectionHandler implements EventHandler<OrderEvent> {

    private final OrderViewStore store;
    private final OrderSummaryCalculator summaryCalculator;
    private final Clock clock;

    public OrderProjectionHandler(OrderViewStore store, OrderSummaryCalculator summaryCalculator, Clock clock) {
        this.store = store;
        this.summaryCalculator = summaryCalculator;
        this.clock = clock;
    }

    @Override
    public void handle(OrderEvent event) {
        boolean mutated = event.accept(projector);
        if (mutated) {
            refreshSummary();
        }
    }

    @Override
    public String name() {
        return "order-projection";
    }

    /**
     * Recompute the summary from a full scan of the current per-order views.
     */
    public void refreshSummary() {
        store.saveSummary(summaryCalculator.calculate(store.findAll(), Instant.now(clock)));
    }

    // Each visit returns true when the read model changed.
    private final OrderEvent.Visitor<Boolean> projector = new OrderEvent.Visitor<>() {

        @Override
        public Boolean visit(OrderCreated event) {
            Optional<OrderView> existing = store.findById(event.aggregateId());
            if (existing.isPresent() && existing.get().getLastEventVersion() >= event.version()) {
                log.debug("Duplicate event skipped: eventId={}, orderId={}", event.eventId(), event.aggregateId());
                return false;
            }

            store.save(OrderView.builder()
                    .orderId(event.aggregateId())
                    .customerName(event.customerName())
                    .customerEmail(event.customerEmail())
                    .items(event.items())
                    .totalAmount(event.totalAmount())
                    .status(OrderStatus.PENDING)
                    .orderDate(event.orderDate())
                    .updatedAt(event.occurredOn())
                    .statusHistory(List.of(new StatusHistoryEntry(OrderStatus.PENDING, event.occurredOn())))
                    .customerInfo(new CustomerInfo(event.customerName(), event.customerEmail()))
                    .lastEventVersion(event.version())
                    .build());
            log.debug("Order view created: orderId={}", event.aggregateId());
            return true;
        }

        @Override
        public Boolean visit(OrderStatusChanged event) {
            return recordStatus(event, event.newStatus(), event.changedAt());
        }

        @Override
        public Boolean visit(OrderCancelled event) {
            return recordStatus(event, OrderStatus.CANCELLED, event.cancelledAt());
        }

        @Override
        public Boolean visit(OrderDeleted event) {
            Optional<OrderView> existing = store.findById(event.aggregateId());
            if (existing.isEmpty()) {
                log.debug("Order view already absent: orderId={}", event.aggregateId());
                return false;
            }
            store.deleteById(event.aggregateId());
            log.debug("Order view removed: orderId={}", event.aggregateId());
            return true;
        }
    };

    private boolean recordStatus(OrderEvent event, OrderStatus newStatus, Instant changedAt) {
        Optional<OrderView> existing = store.findById(event.aggregateId());
        if (existing.isEmpty()) {
            log.warn("Order view not found, event skipped: eventId={}, type={}, orderId={}",
                    event.eventId(), event.eventType(), event.aggregateId());
            return false;
        }

        OrderView view = existing.get();
        if (view.getLastEventVersion() >= event.version()) {
            log.debug("Duplicate event skipped: eventId={}, orderId={}", event.eventId(), event.aggregateId());
            return false;
        }

        view.recordStatus(newStatus, changedAt, event.version());
        store.save(view);
        log.debug("Order view status updated: orderId={}, status={}", event.aggregateId(), newStatus.wireName());
        return true;
    }
}

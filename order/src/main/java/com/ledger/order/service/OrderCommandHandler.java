package com.ledger.order.service;

import com.ledger.order.domain.OrderAggregate;
import com.ledger.order.domain.OrderCommand;
import com.ledger.order.domain.OrderEvent;
import com.ledger.order.domain.OrderState;
import com.ledger.order.exception.OrderException;
import com.ledger.shared.bus.EventBus;
import com.ledger.shared.eventstore.ConcurrencyConflictException;
import com.ledger.shared.eventstore.EventStore;
import com.ledger.shared.eventstore.Snapshot;
import com.ledger.shared.eventstore.StoredEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Order Command Handler — write side.
 *
 * Flow per command:
 *  1. Create a fresh aggregate (create) or load it: latest snapshot + events after it
 *  2. Invoke the aggregate operation, which records exactly one event or throws
 *  3. Append the pending events, expecting the version the aggregate was loaded at
 *  4. Publish them on the event bus
 *  5. Mark them committed
 *
 * A failed append (validation, conflict, timeout) publishes nothing. On
 * ConcurrencyConflictException the caller reloads and retries; nothing is retried here.
 * Read models catch up asynchronously through the bus.
 */
@Slf4j
public class OrderCommandHandler {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final EventStore<OrderEvent> eventStore;
    private final EventBus<OrderEvent> eventBus;
    private final MeterRegistry meterRegistry;
    private final Counter conflictCounter;

    public OrderCommandHandler(EventStore<OrderEvent> eventStore, EventBus<OrderEvent> eventBus,
                               MeterRegistry meterRegistry) {
        this.eventStore = eventStore;
        this.eventBus = eventBus;
        this.meterRegistry = meterRegistry;
        this.conflictCounter = Counter.builder("orders.concurrency.conflicts")
                .description("Commands rejected because the order changed since it was loaded")
                .register(meterRegistry);
    }

    // ─── Commands ─────────────────────────────────────────────────────────────

    /**
     * @return the id of the new order
     */
    public String handle(OrderCommand.CreateOrder cmd) {
        return measured("create", () -> {
            validate(cmd);
            String orderId = "ord_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
            OrderAggregate aggregate = new OrderAggregate(orderId);
            aggregate.createOrder(cmd);
            commit(aggregate);

            log.info("Order created: orderId={}, customerEmail={}, items={}, totalAmount={}",
                    orderId, cmd.customerEmail(), aggregate.getItems().size(), aggregate.getTotalAmount());
            return orderId;
        });
    }

    public void handle(OrderCommand.ChangeStatus cmd) {
        measured("change_status", () -> {
            OrderAggregate aggregate = loadAggregate(cmd.orderId());
            String previous = aggregate.getStatus().wireName();
            aggregate.changeStatus(cmd);
            commit(aggregate);

            log.info("Order status changed: orderId={}, from={}, to={}, version={}",
                    cmd.orderId(), previous, cmd.newStatus().wireName(), aggregate.getVersion());
            return null;
        });
    }

    public void handle(OrderCommand.Cancel cmd) {
        measured("cancel", () -> {
            OrderAggregate aggregate = loadAggregate(cmd.orderId());
            aggregate.cancelOrder(cmd);
            commit(aggregate);

            log.info("Order cancelled: orderId={}, reason={}, version={}",
                    cmd.orderId(), cmd.reason(), aggregate.getVersion());
            return null;
        });
    }

    public void handle(OrderCommand.Delete cmd) {
        measured("delete", () -> {
            OrderAggregate aggregate = loadAggregate(cmd.orderId());
            aggregate.deleteOrder(cmd);
            commit(aggregate);

            log.info("Order deleted: orderId={}, version={}", cmd.orderId(), aggregate.getVersion());
            return null;
        });
    }

    // ─── Load / Commit ────────────────────────────────────────────────────────

    /**
     * Rehydrate an order from its latest snapshot (if any) and the events recorded after it.
     *
     * @throws OrderException NOT_FOUND when the order has no events at all
     */
    public OrderAggregate loadAggregate(String orderId) {
        Optional<Snapshot<OrderState>> snapshot = eventStore.getLatestSnapshot(orderId, OrderState.class);
        long fromVersion = snapshot.map(Snapshot::version).orElse(0L);
        List<OrderEvent> tail = eventStore.getEvents(orderId, fromVersion).stream()
                .map(StoredEvent::event)
                .toList();

        if (snapshot.isEmpty() && tail.isEmpty()) {
            throw OrderException.notFound(orderId);
        }
        return OrderAggregate.fromEvents(orderId, tail, snapshot.map(Snapshot::state).orElse(null));
    }

    private void commit(OrderAggregate aggregate) {
        List<OrderEvent> pending = aggregate.getUncommittedEvents();
        if (pending.isEmpty()) {
            return;
        }
        eventStore.saveEvents(aggregate.getId(), pending, aggregate.getCommittedVersion());
        try {
            eventBus.publishEvents(pending);
        } catch (RuntimeException e) {
            // Appended but not distributed: read models miss these events until the next replay.
            log.error("Events appended but not published: orderId={}, version={}",
                    aggregate.getId(), aggregate.getVersion(), e);
            throw e;
        }
        aggregate.markEventsAsCommitted();
    }

    // ─── Validation ───────────────────────────────────────────────────────────

    private static void validate(OrderCommand.CreateOrder cmd) {
        String name = cmd.customerName() == null ? "" : cmd.customerName().trim();
        if (name.length() < 2 || name.length() > 100) {
            throw OrderException.validation("customerName must be between 2 and 100 characters");
        }
        if (cmd.customerEmail() == null || !EMAIL.matcher(cmd.customerEmail()).matches()) {
            throw OrderException.validation("customerEmail must be a valid email address");
        }
        for (OrderCommand.Line line : cmd.items()) {
            if (isBlank(line.productId()) || isBlank(line.productName())) {
                throw OrderException.validation("Every item needs a productId and a productName");
            }
            if (line.quantity() < 1) {
                throw OrderException.validation("Item quantity must be at least 1: " + line.productId());
            }
            if (line.price() == null || line.price().compareTo(BigDecimal.ZERO) < 0) {
                throw OrderException.validation("Item price must be zero or more: " + line.productId());
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ─── Metrics ──────────────────────────────────────────────────────────────

    private <T> T measured(String type, Supplier<T> action) {
        try {
            T result = action.get();
            count(type, "success");
            return result;
        } catch (OrderException e) {
            count(type, "rejected");
            throw e;
        } catch (ConcurrencyConflictException e) {
            conflictCounter.increment();
            count(type, "conflict");
            throw e;
        } catch (RuntimeException e) {
            count(type, "error");
            throw e;
        }
    }

    private void count(String type, String outcome) {
        Counter.builder("orders.commands")
                .tag("type", type)
                .tag("outcome", outcome)
                .description("Order commands handled")
                .register(meterRegistry)
                .increment();
    }
}

package com.ledger.order.domain;

import com.ledger.order.domain.OrderEvent.OrderCancelled;
import com.ledger.order.domain.OrderEvent.OrderCreated;
import com.ledger.order.domain.OrderEvent.OrderDeleted;
import com.ledger.order.domain.OrderEvent.OrderStatusChanged;
import com.ledger.order.exception.ErrorCode;
import com.ledger.order.exception.OrderException;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Order Aggregate — converts commands into events and folds events into state.
 *
 * Every command operation either records exactly one event (applied immediately and buffered
 * in uncommittedEvents) or throws {@link OrderException} leaving the aggregate untouched.
 * State is never assigned directly: the only mutation path is {@link #apply}, used both for
 * live commands and for rebuilding from history, so the transition rules hold in both.
 *
 * Not thread-safe. One instance belongs to one command for its duration.
 */
@Getter
public class OrderAggregate {

    private final String id;
    private long version;
    private OrderStatus status = OrderStatus.PENDING;
    private String customerName;
    private String customerEmail;
    private List<OrderItem> items = List.of();
    private BigDecimal totalAmount = BigDecimal.ZERO;
    private Instant orderDate;
    private boolean deleted;

    @Getter(AccessLevel.NONE)
    private final List<OrderEvent> uncommittedEvents = new ArrayList<>();

    public OrderAggregate(String id) {
        this.id = id;
    }

    // ─── Rehydration ──────────────────────────────────────────────────────────

    /**
     * Fold events (any order; applied by ascending version) onto a blank aggregate.
     */
    public static OrderAggregate fromEvents(String id, List<? extends OrderEvent> events) {
        return fromEvents(id, events, null);
    }

    /**
     * Fold events onto a snapshot state, or onto a blank aggregate when {@code snapshot} is null.
     * Events at or below the snapshot version are ignored.
     */
    public static OrderAggregate fromEvents(String id, List<? extends OrderEvent> events, OrderState snapshot) {
        OrderAggregate aggregate = new OrderAggregate(id);
        if (snapshot != null) {
            aggregate.restore(snapshot);
        }
        long baseVersion = aggregate.version;
        events.stream()
                .filter(event -> event.version() > baseVersion)
                .sorted(Comparator.comparingLong(OrderEvent::version))
                .forEach(aggregate::apply);
        return aggregate;
    }

    public OrderState toState() {
        return new OrderState(id, version, status, customerName, customerEmail, items, totalAmount, orderDate, deleted);
    }

    private void restore(OrderState state) {
        if (!id.equals(state.id())) {
            throw OrderException.idMismatch(id, state.id());
        }
        this.version = state.version();
        this.status = state.status();
        this.customerName = state.customerName();
        this.customerEmail = state.customerEmail();
        this.items = state.items() == null ? List.of() : List.copyOf(state.items());
        this.totalAmount = state.totalAmount() == null ? BigDecimal.ZERO : state.totalAmount();
        this.orderDate = state.orderDate();
        this.deleted = state.deleted();
    }

    // ─── Commands ─────────────────────────────────────────────────────────────

    public void createOrder(OrderCommand.CreateOrder cmd) {
        if (version > 0) {
            throw new OrderException(ErrorCode.ALREADY_EXISTS, "Order already exists: " + id);
        }
        if (cmd.items() == null || cmd.items().isEmpty()) {
            throw new OrderException(ErrorCode.EMPTY_ORDER, "Order must contain at least one item");
        }

        List<OrderItem> priced = cmd.items().stream()
                .map(line -> OrderItem.of(line.productId(), line.productName(), line.quantity(), line.price()))
                .toList();
        BigDecimal total = priced.stream()
                .map(OrderItem::subtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        raise(new OrderCreated(newEventId(), id, version + 1, cmd.issuedAt(),
                cmd.customerName(), cmd.customerEmail(), priced, total, cmd.issuedAt()));
    }

    public void changeStatus(OrderCommand.ChangeStatus cmd) {
        if (deleted) {
            throw new OrderException(ErrorCode.DELETED, "Cannot change status of deleted order " + id);
        }
        requireSameId(cmd.orderId());
        if (cmd.newStatus() == null) {
            throw OrderException.validation("New status is required");
        }
        if (!status.canTransitionTo(cmd.newStatus())) {
            throw OrderException.invalidTransition(status, cmd.newStatus());
        }

        raise(new OrderStatusChanged(newEventId(), id, version + 1, cmd.issuedAt(),
                status, cmd.newStatus(), cmd.issuedAt()));
    }

    public void cancelOrder(OrderCommand.Cancel cmd) {
        if (deleted) {
            throw new OrderException(ErrorCode.DELETED, "Cannot cancel deleted order " + id);
        }
        requireSameId(cmd.orderId());
        if (status == OrderStatus.DELIVERED) {
            throw new OrderException(ErrorCode.INVALID_TRANSITION, "Cannot cancel delivered order " + id);
        }

        raise(new OrderCancelled(newEventId(), id, version + 1, cmd.issuedAt(), cmd.reason(), cmd.issuedAt()));
    }

    public void deleteOrder(OrderCommand.Delete cmd) {
        if (deleted) {
            throw new OrderException(ErrorCode.ALREADY_DELETED, "Order already deleted: " + id);
        }
        requireSameId(cmd.orderId());
        if (!status.isDeletable()) {
            throw new OrderException(ErrorCode.INVALID_STATE,
                    "Only pending or cancelled orders can be deleted; order " + id + " is " + status.wireName());
        }

        raise(new OrderDeleted(newEventId(), id, version + 1, cmd.issuedAt(), cmd.issuedAt()));
    }

    // ─── Uncommitted Events ───────────────────────────────────────────────────

    public List<OrderEvent> getUncommittedEvents() {
        return List.copyOf(uncommittedEvents);
    }

    /** Version persisted before this instance's pending events. */
    public long getCommittedVersion() {
        return version - uncommittedEvents.size();
    }

    /**
     * Clear the pending-event buffer. Only after the events were both appended and published.
     */
    public void markEventsAsCommitted() {
        uncommittedEvents.clear();
    }

    // ─── Event Application ────────────────────────────────────────────────────

    private void raise(OrderEvent event) {
        apply(event);
        uncommittedEvents.add(event);
    }

    private void apply(OrderEvent event) {
        if (event.version() != version + 1) {
            throw new IllegalStateException(String.format(
                    "Event %s for order %s has version %d, expected %d", event.eventId(), id, event.version(), version + 1));
        }
        if (deleted) {
            throw new IllegalStateException("Event " + event.eventId() + " recorded after deletion of order " + id);
        }
        event.accept(stateMutator);
        version = event.version();
    }

    @Getter(AccessLevel.NONE)
    private final OrderEvent.Visitor<Void> stateMutator = new OrderEvent.Visitor<>() {

        @Override
        public Void visit(OrderCreated event) {
            if (version != 0) {
                throw new OrderException(ErrorCode.ALREADY_EXISTS, "Order already exists: " + id);
            }
            customerName = event.customerName();
            customerEmail = event.customerEmail();
            items = List.copyOf(event.items());
            totalAmount = event.totalAmount();
            orderDate = event.orderDate();
            status = OrderStatus.PENDING;
            return null;
        }

        @Override
        public Void visit(OrderStatusChanged event) {
            if (!status.canTransitionTo(event.newStatus())) {
                throw OrderException.invalidTransition(status, event.newStatus());
            }
            status = event.newStatus();
            return null;
        }

        @Override
        public Void visit(OrderCancelled event) {
            status = OrderStatus.CANCELLED;
            return null;
        }

        @Override
        public Void visit(OrderDeleted event) {
            deleted = true;
            return null;
        }
    };

    private void requireSameId(String orderId) {
        if (!id.equals(orderId)) {
            throw OrderException.idMismatch(id, orderId);
        }
    }

    private static String newEventId() {
        return UUID.randomUUID().toString();
    }
}

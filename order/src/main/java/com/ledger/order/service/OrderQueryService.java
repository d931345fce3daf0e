package com.ledger.order.service;

import com.ledger.order.domain.OrderEvent;
import com.ledger.order.domain.OrderStatus;
import com.ledger.order.exception.OrderException;
import com.ledger.order.readmodel.CustomerRanking;
import com.ledger.order.readmodel.OrderPage;
import com.ledger.order.readmodel.OrderQuery;
import com.ledger.order.readmodel.OrderSummaryView;
import com.ledger.order.readmodel.OrderView;
import com.ledger.order.readmodel.OrderViewStore;
import com.ledger.shared.eventstore.EventStore;
import com.ledger.shared.eventstore.StoredEvent;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Order Query Service — read side.
 *
 * Served entirely from the read models, which trail the event store by up to one bus poll
 * interval. The only exception is getOrderEvents, the audit trail, read from the event store.
 */
@RequiredArgsConstructor
public class OrderQueryService {

    static final int DEFAULT_LIMIT = 10;

    private final OrderViewStore viewStore;
    private final EventStore<OrderEvent> eventStore;
    private final Clock clock;

    public OrderView getOrder(String orderId) {
        return viewStore.findById(orderId).orElseThrow(() -> OrderException.notFound(orderId));
    }

    /**
     * Filtered page of orders, newest first. Defaults: limit 10, offset 0.
     */
    public OrderPage listOrders(OrderQuery query) {
        int limit = query.limit() == null ? DEFAULT_LIMIT : query.limit();
        int offset = query.offsetOrZero();
        if (limit < 1 || offset < 0) {
            throw OrderException.validation("limit must be positive and offset must not be negative");
        }
        return viewStore.find(query.toBuilder().limit(limit).offset(offset).build());
    }

    public List<OrderView> getOrdersByStatus(OrderStatus status) {
        return viewStore.find(OrderQuery.builder().status(status).build()).items();
    }

    public List<OrderView> getOrdersByCustomer(String customerEmail) {
        return viewStore.find(OrderQuery.builder().customerEmail(customerEmail).build()).items();
    }

    public List<OrderView> getOrdersByDateRange(Instant fromDate, Instant toDate) {
        if (fromDate.isAfter(toDate)) {
            throw OrderException.validation("fromDate must not be after toDate");
        }
        return viewStore.find(OrderQuery.builder().fromDate(fromDate).toDate(toDate).build()).items();
    }

    /**
     * Orders placed in the given calendar month, UTC.
     */
    public List<OrderView> getOrdersByMonth(int year, int month) {
        if (month < 1 || month > 12) {
            throw OrderException.validation("month must be between 1 and 12");
        }
        YearMonth yearMonth = YearMonth.of(year, month);
        Instant start = yearMonth.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant end = yearMonth.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant()
                .minus(1, ChronoUnit.MICROS);
        return getOrdersByDateRange(start, end);
    }

    /**
     * Case-insensitive substring match on customer name, customer email or any item's product name.
     */
    public List<OrderView> searchOrders(String term) {
        if (term == null || term.isBlank()) {
            throw OrderException.validation("search term must not be blank");
        }
        String needle = term.trim().toLowerCase(Locale.ROOT);
        return viewStore.findAll().stream()
                .filter(view -> contains(view.getCustomerName(), needle)
                        || contains(view.getCustomerEmail(), needle)
                        || view.getItems().stream().anyMatch(item -> contains(item.productName(), needle)))
                .sorted(Comparator.comparing(OrderView::getOrderDate).reversed())
                .toList();
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    public OrderSummaryView getSummary() {
        return viewStore.findSummary().orElseGet(() -> OrderSummaryView.empty(Instant.now(clock)));
    }

    public List<CustomerRanking> getTopCustomers(int limit) {
        List<CustomerRanking> ranking = getSummary().getTopCustomers();
        return ranking.subList(0, Math.max(0, Math.min(limit, ranking.size())));
    }

    public Map<String, BigDecimal> getRevenueByStatus() {
        return getSummary().getRevenueByStatus();
    }

    /**
     * Audit trail: every stored event of an order, in version order.
     *
     * @throws OrderException NOT_FOUND when the order has no events
     */
    public List<StoredEvent<OrderEvent>> getOrderEvents(String orderId) {
        List<StoredEvent<OrderEvent>> events = eventStore.getEvents(orderId);
        if (events.isEmpty()) {
            throw OrderException.notFound(orderId);
        }
        return events;
    }
}

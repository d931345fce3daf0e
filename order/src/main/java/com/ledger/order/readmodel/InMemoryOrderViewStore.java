package com.ledger.order.readmodel;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local read-model store for tests and the {@code memory} profile.
 * Views are copied on the way in and out, so callers never share mutable state with the store.
 */
@Component
@ConditionalOnProperty(name = "ledger.read-model.store", havingValue = "memory")
public class InMemoryOrderViewStore implements OrderViewStore {

    private static final Comparator<OrderView> BY_ORDER_DATE =
            Comparator.comparing(OrderView::getOrderDate).thenComparing(OrderView::getOrderId);

    private final Map<String, OrderView> views = new LinkedHashMap<>();
    private OrderSummaryView summary;

    @Override
    public synchronized void save(OrderView view) {
        views.put(view.getOrderId(), view.copy());
    }

    @Override
    public synchronized Optional<OrderView> findById(String orderId) {
        return Optional.ofNullable(views.get(orderId)).map(OrderView::copy);
    }

    @Override
    public synchronized OrderPage find(OrderQuery query) {
        List<OrderView> matches = views.values().stream()
                .filter(query::matches)
                .sorted(BY_ORDER_DATE.reversed())
                .toList();
        int offset = query.offsetOrZero();
        int limit = query.limit() == null ? matches.size() : query.limit();
        List<OrderView> page = matches.stream()
                .skip(offset)
                .limit(limit)
                .map(OrderView::copy)
                .toList();
        return new OrderPage(page, matches.size(), limit, offset);
    }

    @Override
    public synchronized List<OrderView> findAll() {
        return views.values().stream()
                .sorted(BY_ORDER_DATE)
                .map(OrderView::copy)
                .toList();
    }

    @Override
    public synchronized void deleteById(String orderId) {
        views.remove(orderId);
    }

    @Override
    public synchronized void saveSummary(OrderSummaryView summary) {
        this.summary = summary;
    }

    @Override
    public synchronized Optional<OrderSummaryView> findSummary() {
        return Optional.ofNullable(summary);
    }

    @Override
    public synchronized void deleteAll() {
        views.clear();
        summary = null;
    }
}

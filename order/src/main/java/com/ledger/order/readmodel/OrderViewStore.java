package com.ledger.order.readmodel;

import java.util.List;
import java.util.Optional;

/**
 * Document store for the order read models.
 *
 * Written only by the projection handler and the replay service.
 */
public interface OrderViewStore {

    /** Insert or replace the view keyed by its orderId. */
    void save(OrderView view);

    Optional<OrderView> findById(String orderId);

    /**
     * Views matching the query's filters, newest orderDate first, paginated by limit/offset.
     * {@code total} counts every match, ignoring pagination.
     */
    OrderPage find(OrderQuery query);

    /** Every view, oldest orderDate first. */
    List<OrderView> findAll();

    void deleteById(String orderId);

    void saveSummary(OrderSummaryView summary);

    Optional<OrderSummaryView> findSummary();

    /** Drop every per-order view and the summary. */
    void deleteAll();
}

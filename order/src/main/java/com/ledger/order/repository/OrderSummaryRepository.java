package com.ledger.order.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.ledger.order.readmodel.OrderSummaryView;

/**
 * Single-row table holding the aggregate order summary.
 */
@Repository
public interface OrderSummaryRepository extends JpaRepository<OrderSummaryView, String> {
}

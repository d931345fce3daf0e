package com.ledger.order.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Folded aggregate state at a given version; the snapshot payload.
 */
public record OrderState(String id, long version, OrderStatus status, String customerName, String customerEmail,
                         List<OrderItem> items, BigDecimal totalAmount, Instant orderDate, boolean deleted) {
}

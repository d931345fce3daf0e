package com.ledger.order.readmodel;

import com.ledger.order.domain.OrderStatus;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Filter and pagination for per-order views. Every filter is optional; date and amount
 * bounds are inclusive. A null limit means "all matches".
 */
@Builder(toBuilder = true)
public record OrderQuery(OrderStatus status,
                         String customerEmail,
                         Instant fromDate,
                         Instant toDate,
                         BigDecimal minAmount,
                         BigDecimal maxAmount,
                         Integer limit,
                         Integer offset) {

    public static OrderQuery all() {
        return OrderQuery.builder().build();
    }

    public int offsetOrZero() {
        return offset == null ? 0 : offset;
    }

    public boolean matches(OrderView view) {
        if (status != null && status != view.getStatus()) {
            return false;
        }
        if (customerEmail != null && !customerEmail.equals(view.getCustomerEmail())) {
            return false;
        }
        if (fromDate != null && view.getOrderDate().isBefore(fromDate)) {
            return false;
        }
        if (toDate != null && view.getOrderDate().isAfter(toDate)) {
            return false;
        }
        if (minAmount != null && view.getTotalAmount().compareTo(minAmount) < 0) {
            return false;
        }
        return maxAmount == null || view.getTotalAmount().compareTo(maxAmount) <= 0;
    }
}

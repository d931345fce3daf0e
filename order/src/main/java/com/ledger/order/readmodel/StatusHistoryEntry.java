package com.ledger.order.readmodel;

import com.ledger.order.domain.OrderStatus;

import java.time.Instant;

public record StatusHistoryEntry(OrderStatus status, Instant changedAt) {
}

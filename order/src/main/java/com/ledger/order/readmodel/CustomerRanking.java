package com.ledger.order.readmodel;

import java.math.BigDecimal;

public record CustomerRanking(String customerEmail, String customerName, long orderCount, BigDecimal totalSpent) {
}

package com.ledger.order.readmodel;

import java.math.BigDecimal;

/**
 * Orders placed in one calendar month (UTC). {@code month} is zero-padded, "01".."12".
 */
public record MonthlyBucket(int year, String month, long count, BigDecimal revenue) {
}

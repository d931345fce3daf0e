package com.ledger.order.readmodel;

import java.util.List;

public record OrderPage(List<OrderView> items, long total, int limit, int offset) {
}

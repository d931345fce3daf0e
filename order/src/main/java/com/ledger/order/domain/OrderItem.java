package com.ledger.order.domain;

import java.math.BigDecimal;

/**
 * Order line as recorded in OrderCreated: subtotal is always quantity × price.
 */
public record OrderItem(String productId, String productName, int quantity, BigDecimal price, BigDecimal subtotal) {

    public static OrderItem of(String productId, String productName, int quantity, BigDecimal price) {
        return new OrderItem(productId, productName, quantity, price, price.multiply(BigDecimal.valueOf(quantity)));
    }
}

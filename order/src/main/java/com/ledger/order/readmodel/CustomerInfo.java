package com.ledger.order.readmodel;

public record CustomerInfo(String name, String email) {
}

package com.ledger.order;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Order Ledger — Entry Point
 *
 * Event-sourced order service: Redis event log + event bus, PostgreSQL read models.
 *
 * Port: 8081 (see application.yml)
 */
@SpringBootApplication
public class OrderServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrderServiceApplication.class, args);
    }
}

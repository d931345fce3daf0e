package com.ledger.order.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Commands express intent. They drive the aggregate and are never persisted.
 */
public sealed interface OrderCommand {

    String commandId();

    Instant issuedAt();

    record CreateOrder(String commandId, Instant issuedAt, String customerName, String customerEmail,
                       List<Line> items) implements OrderCommand {

        public static CreateOrder of(String customerName, String customerEmail, List<Line> items) {
            return new CreateOrder(newCommandId(), Instant.now(), customerName, customerEmail,
                    items == null ? List.of() : List.copyOf(items));
        }
    }

    record ChangeStatus(String commandId, Instant issuedAt, String orderId, OrderStatus newStatus)
            implements OrderCommand {

        public static ChangeStatus of(String orderId, OrderStatus newStatus) {
            return new ChangeStatus(newCommandId(), Instant.now(), orderId, newStatus);
        }
    }

    record Cancel(String commandId, Instant issuedAt, String orderId, String reason) implements OrderCommand {

        public static Cancel of(String orderId, String reason) {
            return new Cancel(newCommandId(), Instant.now(), orderId, reason);
        }
    }

    record Delete(String commandId, Instant issuedAt, String orderId) implements OrderCommand {

        public static Delete of(String orderId) {
            return new Delete(newCommandId(), Instant.now(), orderId);
        }
    }

    /** Requested order line, before pricing. */
    record Line(String productId, String productName, int quantity, BigDecimal price) {
    }

    private static String newCommandId() {
        return "cmd-" + UUID.randomUUID();
    }
}

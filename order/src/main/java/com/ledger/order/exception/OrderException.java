package com.ledger.order.exception;

import com.ledger.order.domain.OrderStatus;
import lombok.Getter;

/**
 * Synchronous domain/command failure, returned to the caller that issued the command.
 * Never leaves a partial event behind: the aggregate is unchanged when this is thrown.
 */
@Getter
public class OrderException extends RuntimeException {

    private final ErrorCode code;

    public OrderException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static OrderException validation(String message) {
        return new OrderException(ErrorCode.VALIDATION_ERROR, message);
    }

    public static OrderException notFound(String orderId) {
        return new OrderException(ErrorCode.NOT_FOUND, "Order not found: " + orderId);
    }

    public static OrderException invalidTransition(OrderStatus from, OrderStatus to) {
        return new OrderException(ErrorCode.INVALID_TRANSITION,
                "Invalid status transition from " + from.wireName() + " to " + to.wireName());
    }

    public static OrderException idMismatch(String aggregateId, String requestedId) {
        return new OrderException(ErrorCode.ID_MISMATCH,
                "Order ID mismatch: aggregate " + aggregateId + ", command " + requestedId);
    }
}

package com.ledger.order.exception;

/**
 * Failure taxonomy of the order write and read paths.
 */
public enum ErrorCode {
    VALIDATION_ERROR,
    EMPTY_ORDER,
    NOT_FOUND,
    ID_MISMATCH,
    INVALID_TRANSITION,
    INVALID_STATE,
    ALREADY_EXISTS,
    ALREADY_DELETED,
    DELETED
}

package com.ledger.shared.support;

import lombok.Getter;

import java.time.Duration;

/**
 * A store or bus operation did not complete within its caller-supplied deadline.
 *
 * The outcome of the timed-out operation is unknown: a conditional append may still have
 * been applied. Callers reload before retrying.
 */
@Getter
public class OperationTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(String.format("Operation '%s' exceeded its deadline of %d ms", operation, timeout.toMillis()), cause);
        this.operation = operation;
        this.timeout = timeout;
    }
}

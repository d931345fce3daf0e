package com.ledger.shared.log;

/**
 * Key/counter store for pointers and cursors. Absent keys read as 0.
 */
public interface CounterStore {

    long get(String key);

    /**
     * Set {@code key} to {@code next} if its current value equals {@code expected}.
     *
     * @return true if the value was changed
     */
    boolean compareAndSet(String key, long expected, long next);
}

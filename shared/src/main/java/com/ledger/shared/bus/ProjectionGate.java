package com.ledger.shared.bus;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Exclusive "rebuilding" flag shared by live event delivery and read-model replay.
 *
 * Live delivery cycles enter shared mode and never wait: if a rebuild holds the gate, the
 * cycle is skipped and its entries stay queued in the channel. A rebuild enters exclusive
 * mode and waits for an in-flight delivery cycle to finish first.
 */
public class ProjectionGate {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public boolean tryEnterDelivery() {
        return lock.readLock().tryLock();
    }

    public void exitDelivery() {
        lock.readLock().unlock();
    }

    public <T> T rebuild(Supplier<T> work) {
        lock.writeLock().lock();
        try {
            return work.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isRebuilding() {
        return lock.isWriteLocked();
    }
}

package com.project.image.threshold.service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot mailbox: a new value overwrites any value not yet taken.
 * Producers never wait; the consumer waits at most one poll interval per {@link #take}.
 */
public class ParameterChannel<T> {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition posted = lock.newCondition();

    private T pending;

    /** Stores {@code value}, replacing an unconsumed one. Returns true if a value was replaced. */
    public boolean post(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Value must not be null");
        }
        lock.lock();
        try {
            boolean coalesced = pending != null;
            pending = value;
            posted.signal();
            return coalesced;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code pollInterval} for a value and takes it out of the slot.
     *
     * @return the pending value, or empty if none arrived in time
     */
    public Optional<T> take(Duration pollInterval) throws InterruptedException {
        long nanos = pollInterval.toNanos();
        lock.lock();
        try {
            while (pending == null) {
                if (nanos <= 0L) {
                    return Optional.empty();
                }
                nanos = posted.awaitNanos(nanos);
            }
            T value = pending;
            pending = null;
            return Optional.of(value);
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPending() {
        lock.lock();
        try {
            return pending != null;
        } finally {
            lock.unlock();
        }
    }
}

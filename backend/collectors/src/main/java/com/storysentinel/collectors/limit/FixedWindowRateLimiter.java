package com.storysentinel.collectors.limit;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Fixed-window permit counter with a bounded FIFO wait queue.
 *
 * <p>At most {@code permitLimit} permits are handed out per window. A caller that finds the
 * window exhausted joins the queue and is served, oldest first, when a later window opens. A
 * caller that finds the queue full is rejected immediately. While anyone is queued, new callers
 * queue behind them even if the current window still has permits.
 *
 * <p>No background thread is involved: queued callers wake at the window boundary and roll the
 * window forward themselves.
 */
public final class FixedWindowRateLimiter {
    public enum Permit {
        GRANTED,
        QUEUED_THEN_GRANTED,
        REJECTED;

        public boolean acquired() {
            return this != REJECTED;
        }
    }

    private final int permitLimit;
    private final long windowNanos;
    private final int queueLimit;
    private final LongSupplier nanoTime;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition windowOpened = lock.newCondition();
    private final ArrayDeque<Waiter> queue = new ArrayDeque<>();
    private long windowStart;
    private int permitsUsed;

    public FixedWindowRateLimiter(int permitLimit, Duration window, int queueLimit) {
        this(permitLimit, window, queueLimit, System::nanoTime);
    }

    FixedWindowRateLimiter(int permitLimit, Duration window, int queueLimit, LongSupplier nanoTime) {
        if (permitLimit < 1) {
            throw new IllegalArgumentException("permitLimit must be >= 1");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (queueLimit < 0) {
            throw new IllegalArgumentException("queueLimit must be >= 0");
        }
        this.permitLimit = permitLimit;
        this.windowNanos = window.toNanos();
        this.queueLimit = queueLimit;
        this.nanoTime = nanoTime;
        this.windowStart = nanoTime.getAsLong();
    }

    /**
     * Takes one permit, waiting in the queue when the current window is used up.
     *
     * @throws InterruptedException if interrupted while queued; the caller's place is released
     */
    public Permit acquire() throws InterruptedException {
        lock.lock();
        try {
            roll(nanoTime.getAsLong());
            if (queue.isEmpty() && permitsUsed < permitLimit) {
                permitsUsed++;
                return Permit.GRANTED;
            }
            if (queue.size() >= queueLimit) {
                return Permit.REJECTED;
            }

            Waiter waiter = new Waiter();
            queue.addLast(waiter);
            try {
                while (!waiter.granted) {
                    long untilNextWindow = windowStart + windowNanos - nanoTime.getAsLong();
                    if (untilNextWindow > 0) {
                        windowOpened.awaitNanos(untilNextWindow);
                    }
                    roll(nanoTime.getAsLong());
                }
            } catch (InterruptedException e) {
                if (!waiter.granted) {
                    queue.remove(waiter);
                }
                throw e;
            }
            return Permit.QUEUED_THEN_GRANTED;
        } finally {
            lock.unlock();
        }
    }

    public int queueDepth() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private void roll(long now) {
        long elapsed = now - windowStart;
        if (elapsed < windowNanos) {
            return;
        }
        windowStart += (elapsed / windowNanos) * windowNanos;
        permitsUsed = 0;
        while (permitsUsed < permitLimit && !queue.isEmpty()) {
            queue.pollFirst().granted = true;
            permitsUsed++;
        }
        windowOpened.signalAll();
    }

    private static final class Waiter {
        private boolean granted;
    }
}

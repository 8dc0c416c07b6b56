package com.storysentinel.collectors.limit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FixedWindowRateLimiterTest {
    @Test
    void grantsUpToLimitThenRejectsWithoutQueue() throws Exception {
        AtomicLong now = new AtomicLong();
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(2, Duration.ofSeconds(1), 0, now::get);

        assertEquals(FixedWindowRateLimiter.Permit.GRANTED, limiter.acquire());
        assertEquals(FixedWindowRateLimiter.Permit.GRANTED, limiter.acquire());
        FixedWindowRateLimiter.Permit third = limiter.acquire();
        assertEquals(FixedWindowRateLimiter.Permit.REJECTED, third);
        assertFalse(third.acquired());
    }

    @Test
    void nextWindowRestoresPermits() throws Exception {
        AtomicLong now = new AtomicLong();
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(1, Duration.ofSeconds(1), 0, now::get);

        assertEquals(FixedWindowRateLimiter.Permit.GRANTED, limiter.acquire());
        assertEquals(FixedWindowRateLimiter.Permit.REJECTED, limiter.acquire());

        now.addAndGet(Duration.ofMillis(999).toNanos());
        assertEquals(FixedWindowRateLimiter.Permit.REJECTED, limiter.acquire());

        now.addAndGet(Duration.ofMillis(1).toNanos());
        assertEquals(FixedWindowRateLimiter.Permit.GRANTED, limiter.acquire());

        now.addAndGet(Duration.ofSeconds(5).toNanos());
        assertEquals(FixedWindowRateLimiter.Permit.GRANTED, limiter.acquire());
    }

    @Test
    void queuedCallerIsGrantedWhenWindowOpensAndFullQueueRejects() throws Exception {
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(1, Duration.ofMillis(300), 1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            assertEquals(FixedWindowRateLimiter.Permit.GRANTED, limiter.acquire());

            Future<FixedWindowRateLimiter.Permit> queued = pool.submit(limiter::acquire);
            awaitQueueDepth(limiter, 1);

            assertEquals(FixedWindowRateLimiter.Permit.REJECTED, limiter.acquire());
            assertEquals(FixedWindowRateLimiter.Permit.QUEUED_THEN_GRANTED, queued.get(2, TimeUnit.SECONDS));
            assertEquals(0, limiter.queueDepth());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void queuedCallersAreServedInArrivalOrder() throws Exception {
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(1, Duration.ofMillis(300), 3);
        ExecutorService pool = Executors.newFixedThreadPool(3);
        List<String> order = new CopyOnWriteArrayList<>();
        try {
            assertEquals(FixedWindowRateLimiter.Permit.GRANTED, limiter.acquire());

            Future<?> first = pool.submit(() -> acquireAndRecord(limiter, "first", order));
            awaitQueueDepth(limiter, 1);
            Future<?> second = pool.submit(() -> acquireAndRecord(limiter, "second", order));
            awaitQueueDepth(limiter, 2);
            Future<?> third = pool.submit(() -> acquireAndRecord(limiter, "third", order));
            awaitQueueDepth(limiter, 3);

            first.get(3, TimeUnit.SECONDS);
            second.get(3, TimeUnit.SECONDS);
            third.get(3, TimeUnit.SECONDS);
            assertEquals(List.of("first", "second", "third"), order);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void interruptedWaiterGivesUpItsPlace() throws Exception {
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(1, Duration.ofSeconds(30), 1);
        assertEquals(FixedWindowRateLimiter.Permit.GRANTED, limiter.acquire());

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                limiter.acquire();
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        waiter.start();
        awaitQueueDepth(limiter, 1);

        waiter.interrupt();
        waiter.join(2_000);

        assertFalse(waiter.isAlive());
        assertInstanceOf(InterruptedException.class, failure.get());
        assertEquals(0, limiter.queueDepth());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new FixedWindowRateLimiter(0, Duration.ofSeconds(1), 0));
        assertThrows(IllegalArgumentException.class, () -> new FixedWindowRateLimiter(1, Duration.ZERO, 0));
        assertThrows(IllegalArgumentException.class, () -> new FixedWindowRateLimiter(1, Duration.ofSeconds(1), -1));
    }

    private static void acquireAndRecord(FixedWindowRateLimiter limiter, String name, List<String> order) {
        try {
            assertTrue(limiter.acquire().acquired());
            order.add(name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitQueueDepth(FixedWindowRateLimiter limiter, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (limiter.queueDepth() < expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Queue never reached depth " + expected);
            }
            Thread.sleep(2);
        }
    }
}

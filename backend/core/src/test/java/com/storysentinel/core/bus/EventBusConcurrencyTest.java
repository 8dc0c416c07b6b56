package com.storysentinel.core.bus;

import com.storysentinel.core.events.FanOutPassCompleted;
import com.storysentinel.core.events.RefreshStarted;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusConcurrencyTest {
    @Test
    void passEventsFromManyWorkersReachTypedAndWildcardHandlers() throws Exception {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("No handler should fail in this test", error);
        });
        LongAdder requestsSent = new LongAdder();
        LongAdder seenByWildcard = new LongAdder();
        bus.subscribe(FanOutPassCompleted.class, event -> requestsSent.add(event.requestsSent()));
        bus.subscribeAll(event -> seenByWildcard.increment());

        int workers = 8;
        int passesPerWorker = 250;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                futures.add(executor.submit(() -> {
                    for (int pass = 0; pass < passesPerWorker; pass++) {
                        bus.publish(new FanOutPassCompleted(Instant.now(), 1, pass, 3, 2, 1, 3, 10));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(3L * workers * passesPerWorker, requestsSent.sum());
        assertEquals((long) workers * passesPerWorker, seenByWildcard.sum());
    }

    @Test
    void subscribingWhilePublishingNeitherFailsNorLosesExistingHandlers() throws Exception {
        AtomicInteger handlerErrors = new AtomicInteger();
        EventBus bus = new EventBus((event, error) -> handlerErrors.incrementAndGet());
        AtomicInteger observed = new AtomicInteger();
        bus.subscribe(RefreshStarted.class, event -> observed.incrementAndGet());

        int publishes = 2_000;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Future<?> publisher = executor.submit(() -> {
                start.await();
                for (int cycle = 1; cycle <= publishes; cycle++) {
                    bus.publish(new RefreshStarted(Instant.now(), cycle));
                }
                return null;
            });
            List<Future<?>> subscribers = new ArrayList<>();
            for (int s = 0; s < 3; s++) {
                subscribers.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 100; i++) {
                        bus.subscribeAll(event -> { });
                    }
                    return null;
                }));
            }
            start.countDown();
            publisher.get(10, TimeUnit.SECONDS);
            for (Future<?> future : subscribers) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, handlerErrors.get());
        assertTrue(observed.get() >= publishes);
    }
}

package com.storysentinel.collectors.refresh;

import com.storysentinel.collectors.api.SnapshotStore;
import com.storysentinel.collectors.api.StoryIdSource;
import com.storysentinel.collectors.fanout.FanOutOutcome;
import com.storysentinel.collectors.fanout.FanOutPass;
import com.storysentinel.collectors.retry.RetryController;
import com.storysentinel.collectors.retry.RetryOutcome;
import com.storysentinel.core.bus.EventBus;
import com.storysentinel.core.events.AlertRaised;
import com.storysentinel.core.events.FanOutPassCompleted;
import com.storysentinel.core.events.RefreshCompleted;
import com.storysentinel.core.events.RefreshStarted;
import com.storysentinel.core.model.StorySnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Runs one refresh cycle: read the best-story ids, fetch their details (initial pass plus
 * retries) and publish the result as a brand-new snapshot.
 *
 * <p>Only the id-list fetch and programming errors escape {@link #refresh()}; per-item problems
 * end up as dropped identifiers in the report. A cycle that is interrupted publishes nothing.
 */
public final class BestStoriesRefresher {
    public static final int MAX_BEST_STORIES = 200;

    private static final Logger LOGGER = Logger.getLogger(BestStoriesRefresher.class.getName());

    private final StoryIdSource idSource;
    private final FanOutPass fanOut;
    private final RetryController retryController;
    private final SnapshotStore snapshotStore;
    private final EventBus eventBus;
    private final Clock clock;
    private final AtomicLong cycles = new AtomicLong();

    public BestStoriesRefresher(
            StoryIdSource idSource,
            FanOutPass fanOut,
            RetryController retryController,
            SnapshotStore snapshotStore,
            EventBus eventBus,
            Clock clock
    ) {
        this.idSource = idSource;
        this.fanOut = fanOut;
        this.retryController = retryController;
        this.snapshotStore = snapshotStore;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public RefreshReport refresh() throws InterruptedException {
        long cycle = cycles.incrementAndGet();
        Instant startedAt = clock.instant();
        LOGGER.info(() -> "Refreshing best stories, cycle " + cycle + " at " + startedAt);
        eventBus.publish(new RefreshStarted(startedAt, cycle));

        Set<Integer> ids = firstDistinct(idSource.bestStoryIds());

        AtomicInteger passes = new AtomicInteger();
        AtomicInteger requestsSent = new AtomicInteger();
        FanOutPass observedPass = pending -> {
            Instant passStartedAt = clock.instant();
            FanOutOutcome outcome = fanOut.run(pending);
            requestsSent.addAndGet(outcome.requestsSent());
            eventBus.publish(new FanOutPassCompleted(
                    clock.instant(),
                    cycle,
                    passes.getAndIncrement(),
                    pending.size(),
                    outcome.succeeded().size(),
                    outcome.failed().size(),
                    outcome.requestsSent(),
                    Duration.between(passStartedAt, clock.instant()).toMillis()
            ));
            return outcome;
        };

        RetryOutcome outcome = retryController.retry(observedPass.run(ids), observedPass);

        if (Thread.interrupted()) {
            throw new InterruptedException("Refresh cycle " + cycle + " cancelled before publish");
        }
        snapshotStore.publish(new StorySnapshot(cycle, clock.instant(), outcome.stories()));

        Duration duration = Duration.between(startedAt, clock.instant());
        RefreshReport report = new RefreshReport(
                cycle,
                ids.size(),
                outcome.stories().size(),
                outcome.dropped(),
                passes.get(),
                requestsSent.get(),
                duration
        );
        if (!report.dropped().isEmpty()) {
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "refresh",
                    report.dropped().size() + " stories dropped after retries in cycle " + cycle,
                    Map.of("cycle", cycle, "dropped", report.dropped().size(), "retries", outcome.retries())
            ));
        }
        eventBus.publish(new RefreshCompleted(
                clock.instant(),
                cycle,
                report.requested(),
                report.published(),
                report.dropped().size(),
                report.passes(),
                duration.toMillis()
        ));
        LOGGER.fine(() -> report.published() + " stories acquired in cycle " + cycle);
        return report;
    }

    private static Set<Integer> firstDistinct(List<Integer> ids) {
        Set<Integer> distinct = new LinkedHashSet<>();
        for (Integer id : ids) {
            if (distinct.size() == MAX_BEST_STORIES) {
                break;
            }
            if (id != null) {
                distinct.add(id);
            }
        }
        return distinct;
    }
}

package com.storysentinel.service.api;

import com.storysentinel.core.bus.EventBus;
import com.storysentinel.core.events.AlertRaised;
import com.storysentinel.core.events.FanOutPassCompleted;
import com.storysentinel.core.events.RefreshCompleted;
import com.storysentinel.core.events.RefreshStarted;
import com.storysentinel.service.runtime.RefreshOrchestrator;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

public final class DiagnosticsTracker {
    private final Supplier<RefreshOrchestrator.State> refreshState;
    private final LongAdder cyclesCompleted = new LongAdder();
    private final LongAdder detailRequestsSent = new LongAdder();
    private final LongAdder storiesDroppedTotal = new LongAdder();
    private final LongAdder alertsRaised = new LongAdder();
    private final AtomicReference<RefreshStatus> lastRefresh = new AtomicReference<>(RefreshStatus.empty());
    private final AtomicReference<String> lastAlertMessage = new AtomicReference<>();

    public DiagnosticsTracker(EventBus eventBus, Supplier<RefreshOrchestrator.State> refreshState) {
        this.refreshState = refreshState;
        eventBus.subscribe(RefreshStarted.class, this::onRefreshStarted);
        eventBus.subscribe(FanOutPassCompleted.class, this::onPassCompleted);
        eventBus.subscribe(RefreshCompleted.class, this::onRefreshCompleted);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("refreshState", refreshState.get().name());
        metrics.put("cyclesCompleted", cyclesCompleted.longValue());
        metrics.put("detailRequestsSent", detailRequestsSent.longValue());
        metrics.put("storiesDroppedTotal", storiesDroppedTotal.longValue());
        metrics.put("alertsRaised", alertsRaised.longValue());
        metrics.put("lastAlertMessage", lastAlertMessage.get());
        metrics.put("lastCompleteness", lastCompleteness());
        metrics.put("lastRefresh", lastRefresh.get().toMap());
        return metrics;
    }

    /**
     * Share of requested stories that made it into the last completed snapshot, or 1.0 before
     * any cycle has completed.
     */
    public double lastCompleteness() {
        Double completeness = lastRefresh.get().completeness();
        return completeness == null ? 1.0 : completeness;
    }

    private void onRefreshStarted(RefreshStarted event) {
        lastRefresh.updateAndGet(status -> status.withStart(event.cycle(), event.timestamp()));
    }

    private void onPassCompleted(FanOutPassCompleted event) {
        detailRequestsSent.add(event.requestsSent());
    }

    private void onRefreshCompleted(RefreshCompleted event) {
        cyclesCompleted.increment();
        storiesDroppedTotal.add(event.dropped());
        lastRefresh.updateAndGet(status -> status.withCompletion(event));
    }

    private void onAlertRaised(AlertRaised event) {
        alertsRaised.increment();
        lastAlertMessage.set(event.message());
    }

    private record RefreshStatus(
            Long cycle,
            Instant startedAt,
            Instant completedAt,
            Long durationMillis,
            Integer requested,
            Integer published,
            Integer dropped,
            Double completeness
    ) {
        private static RefreshStatus empty() {
            return new RefreshStatus(null, null, null, null, null, null, null, null);
        }

        private RefreshStatus withStart(long startedCycle, Instant at) {
            return new RefreshStatus(startedCycle, at, completedAt, durationMillis, requested, published, dropped, completeness);
        }

        private RefreshStatus withCompletion(RefreshCompleted event) {
            return new RefreshStatus(
                    event.cycle(),
                    startedAt,
                    event.timestamp(),
                    event.durationMillis(),
                    event.requested(),
                    event.published(),
                    event.dropped(),
                    event.completeness()
            );
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("cycle", cycle);
            map.put("startedAt", startedAt == null ? null : startedAt.toString());
            map.put("completedAt", completedAt == null ? null : completedAt.toString());
            map.put("durationMillis", durationMillis);
            map.put("requested", requested);
            map.put("published", published);
            map.put("dropped", dropped);
            map.put("completeness", completeness);
            return map;
        }
    }
}

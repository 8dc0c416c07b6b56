package com.storysentinel.service.api;

import com.storysentinel.core.bus.EventBus;
import com.storysentinel.core.events.AlertRaised;
import com.storysentinel.core.events.FanOutPassCompleted;
import com.storysentinel.core.events.RefreshCompleted;
import com.storysentinel.core.events.RefreshStarted;
import com.storysentinel.service.runtime.RefreshOrchestrator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DiagnosticsTrackerTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void summarizesRefreshEvents() {
        EventBus bus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(bus, () -> RefreshOrchestrator.State.IDLE);

        bus.publish(new RefreshStarted(T0, 1));
        bus.publish(new FanOutPassCompleted(T0.plusSeconds(1), 1, 0, 4, 2, 2, 4, 900));
        bus.publish(new FanOutPassCompleted(T0.plusSeconds(7), 1, 1, 2, 1, 1, 2, 300));
        bus.publish(new AlertRaised(T0.plusSeconds(8), "refresh", "1 stories dropped after retries in cycle 1", Map.of()));
        bus.publish(new RefreshCompleted(T0.plusSeconds(8), 1, 4, 3, 1, 2, 8_000));

        Map<String, Object> metrics = tracker.metricsSnapshot();
        assertEquals("IDLE", metrics.get("refreshState"));
        assertEquals(1L, metrics.get("cyclesCompleted"));
        assertEquals(6L, metrics.get("detailRequestsSent"));
        assertEquals(1L, metrics.get("storiesDroppedTotal"));
        assertEquals(1L, metrics.get("alertsRaised"));
        assertEquals("1 stories dropped after retries in cycle 1", metrics.get("lastAlertMessage"));

        @SuppressWarnings("unchecked")
        Map<String, Object> last = (Map<String, Object>) metrics.get("lastRefresh");
        assertEquals(1L, last.get("cycle"));
        assertEquals("2026-03-01T10:00:00Z", last.get("startedAt"));
        assertEquals("2026-03-01T10:00:08Z", last.get("completedAt"));
        assertEquals(4, last.get("requested"));
        assertEquals(3, last.get("published"));
        assertEquals(0.75, tracker.lastCompleteness());
        assertEquals(0.75, metrics.get("lastCompleteness"));
    }

    @Test
    void completenessDefaultsToOneBeforeFirstCycle() {
        DiagnosticsTracker tracker = new DiagnosticsTracker(new EventBus(), () -> RefreshOrchestrator.State.REFRESHING);

        assertEquals(1.0, tracker.lastCompleteness());
        Map<String, Object> metrics = tracker.metricsSnapshot();
        assertEquals("REFRESHING", metrics.get("refreshState"));
        assertNull(metrics.get("lastAlertMessage"));
        assertEquals(1.0, metrics.get("lastCompleteness"));
    }
}

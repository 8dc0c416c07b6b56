package com.storysentinel.service.runtime;

import com.storysentinel.collectors.refresh.BestStoriesRefresher;
import com.storysentinel.core.bus.EventBus;
import com.storysentinel.core.events.AlertRaised;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives refresh cycles: one immediately on {@link #start()}, then one per interval. A timer
 * thread fires ticks and hands them to a single refresh thread, so cycles never overlap; a tick
 * that arrives while a cycle is still running is skipped.
 *
 * <p>Anything thrown out of a cycle, errors included, is fatal: no further ticks run and {@link #termination()}
 * completes exceptionally with it. {@link #stop()} interrupts any cycle in flight, which then
 * publishes nothing, and completes {@link #termination()} normally.
 */
public final class RefreshOrchestrator {
    public enum State {
        IDLE,
        REFRESHING,
        STOPPED,
        FAILED
    }

    private static final Logger LOGGER = Logger.getLogger(RefreshOrchestrator.class.getName());

    private final BestStoriesRefresher refresher;
    private final long intervalMillis;
    private final EventBus eventBus;
    private final Clock clock;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(named("refresh-timer"));
    private final ExecutorService refreshExecutor = Executors.newSingleThreadExecutor(named("story-refresh"));
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicBoolean cycleRunning = new AtomicBoolean();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private volatile ScheduledFuture<?> ticks;
    private volatile Future<?> inFlight;

    public RefreshOrchestrator(BestStoriesRefresher refresher, Duration interval, EventBus eventBus, Clock clock) {
        this(refresher, interval, eventBus, clock, 1_000);
    }

    RefreshOrchestrator(BestStoriesRefresher refresher, Duration interval, EventBus eventBus, Clock clock, long minIntervalMillis) {
        this.refresher = refresher;
        this.intervalMillis = Math.max(minIntervalMillis, interval.toMillis());
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public synchronized void start() {
        if (ticks != null) {
            throw new IllegalStateException("Refresh orchestrator already started");
        }
        LOGGER.info(() -> "Starting story refresh every " + intervalMillis + " ms");
        ticks = timerExecutor.scheduleAtFixedRate(this::onTick, 0, intervalMillis, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        State previous = state.getAndUpdate(current -> current == State.FAILED ? current : State.STOPPED);
        cancelTicks();
        Future<?> cycle = inFlight;
        if (cycle != null) {
            cycle.cancel(true);
        }
        timerExecutor.shutdownNow();
        refreshExecutor.shutdownNow();
        try {
            if (!refreshExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Refresh thread did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (previous != State.FAILED && previous != State.STOPPED) {
            LOGGER.info("Story refresh stopped");
        }
        termination.complete(null);
    }

    public State state() {
        return state.get();
    }

    /**
     * Completes when refreshing ends for good: normally after {@link #stop()}, exceptionally with
     * the cause when a cycle fails.
     */
    public CompletableFuture<Void> termination() {
        return termination;
    }

    void onTick() {
        State current = state.get();
        if (current == State.STOPPED || current == State.FAILED) {
            return;
        }
        if (!cycleRunning.compareAndSet(false, true)) {
            LOGGER.warning("Skipping refresh tick, previous cycle is still running");
            return;
        }
        try {
            inFlight = refreshExecutor.submit(this::runCycle);
        } catch (RejectedExecutionException e) {
            cycleRunning.set(false);
        }
    }

    private void runCycle() {
        try {
            if (!state.compareAndSet(State.IDLE, State.REFRESHING)) {
                return;
            }
            refresher.refresh();
            state.compareAndSet(State.REFRESHING, State.IDLE);
        } catch (InterruptedException e) {
            LOGGER.info("Refresh cycle cancelled before publishing");
            if (state.compareAndSet(State.REFRESHING, State.STOPPED)) {
                cancelTicks();
                termination.complete(null);
            }
        } catch (Throwable e) {
            fail(e);
        } finally {
            cycleRunning.set(false);
        }
    }

    private void fail(Throwable error) {
        if (!state.compareAndSet(State.REFRESHING, State.FAILED)) {
            LOGGER.log(Level.FINE, "Ignoring refresh failure after stop", error);
            return;
        }
        LOGGER.log(Level.SEVERE, "Refresh cycle failed, no further refreshes will run", error);
        eventBus.publish(new AlertRaised(
                clock.instant(),
                "refresh",
                "Background refresh stopped: " + error.getMessage(),
                Map.of("error", error.getClass().getSimpleName())
        ));
        cancelTicks();
        termination.completeExceptionally(error);
    }

    private void cancelTicks() {
        ScheduledFuture<?> scheduled = ticks;
        if (scheduled != null) {
            scheduled.cancel(false);
        }
    }

    private static ThreadFactory named(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}

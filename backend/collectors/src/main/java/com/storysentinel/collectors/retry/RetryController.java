package com.storysentinel.collectors.retry;

import com.storysentinel.collectors.fanout.FanOutOutcome;
import com.storysentinel.collectors.fanout.FanOutPass;
import com.storysentinel.core.model.Story;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Re-runs a fan-out pass over the identifiers that failed, pausing between attempts, until nothing
 * is left or the retry budget is spent. Whatever still fails afterwards is dropped.
 */
public final class RetryController {
    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(5);

    private static final Logger LOGGER = Logger.getLogger(RetryController.class.getName());

    private final int maxRetries;
    private final Duration delay;
    private final Sleeper sleeper;

    public RetryController() {
        this(DEFAULT_MAX_RETRIES, DEFAULT_DELAY, Sleeper.threadSleep());
    }

    public RetryController(int maxRetries, Duration delay, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.delay = delay;
        this.sleeper = sleeper;
    }

    public RetryOutcome retry(FanOutOutcome initial, FanOutPass pass) throws InterruptedException {
        List<Story> stories = new ArrayList<>(initial.succeeded());
        Set<Integer> remaining = initial.failed();
        int retries = 0;

        while (!remaining.isEmpty() && retries < maxRetries) {
            sleeper.sleep(delay);
            FanOutOutcome next = pass.run(remaining);
            stories.addAll(next.succeeded());
            remaining = next.failed();
            retries++;
            int attempt = retries;
            int left = remaining.size();
            LOGGER.fine(() -> "Retry " + attempt + "/" + maxRetries + " left " + left + " identifiers failing");
        }

        if (!remaining.isEmpty()) {
            Set<Integer> dropped = remaining;
            LOGGER.warning(() -> "Dropping " + dropped.size() + " identifiers after " + maxRetries + " retries: " + dropped);
        }
        return new RetryOutcome(stories, remaining, retries);
    }
}

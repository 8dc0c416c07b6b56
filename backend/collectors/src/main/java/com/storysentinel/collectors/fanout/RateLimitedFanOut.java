package com.storysentinel.collectors.fanout;

import com.storysentinel.collectors.api.DetailFetcher;
import com.storysentinel.collectors.api.FetchResult;
import com.storysentinel.collectors.limit.FixedWindowRateLimiter;
import com.storysentinel.core.model.Story;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches story details for a batch of identifiers on a fixed pool of {@code maxParallelism}
 * workers. Every attempt first takes a permit from the shared limiter; a rejected permit, a failed
 * fetch and an unexpected exception all land the identifier in the failed set.
 */
public final class RateLimitedFanOut implements FanOutPass, AutoCloseable {
    public static final int PERMITS_PER_SECOND = 30;
    public static final int PERMIT_QUEUE_LIMIT = 200;

    private static final Logger LOGGER = Logger.getLogger(RateLimitedFanOut.class.getName());

    private final DetailFetcher fetcher;
    private final FixedWindowRateLimiter limiter;
    private final ExecutorService workers;

    public RateLimitedFanOut(DetailFetcher fetcher, int maxParallelism) {
        this(fetcher, new FixedWindowRateLimiter(PERMITS_PER_SECOND, Duration.ofSeconds(1), PERMIT_QUEUE_LIMIT), maxParallelism);
    }

    public RateLimitedFanOut(DetailFetcher fetcher, FixedWindowRateLimiter limiter, int maxParallelism) {
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("maxParallelism must be >= 1");
        }
        this.fetcher = fetcher;
        this.limiter = limiter;
        this.workers = Executors.newFixedThreadPool(maxParallelism, new WorkerThreadFactory());
    }

    @Override
    public FanOutOutcome run(Set<Integer> ids) throws InterruptedException {
        Set<Integer> requested = Set.copyOf(ids);
        AtomicInteger requestsSent = new AtomicInteger();
        List<Callable<FetchResult>> attempts = new ArrayList<>(requested.size());
        for (Integer id : requested) {
            attempts.add(() -> attempt(id, requestsSent));
        }

        // invokeAll cancels outstanding attempts with interrupt when this thread is interrupted
        List<Future<FetchResult>> futures = workers.invokeAll(attempts);

        List<Story> succeeded = new ArrayList<>();
        Set<Integer> failed = new HashSet<>();
        for (Future<FetchResult> future : futures) {
            FetchResult result = resultOf(future);
            if (result.isSuccess()) {
                succeeded.add(result.story());
            } else {
                failed.add(result.id());
            }
        }

        LOGGER.fine(() -> requestsSent.get() + " story requests sent for " + requested.size() + " identifiers");
        return new FanOutOutcome(succeeded, failed, requestsSent.get()).verifyCovers(requested);
    }

    @Override
    public void close() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Story fetch workers did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private FetchResult attempt(int id, AtomicInteger requestsSent) {
        try {
            FixedWindowRateLimiter.Permit permit = limiter.acquire();
            if (!permit.acquired()) {
                LOGGER.fine(() -> "[Rejected] Could not acquire permit for item " + id);
                return FetchResult.failure(id, "rate limit permit rejected");
            }
            requestsSent.incrementAndGet();
            FetchResult result = fetcher.fetch(id);
            if (result == null) {
                return FetchResult.failure(id, "fetcher returned no result");
            }
            if (!result.isSuccess()) {
                LOGGER.fine(() -> "[Failed] Could not acquire story for item " + id + ": " + result.failureReason());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(id, "interrupted");
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "[Error] Exception while fetching story " + id, e);
            return FetchResult.failure(id, e.toString());
        }
    }

    private static FetchResult resultOf(Future<FetchResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Story fetch worker failed", e.getCause());
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "story-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

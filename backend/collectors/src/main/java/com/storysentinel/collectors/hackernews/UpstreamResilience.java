package com.storysentinel.collectors.hackernews;

import com.storysentinel.collectors.config.HackerNewsConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/**
 * Retry with exponential backoff around a circuit breaker, shared by every request a
 * {@link HackerNewsClient} sends. Each attempt passes through the breaker, so retries count
 * towards its failure rate.
 *
 * <p>Transport errors and transient statuses (408, 429, 5xx) are retried and recorded as breaker
 * failures. When the breaker is open calls fail fast with
 * {@link io.github.resilience4j.circuitbreaker.CallNotPermittedException}.
 */
public final class UpstreamResilience {
    private static final Logger LOGGER = Logger.getLogger(UpstreamResilience.class.getName());

    @FunctionalInterface
    public interface UpstreamCall<T> {
        T send() throws IOException, InterruptedException;
    }

    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public UpstreamResilience(HackerNewsConfig.Resilience settings) {
        this(settings, settings.backoff());
    }

    UpstreamResilience(HackerNewsConfig.Resilience settings, Duration firstBackoff) {
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(settings.retryCount() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(firstBackoff, 2.0))
                .retryExceptions(IOException.class)
                .build();
        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold((float) (settings.circuitBreakerThreshold() * 100))
                .slidingWindowType(SlidingWindowType.TIME_BASED)
                .slidingWindowSize(settings.samplingDurationSeconds())
                .minimumNumberOfCalls(settings.minimumThroughput())
                .waitDurationInOpenState(settings.breakDuration())
                .recordExceptions(IOException.class)
                .ignoreExceptions(InterruptedException.class)
                .build();

        this.retry = Retry.of("hackernews", retryConfig);
        this.circuitBreaker = CircuitBreaker.of("hackernews", breakerConfig);

        retry.getEventPublisher().onRetry(event -> LOGGER.fine(() -> "Retrying upstream request, attempt "
                + event.getNumberOfRetryAttempts() + " after " + event.getLastThrowable()));
        circuitBreaker.getEventPublisher().onStateTransition(event -> LOGGER.warning(() -> "Upstream circuit breaker "
                + event.getStateTransition().getFromState() + " -> " + event.getStateTransition().getToState()));
    }

    public <T> T execute(UpstreamCall<T> call) throws IOException, InterruptedException {
        Callable<T> guarded = Retry.decorateCallable(retry, CircuitBreaker.decorateCallable(circuitBreaker, call::send));
        try {
            return guarded.call();
        } catch (IOException | InterruptedException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected upstream failure", e);
        }
    }

    static boolean isTransient(int status) {
        return status == 408 || status == 429 || status / 100 == 5;
    }
}

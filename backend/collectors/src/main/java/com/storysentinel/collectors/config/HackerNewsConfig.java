package com.storysentinel.collectors.config;

import java.net.URI;
import java.time.Duration;

public record HackerNewsConfig(
        String baseUrl,
        Integer cacheDurationMinutes,
        Integer maxDegreeOfParallelism,
        Integer requestTimeoutSeconds,
        Integer connectTimeoutSeconds,
        Resilience resilience
) {
    public static final String DEFAULT_BASE_URL = "https://hacker-news.firebaseio.com/v0/";

    public HackerNewsConfig {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : withTrailingSlash(baseUrl.trim());
        cacheDurationMinutes = positiveOr(cacheDurationMinutes, 5);
        maxDegreeOfParallelism = positiveOr(maxDegreeOfParallelism, Runtime.getRuntime().availableProcessors());
        requestTimeoutSeconds = positiveOr(requestTimeoutSeconds, 10);
        connectTimeoutSeconds = positiveOr(connectTimeoutSeconds, 5);
        resilience = resilience == null ? Resilience.defaults() : resilience;
    }

    public static HackerNewsConfig defaults() {
        return new HackerNewsConfig(null, null, null, null, null, null);
    }

    public HackerNewsConfig withBaseUrl(String override) {
        return new HackerNewsConfig(override, cacheDurationMinutes, maxDegreeOfParallelism, requestTimeoutSeconds, connectTimeoutSeconds,
                resilience);
    }

    public URI baseUri() {
        return URI.create(baseUrl);
    }

    public Duration refreshInterval() {
        return Duration.ofMinutes(cacheDurationMinutes);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public Duration connectTimeout() {
        return Duration.ofSeconds(connectTimeoutSeconds);
    }

    /**
     * Retry and circuit breaker settings applied to every upstream request. The breaker opens
     * once {@code circuitBreakerThreshold} of the calls seen in the last
     * {@code samplingDurationSeconds} failed, provided at least {@code minimumThroughput} calls
     * were made.
     */
    public record Resilience(
            Integer retryCount,
            Integer backoffSeconds,
            Double circuitBreakerThreshold,
            Integer samplingDurationSeconds,
            Integer minimumThroughput,
            Integer breakDurationSeconds
    ) {
        public Resilience {
            retryCount = retryCount == null || retryCount < 0 ? 3 : retryCount;
            backoffSeconds = positiveOr(backoffSeconds, 2);
            circuitBreakerThreshold = circuitBreakerThreshold == null
                    || circuitBreakerThreshold <= 0 || circuitBreakerThreshold > 1 ? 0.5 : circuitBreakerThreshold;
            samplingDurationSeconds = positiveOr(samplingDurationSeconds, 30);
            minimumThroughput = positiveOr(minimumThroughput, 10);
            breakDurationSeconds = positiveOr(breakDurationSeconds, 5);
        }

        public static Resilience defaults() {
            return new Resilience(null, null, null, null, null, null);
        }

        public Duration backoff() {
            return Duration.ofSeconds(backoffSeconds);
        }

        public Duration samplingDuration() {
            return Duration.ofSeconds(samplingDurationSeconds);
        }

        public Duration breakDuration() {
            return Duration.ofSeconds(breakDurationSeconds);
        }
    }

    private static Integer positiveOr(Integer value, int fallback) {
        return value == null || value < 1 ? fallback : value;
    }

    private static String withTrailingSlash(String url) {
        return url.endsWith("/") ? url : url + "/";
    }
}

package com.storysentinel.service.config;

import java.time.Duration;

public record ApiConfig(Integer port, String apiKey, RateLimit rateLimit) {
    public static final int DEFAULT_PORT = 8080;

    public ApiConfig {
        port = port == null || port < 0 ? DEFAULT_PORT : port;
        apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        rateLimit = rateLimit == null ? RateLimit.defaults() : rateLimit;
    }

    public static ApiConfig defaults() {
        return new ApiConfig(null, null, null);
    }

    public ApiConfig withPort(int override) {
        return new ApiConfig(override, apiKey, rateLimit);
    }

    public ApiConfig withApiKey(String override) {
        return new ApiConfig(port, override, rateLimit);
    }

    /**
     * Inbound limit on {@code /api/best}: {@code permitLimit} requests per window, with up to
     * {@code queueLimit} requests waiting for the next window.
     */
    public record RateLimit(Integer permitLimit, Integer windowSeconds, Integer queueLimit) {
        public RateLimit {
            permitLimit = permitLimit == null || permitLimit < 1 ? 100 : permitLimit;
            windowSeconds = windowSeconds == null || windowSeconds < 1 ? 60 : windowSeconds;
            queueLimit = queueLimit == null || queueLimit < 0 ? 10 : queueLimit;
        }

        public static RateLimit defaults() {
            return new RateLimit(null, null, null);
        }

        public Duration window() {
            return Duration.ofSeconds(windowSeconds);
        }
    }
}

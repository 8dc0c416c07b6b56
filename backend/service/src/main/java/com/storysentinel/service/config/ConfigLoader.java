package com.storysentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.storysentinel.collectors.config.HackerNewsConfig;
import com.storysentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;

public final class ConfigLoader {
    static final String HACKER_NEWS_FILE = "hackernews.json";
    static final String API_FILE = "api.json";

    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static HackerNewsConfig loadHackerNews(Path configDir) {
        return read(configDir.resolve(HACKER_NEWS_FILE), new TypeReference<>() {
        }, HackerNewsConfig.defaults());
    }

    public static ApiConfig loadApi(Path configDir) {
        return read(configDir.resolve(API_FILE), new TypeReference<>() {
        }, ApiConfig.defaults());
    }

    public static HackerNewsConfig applyEnvironment(HackerNewsConfig config, Map<String, String> env) {
        String baseUrl = env.get("HN_BASE_URL");
        return baseUrl == null || baseUrl.isBlank() ? config : config.withBaseUrl(baseUrl);
    }

    public static ApiConfig applyEnvironment(ApiConfig config, Map<String, String> env) {
        ApiConfig result = config;
        String apiKey = env.get("API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            result = result.withApiKey(apiKey);
        }
        String port = env.get("API_PORT");
        if (port != null && !port.isBlank()) {
            try {
                result = result.withPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalStateException("API_PORT must be an integer, was '" + port + "'", e);
            }
        }
        return result;
    }

    private static <T> T read(Path path, TypeReference<T> ref, T fallback) {
        if (!Files.exists(path)) {
            LOGGER.info(() -> "No config at " + path + ", using defaults");
            return fallback;
        }
        try (InputStream in = Files.newInputStream(path)) {
            T value = JsonUtils.objectMapper().readValue(in, ref);
            return value == null ? fallback : value;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}

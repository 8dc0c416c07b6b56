package com.storysentinel.service;

import com.storysentinel.collectors.config.HackerNewsConfig;
import com.storysentinel.collectors.fanout.RateLimitedFanOut;
import com.storysentinel.collectors.hackernews.HackerNewsClient;
import com.storysentinel.collectors.hackernews.UpstreamResilience;
import com.storysentinel.collectors.refresh.BestStoriesRefresher;
import com.storysentinel.collectors.retry.RetryController;
import com.storysentinel.core.bus.EventBus;
import com.storysentinel.service.api.ApiServer;
import com.storysentinel.service.api.DiagnosticsTracker;
import com.storysentinel.service.config.ApiConfig;
import com.storysentinel.service.config.ConfigLoader;
import com.storysentinel.service.http.HttpClientFactory;
import com.storysentinel.service.query.BestStoriesQueryService;
import com.storysentinel.service.runtime.RefreshOrchestrator;
import com.storysentinel.service.store.AtomicSnapshotStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("CONFIG_DIR", "config"));
        HackerNewsConfig hackerNewsConfig = ConfigLoader.applyEnvironment(ConfigLoader.loadHackerNews(configDir), env);
        ApiConfig apiConfig = ConfigLoader.applyEnvironment(ConfigLoader.loadApi(configDir), env);

        Clock clock = Clock.systemUTC();
        EventBus eventBus = new EventBus();
        AtomicSnapshotStore snapshotStore = new AtomicSnapshotStore();

        HttpClient httpClient = HttpClientFactory.create(hackerNewsConfig);
        HackerNewsClient hackerNews = new HackerNewsClient(
                httpClient,
                hackerNewsConfig.baseUri(),
                hackerNewsConfig.requestTimeout(),
                new UpstreamResilience(hackerNewsConfig.resilience())
        );
        RateLimitedFanOut fanOut = new RateLimitedFanOut(hackerNews, hackerNewsConfig.maxDegreeOfParallelism());
        BestStoriesRefresher refresher = new BestStoriesRefresher(
                hackerNews,
                fanOut,
                new RetryController(),
                snapshotStore,
                eventBus,
                clock
        );
        RefreshOrchestrator orchestrator = new RefreshOrchestrator(refresher, hackerNewsConfig.refreshInterval(), eventBus, clock);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, orchestrator::state);
        ApiServer apiServer = new ApiServer(
                apiConfig,
                new BestStoriesQueryService(snapshotStore),
                diagnosticsTracker,
                orchestrator::state,
                snapshotStore::lastPublishedAt
        );

        LOGGER.info(() -> "Reading best stories from " + hackerNewsConfig.baseUrl()
                + " with parallelism " + hackerNewsConfig.maxDegreeOfParallelism());
        orchestrator.start();
        apiServer.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            orchestrator.stop();
            apiServer.stop();
            fanOut.close();
        }));

        try {
            orchestrator.termination().join();
        } catch (CompletionException e) {
            LOGGER.log(Level.SEVERE, "Background refresh terminated, shutting down", e.getCause());
            apiServer.stop();
            fanOut.close();
            throw new IllegalStateException("Background refresh terminated", e.getCause());
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading logging.properties", e);
        }
    }
}

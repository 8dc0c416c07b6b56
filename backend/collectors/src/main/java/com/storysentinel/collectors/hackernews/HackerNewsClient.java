package com.storysentinel.collectors.hackernews;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storysentinel.collectors.api.DetailFetcher;
import com.storysentinel.collectors.api.FetchResult;
import com.storysentinel.collectors.api.StoryIdSource;
import com.storysentinel.core.model.Story;
import com.storysentinel.core.util.JsonUtils;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

public final class HackerNewsClient implements StoryIdSource, DetailFetcher {
    static final String BEST_STORIES_PATH = "beststories.json";
    static final String ITEM_PATH = "item/%d.json";

    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final TypeReference<List<Integer>> ID_LIST = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Duration timeout;
    private final UpstreamResilience resilience;

    public HackerNewsClient(HttpClient httpClient, URI baseUri, Duration timeout, UpstreamResilience resilience) {
        this.httpClient = httpClient;
        this.baseUri = baseUri;
        this.timeout = timeout;
        this.resilience = resilience;
    }

    @Override
    public List<Integer> bestStoryIds() throws InterruptedException {
        URI uri = baseUri.resolve(BEST_STORIES_PATH);
        HttpResponse<String> response;
        try {
            response = send(uri);
        } catch (CallNotPermittedException e) {
            throw new UpstreamException("Best stories request rejected, circuit open for " + uri, uri, e);
        } catch (IOException e) {
            throw new UpstreamException("Best stories request failed for " + uri, uri, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new UpstreamException("Best stories request failed with status " + response.statusCode() + " for " + uri,
                    uri, response.statusCode());
        }
        try {
            List<Integer> ids = MAPPER.readValue(response.body(), ID_LIST);
            return ids == null ? List.of() : ids;
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Malformed best stories payload from " + uri, uri, e);
        }
    }

    @Override
    public FetchResult fetch(int id) throws InterruptedException {
        URI uri = baseUri.resolve(String.format(ITEM_PATH, id));
        HttpResponse<String> response;
        try {
            response = send(uri);
        } catch (CallNotPermittedException e) {
            return FetchResult.failure(id, "circuit open");
        } catch (IOException e) {
            return FetchResult.failure(id, "request failed: " + describe(e));
        }
        if (response.statusCode() / 100 != 2) {
            return FetchResult.failure(id, "status " + response.statusCode());
        }

        Story story;
        try {
            story = MAPPER.readValue(response.body(), Story.class);
        } catch (JsonProcessingException e) {
            return FetchResult.failure(id, "malformed payload: " + e.getOriginalMessage());
        }
        if (story == null) {
            return FetchResult.failure(id, "item not found");
        }
        if (story.id() != id) {
            return FetchResult.failure(id, "payload carries item " + story.id());
        }
        return FetchResult.success(story);
    }

    private HttpResponse<String> send(URI uri) throws IOException, InterruptedException {
        try {
            return resilience.execute(() -> {
                HttpResponse<String> response = httpClient.send(request(uri), HttpResponse.BodyHandlers.ofString());
                if (UpstreamResilience.isTransient(response.statusCode())) {
                    throw new TransientStatusException(response);
                }
                return response;
            });
        } catch (TransientStatusException e) {
            return e.response();
        }
    }

    private HttpRequest request(URI uri) {
        return HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}

package com.storysentinel.service.http;

import com.storysentinel.collectors.config.HackerNewsConfig;

import java.net.http.HttpClient;

public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    /**
     * One client is shared by the id-list and item requests; its connection pool and executor are
     * reused across cycles.
     */
    public static HttpClient create(HackerNewsConfig config) {
        return HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}

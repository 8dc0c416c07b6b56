package com.storysentinel.collectors.api;

@FunctionalInterface
public interface DetailFetcher {
    /**
     * Fetches one story. Every upstream problem (transport, status, payload) is reported as a
     * failed {@link FetchResult} rather than thrown.
     */
    FetchResult fetch(int id) throws InterruptedException;
}

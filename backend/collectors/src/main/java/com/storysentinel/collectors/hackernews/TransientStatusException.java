package com.storysentinel.collectors.hackernews;

import java.io.IOException;
import java.net.http.HttpResponse;

/**
 * Raised inside a guarded call for a transient status so that retries and the circuit breaker
 * treat it like a transport failure. Unwrapped back into the response once retries run out.
 */
final class TransientStatusException extends IOException {
    private final transient HttpResponse<String> response;

    TransientStatusException(HttpResponse<String> response) {
        super("Transient status " + response.statusCode() + " from " + response.uri());
        this.response = response;
    }

    HttpResponse<String> response() {
        return response;
    }
}

package com.storysentinel.collectors.hackernews;

import java.net.URI;

/**
 * Raised when a request that a whole refresh cycle depends on (the best-stories list) fails.
 */
public class UpstreamException extends IllegalStateException {
    private final URI uri;
    private final int status;

    public UpstreamException(String message, URI uri, int status) {
        super(message);
        this.uri = uri;
        this.status = status;
    }

    public UpstreamException(String message, URI uri, Throwable cause) {
        super(message, cause);
        this.uri = uri;
        this.status = -1;
    }

    public URI uri() {
        return uri;
    }

    /**
     * HTTP status of the failed response, or -1 when no response was received.
     */
    public int status() {
        return status;
    }
}

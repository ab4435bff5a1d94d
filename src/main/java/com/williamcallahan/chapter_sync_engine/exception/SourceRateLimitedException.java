package com.williamcallahan.chapter_sync_engine.exception;

import java.time.Duration;

/**
 * Upstream refused the request because of rate limiting, optionally saying when to come back.
 */
public class SourceRateLimitedException extends SourceClientException {

    private final Duration retryAfter;

    public SourceRateLimitedException(String sourceName, Duration retryAfter) {
        super(sourceName, "Rate limited by " + sourceName + (retryAfter != null ? ", retry after " + retryAfter : ""));
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}

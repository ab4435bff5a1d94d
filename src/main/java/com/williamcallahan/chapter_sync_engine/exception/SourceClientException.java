package com.williamcallahan.chapter_sync_engine.exception;

/**
 * Base class for failures reported by an upstream source adapter.
 */
public abstract class SourceClientException extends Exception {

    private final String sourceName;

    protected SourceClientException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    protected SourceClientException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}

package com.williamcallahan.chapter_sync_engine.exception;

/**
 * Upstream could not be reached or timed out.
 */
public class SourceNetworkException extends SourceClientException {

    public SourceNetworkException(String sourceName, String message) {
        super(sourceName, message);
    }

    public SourceNetworkException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }
}

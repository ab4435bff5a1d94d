package com.williamcallahan.chapter_sync_engine.exception;

/**
 * Upstream answered, but the payload could not be understood.
 */
public class SourceParseException extends SourceClientException {

    public SourceParseException(String sourceName, String message) {
        super(sourceName, message);
    }

    public SourceParseException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }
}

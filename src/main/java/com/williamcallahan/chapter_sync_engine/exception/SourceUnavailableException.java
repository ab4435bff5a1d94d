package com.williamcallahan.chapter_sync_engine.exception;

/**
 * A call to an upstream source was not attempted because its circuit is open or no rate-limit
 * permit was available in time.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }
}

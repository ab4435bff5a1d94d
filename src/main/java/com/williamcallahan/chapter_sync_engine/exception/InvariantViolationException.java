package com.williamcallahan.chapter_sync_engine.exception;

public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}

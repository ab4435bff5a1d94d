package com.williamcallahan.chapter_sync_engine.exception;

/**
 * Another worker holds the resource lock. The job is treated as already in progress.
 */
public class LockUnavailableException extends RuntimeException {

    private final long lockKey;

    public LockUnavailableException(String resource, long lockKey) {
        super("Lock unavailable for " + resource);
        this.lockKey = lockKey;
    }

    public long getLockKey() {
        return lockKey;
    }
}

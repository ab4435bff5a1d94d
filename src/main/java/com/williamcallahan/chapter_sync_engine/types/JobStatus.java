package com.williamcallahan.chapter_sync_engine.types;

/**
 * Lifecycle of a queued job: WAITING → ACTIVE → COMPLETED, or back to WAITING on a retryable
 * failure, or DEAD_LETTERED once attempts are exhausted.
 */
public enum JobStatus {
    WAITING,
    ACTIVE,
    COMPLETED,
    DEAD_LETTERED;

    /**
     * Outstanding jobs hold their idempotency key; a second enqueue with the same key is ignored.
     */
    public boolean isOutstanding() {
        return switch (this) {
            case WAITING, ACTIVE -> true;
            case COMPLETED, DEAD_LETTERED -> false;
        };
    }
}

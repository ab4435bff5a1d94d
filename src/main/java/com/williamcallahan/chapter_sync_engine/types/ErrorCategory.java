/**
 * Classification of a job failure
 *
 * Features:
 * - TRANSIENT failures (network, rate limit, lock contention, serialization conflicts) are retried
 * - DATA failures affect a single item and never fail a batch on their own
 * - STRUCTURAL failures indicate a suspected upstream error and suppress destructive writes
 * - FATAL failures (invariant or schema violations) go straight toward the dead-letter set
 */

package com.williamcallahan.chapter_sync_engine.types;

public enum ErrorCategory {
    TRANSIENT,
    DATA,
    STRUCTURAL,
    FATAL;

    public boolean isRetryable() {
        return switch (this) {
            case TRANSIENT, DATA -> true;
            case STRUCTURAL, FATAL -> false;
        };
    }

    /**
     * Whether the failure counts against the upstream source's circuit breaker.
     */
    public boolean countsAgainstSource() {
        return switch (this) {
            case TRANSIENT, DATA -> true;
            case STRUCTURAL, FATAL -> false;
        };
    }
}

package com.williamcallahan.chapter_sync_engine.types;

/**
 * What the queue did with a failed attempt.
 */
public enum FailureDisposition {
    RETRY_SCHEDULED,
    DEAD_LETTERED
}

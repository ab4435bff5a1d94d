package com.williamcallahan.chapter_sync_engine.types;

public enum AttemptOutcome {
    SUCCEEDED,
    SKIPPED,
    FAILED,
    TIMED_OUT,
    LEASE_EXPIRED
}

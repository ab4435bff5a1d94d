package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;

import java.time.Duration;
import java.util.Objects;

/**
 * The only failure information that crosses the job boundary: a category and a message safe to store.
 *
 * @param retryAfter minimum delay requested by the upstream, or null
 * @param outcome    FAILED for handler errors, TIMED_OUT when the worker gave up on the job
 */
public record JobFailure(ErrorCategory category, String safeMessage, Duration retryAfter, AttemptOutcome outcome) {

    public JobFailure {
        Objects.requireNonNull(category, "category");
        outcome = outcome == null ? AttemptOutcome.FAILED : outcome;
    }

    public static JobFailure of(ErrorCategory category, String safeMessage) {
        return new JobFailure(category, safeMessage, null, AttemptOutcome.FAILED);
    }

    public static JobFailure timedOut(String safeMessage) {
        return new JobFailure(ErrorCategory.TRANSIENT, safeMessage, null, AttemptOutcome.TIMED_OUT);
    }
}

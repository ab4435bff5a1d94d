package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;

import java.time.Instant;

/**
 * One entry of a job's attempt history. {@code category} and {@code message} are null for successful attempts.
 */
public record JobAttempt(
    int attempt,
    String workerId,
    Long fenceToken,
    AttemptOutcome outcome,
    ErrorCategory category,
    String message,
    Instant startedAt,
    Instant finishedAt
) {}

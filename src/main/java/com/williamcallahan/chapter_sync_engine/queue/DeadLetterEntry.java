package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A job that exhausted its attempts or failed with a non-retryable category, kept for manual inspection.
 */
@Builder(toBuilder = true)
public record DeadLetterEntry(
    String id,
    String jobId,
    QueueName queue,
    String idempotencyKey,
    String sourceName,
    Map<String, String> payload,
    int priority,
    ErrorCategory category,
    String message,
    int attempts,
    List<JobAttempt> attemptHistory,
    Instant deadLetteredAt,
    Instant resolvedAt,
    String resolutionNote
) {

    public DeadLetterEntry {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        attemptHistory = attemptHistory == null ? List.of() : List.copyOf(attemptHistory);
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    /**
     * A fresh request carrying the original key and payload.
     */
    public JobRequest toRequest() {
        return new JobRequest(queue, idempotencyKey, sourceName, payload, priority);
    }
}

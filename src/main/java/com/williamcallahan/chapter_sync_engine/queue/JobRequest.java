package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.types.QueueName;

import java.util.Map;
import java.util.Objects;

/**
 * Submission to a job queue.
 *
 * @param queue          target queue
 * @param idempotencyKey deterministic key; a second enqueue while the first job is outstanding is ignored
 * @param sourceName     upstream source the job talks to, used for per-source concurrency caps; may be null
 * @param payload        flat string payload, stored as JSON
 * @param priority       1 is the most urgent, 10 the least
 */
public record JobRequest(
    QueueName queue,
    String idempotencyKey,
    String sourceName,
    Map<String, String> payload,
    int priority
) {

    public static final int DEFAULT_PRIORITY = 5;

    public JobRequest {
        Objects.requireNonNull(queue, "queue");
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key is required");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}

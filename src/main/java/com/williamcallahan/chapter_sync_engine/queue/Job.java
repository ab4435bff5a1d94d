/**
 * Snapshot of a queued job
 *
 * Features:
 * - attempts counts claims, so a running job sees 1 on its first try
 * - fenceToken is issued on every claim and is the only proof of ownership a worker holds
 */

package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.JobStatus;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder(toBuilder = true)
public record Job(
    String id,
    QueueName queue,
    String idempotencyKey,
    String sourceName,
    Map<String, String> payload,
    int priority,
    JobStatus status,
    int attempts,
    int maxAttempts,
    Instant availableAt,
    String leaseOwner,
    Instant leaseExpiresAt,
    Long fenceToken,
    String lastError,
    AttemptOutcome outcome,
    Instant createdAt,
    Instant claimedAt,
    Instant firstClaimedAt,
    Instant completedAt
) {

    public Job {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public String payloadValue(String key) {
        return payload.get(key);
    }

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }
}

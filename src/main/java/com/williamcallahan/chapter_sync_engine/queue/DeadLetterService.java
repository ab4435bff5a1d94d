/**
 * Operator-facing access to the dead-letter set
 *
 * Features:
 * - Lists unresolved entries with their full attempt history
 * - Requeues an entry as a fresh job under its original idempotency key
 * - Resolves an entry with a note once it has been dealt with by hand
 */

package com.williamcallahan.chapter_sync_engine.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class DeadLetterService {

    private static final int MAX_LIST_LIMIT = 500;

    private final JobQueue jobQueue;

    public DeadLetterService(JobQueue jobQueue) {
        this.jobQueue = jobQueue;
    }

    public List<DeadLetterEntry> list(int limit) {
        return jobQueue.findDeadLetters(Math.max(1, Math.min(limit, MAX_LIST_LIMIT)));
    }

    public long count() {
        return jobQueue.deadLetterCount();
    }

    /**
     * Enqueues the dead-lettered job again and marks the entry resolved.
     * If a job with the same key is already outstanding, that job is returned and nothing new is added.
     *
     * @throws IllegalArgumentException when the entry does not exist
     * @throws IllegalStateException    when the entry is already resolved
     */
    public JobHandle requeue(String deadLetterId) {
        DeadLetterEntry entry = jobQueue.findDeadLetter(deadLetterId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown dead letter " + deadLetterId));
        if (entry.isResolved()) {
            throw new IllegalStateException("Dead letter " + deadLetterId + " was already resolved: " + entry.resolutionNote());
        }
        JobHandle handle = jobQueue.enqueue(entry.toRequest());
        jobQueue.resolveDeadLetter(deadLetterId, "requeued as " + handle.jobId());
        log.info("Requeued dead letter {} ({} {}) as job {}{}", deadLetterId, entry.queue().queueId(),
            entry.idempotencyKey(), handle.jobId(), handle.enqueued() ? "" : " (already outstanding)");
        return handle;
    }

    /**
     * @return false when the entry does not exist or was already resolved
     */
    public boolean resolve(String deadLetterId, String note) {
        boolean resolved = jobQueue.resolveDeadLetter(deadLetterId, note == null || note.isBlank() ? "resolved" : note.trim());
        if (resolved) {
            log.info("Resolved dead letter {}: {}", deadLetterId, note);
        }
        return resolved;
    }
}

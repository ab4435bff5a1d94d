/**
 * Durable, at-least-once job queue with idempotency-key deduplication and fenced leases
 *
 * Features:
 * - enqueue() is idempotent while a job with the same key is WAITING or ACTIVE
 * - claimNext() leases one job, bumps its attempt count and issues a new fence token
 * - heartbeat(), complete() and fail() only succeed for the current fence token
 * - Exhausted or non-retryable jobs move to the dead-letter set with their attempt history
 */

package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.exception.StaleFenceException;
import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.FailureDisposition;
import com.williamcallahan.chapter_sync_engine.types.QueueName;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public interface JobQueue {

    /**
     * Per-queue counts for monitoring.
     */
    record QueueStats(long waiting, long active, long completed, long deadLettered) {}

    JobHandle enqueue(JobRequest request);

    /**
     * Leases the most urgent available job of a queue.
     * Jobs never claimed within the configured maximum age are completed as SKIPPED instead.
     *
     * @param excludedSources sources whose jobs must stay waiting (at capacity or breaker open)
     */
    Optional<Job> claimNext(QueueName queue, String workerId, Set<String> excludedSources);

    /**
     * Extends the lease of a running job.
     *
     * @return false when the fence token is no longer current
     */
    boolean heartbeat(String jobId, long fenceToken);

    void complete(String jobId, long fenceToken, AttemptOutcome outcome) throws StaleFenceException;

    FailureDisposition fail(String jobId, long fenceToken, JobFailure failure) throws StaleFenceException;

    /**
     * Hands a leased job back without counting the attempt: it returns to WAITING, immediately
     * available, and nothing is added to its history. Used when a worker gives a job up without
     * having run it to a result (capacity, executor rejection, shutdown).
     *
     * @return false when the fence token is no longer current
     */
    boolean release(String jobId, long fenceToken);

    /**
     * Verifies the fence token is current. Callers invoke this inside the store transaction that
     * commits the job's writes, so a stale worker's transaction rolls back.
     */
    void assertFence(String jobId, long fenceToken) throws StaleFenceException;

    /**
     * Returns ACTIVE jobs with expired leases to WAITING, or dead-letters them when out of attempts.
     *
     * @return number of jobs reclaimed
     */
    int reclaimExpiredLeases();

    /**
     * Deletes COMPLETED and DEAD_LETTERED jobs finished before the cutoff, together with their attempt
     * history. Dead-letter entries carry their own copy of the history and are kept.
     *
     * @return number of jobs deleted
     */
    int purgeFinished(Instant finishedBefore);

    Optional<Job> findJob(String jobId);

    List<JobAttempt> findAttempts(String jobId);

    Map<QueueName, QueueStats> stats();

    default long depth(QueueName queue) {
        QueueStats stats = stats().get(queue);
        return stats == null ? 0 : stats.waiting();
    }

    long deadLetterCount();

    List<DeadLetterEntry> findDeadLetters(int limit);

    Optional<DeadLetterEntry> findDeadLetter(String deadLetterId);

    boolean resolveDeadLetter(String deadLetterId, String note);
}

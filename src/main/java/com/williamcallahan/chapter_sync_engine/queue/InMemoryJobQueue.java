package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.exception.StaleFenceException;
import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import com.williamcallahan.chapter_sync_engine.types.FailureDisposition;
import com.williamcallahan.chapter_sync_engine.types.JobStatus;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Process-local job queue used when no datasource is configured and in tests.
 * Same contract as the JDBC queue; state is lost on restart.
 */
@Slf4j
public class InMemoryJobQueue implements JobQueue {

    private static final Comparator<Job> CLAIM_ORDER = Comparator
        .comparingInt(Job::priority)
        .thenComparing(Job::availableAt)
        .thenComparing(Job::createdAt);

    private final SyncEngineProperties.Queue settings;
    private final JobBackoffPolicy backoffPolicy;
    private final Clock clock;

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, String> outstandingKeys = new HashMap<>();
    private final Map<String, List<JobAttempt>> attempts = new HashMap<>();
    private final Map<String, DeadLetterEntry> deadLetters = new LinkedHashMap<>();
    private final AtomicLong fenceSequence = new AtomicLong();

    public InMemoryJobQueue(SyncEngineProperties properties, JobBackoffPolicy backoffPolicy, Clock clock) {
        this.settings = properties.getQueue();
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
    }

    @Override
    public synchronized JobHandle enqueue(JobRequest request) {
        String existingId = outstandingKeys.get(request.idempotencyKey());
        if (existingId != null) {
            log.debug("Job {} already outstanding as {}", request.idempotencyKey(), existingId);
            return new JobHandle(existingId, request.idempotencyKey(), false);
        }
        Instant now = clock.instant();
        Job job = Job.builder()
            .id(IdGenerator.newId())
            .queue(request.queue())
            .idempotencyKey(request.idempotencyKey())
            .sourceName(request.sourceName())
            .payload(request.payload())
            .priority(request.priority())
            .status(JobStatus.WAITING)
            .attempts(0)
            .maxAttempts(settings.jobType(request.queue()).getMaxAttempts())
            .availableAt(now)
            .createdAt(now)
            .build();
        jobs.put(job.id(), job);
        outstandingKeys.put(job.idempotencyKey(), job.id());
        log.debug("Enqueued {} job {} ({})", job.queue(), job.id(), job.idempotencyKey());
        return new JobHandle(job.id(), job.idempotencyKey(), true);
    }

    @Override
    public synchronized Optional<Job> claimNext(QueueName queue, String workerId, Set<String> excludedSources) {
        Instant now = clock.instant();
        skipStaleJobs(queue, now);
        Optional<Job> next = jobs.values().stream()
            .filter(job -> job.queue() == queue && job.status() == JobStatus.WAITING)
            .filter(job -> !job.availableAt().isAfter(now))
            .filter(job -> job.sourceName() == null || !excludedSources.contains(job.sourceName()))
            .min(CLAIM_ORDER);
        if (next.isEmpty()) {
            return Optional.empty();
        }
        Job claimed = next.get().toBuilder()
            .status(JobStatus.ACTIVE)
            .attempts(next.get().attempts() + 1)
            .leaseOwner(workerId)
            .leaseExpiresAt(now.plus(settings.getLeaseDuration()))
            .fenceToken(fenceSequence.incrementAndGet())
            .claimedAt(now)
            .firstClaimedAt(next.get().firstClaimedAt() != null ? next.get().firstClaimedAt() : now)
            .build();
        jobs.put(claimed.id(), claimed);
        return Optional.of(claimed);
    }

    @Override
    public synchronized boolean heartbeat(String jobId, long fenceToken) {
        Job job = jobs.get(jobId);
        if (!isCurrent(job, fenceToken)) {
            return false;
        }
        jobs.put(jobId, job.toBuilder().leaseExpiresAt(clock.instant().plus(settings.getLeaseDuration())).build());
        return true;
    }

    @Override
    public synchronized void complete(String jobId, long fenceToken, AttemptOutcome outcome) {
        Job job = requireCurrent(jobId, fenceToken);
        Instant now = clock.instant();
        recordAttempt(job, outcome, null, null, now);
        finish(job.toBuilder()
            .status(JobStatus.COMPLETED)
            .outcome(outcome)
            .leaseOwner(null)
            .leaseExpiresAt(null)
            .completedAt(now)
            .build());
    }

    @Override
    public synchronized FailureDisposition fail(String jobId, long fenceToken, JobFailure failure) {
        Job job = requireCurrent(jobId, fenceToken);
        Instant now = clock.instant();
        recordAttempt(job, failure.outcome(), failure.category(), failure.safeMessage(), now);
        if (!failure.category().isRetryable() || !job.hasAttemptsLeft()) {
            deadLetter(job, failure.category(), failure.safeMessage(), now);
            return FailureDisposition.DEAD_LETTERED;
        }
        Duration delay = backoffPolicy.delayFor(settings.jobType(job.queue()), job.attempts(), failure.retryAfter());
        jobs.put(jobId, job.toBuilder()
            .status(JobStatus.WAITING)
            .availableAt(now.plus(delay))
            .leaseOwner(null)
            .leaseExpiresAt(null)
            .fenceToken(null)
            .lastError(failure.safeMessage())
            .build());
        log.debug("Job {} attempt {}/{} failed ({}), retrying in {}", jobId, job.attempts(), job.maxAttempts(),
            failure.category(), delay);
        return FailureDisposition.RETRY_SCHEDULED;
    }

    @Override
    public synchronized boolean release(String jobId, long fenceToken) {
        Job job = jobs.get(jobId);
        if (!isCurrent(job, fenceToken)) {
            return false;
        }
        jobs.put(jobId, job.toBuilder()
            .status(JobStatus.WAITING)
            .attempts(job.attempts() - 1)
            .availableAt(clock.instant())
            .leaseOwner(null)
            .leaseExpiresAt(null)
            .fenceToken(null)
            .build());
        return true;
    }

    @Override
    public synchronized void assertFence(String jobId, long fenceToken) {
        requireCurrent(jobId, fenceToken);
    }

    @Override
    public synchronized int reclaimExpiredLeases() {
        Instant now = clock.instant();
        int reclaimed = 0;
        for (Job job : List.copyOf(jobs.values())) {
            if (job.status() != JobStatus.ACTIVE || job.leaseExpiresAt() == null || job.leaseExpiresAt().isAfter(now)) {
                continue;
            }
            recordAttempt(job, AttemptOutcome.LEASE_EXPIRED, ErrorCategory.TRANSIENT, "lease expired", now);
            if (job.hasAttemptsLeft()) {
                jobs.put(job.id(), job.toBuilder()
                    .status(JobStatus.WAITING)
                    .availableAt(now)
                    .leaseOwner(null)
                    .leaseExpiresAt(null)
                    .fenceToken(null)
                    .lastError("lease expired")
                    .build());
            } else {
                deadLetter(job, ErrorCategory.TRANSIENT, "lease expired", now);
            }
            reclaimed++;
        }
        return reclaimed;
    }

    @Override
    public synchronized int purgeFinished(Instant finishedBefore) {
        List<String> finished = jobs.values().stream()
            .filter(job -> job.status() == JobStatus.COMPLETED || job.status() == JobStatus.DEAD_LETTERED)
            .filter(job -> job.completedAt() != null && job.completedAt().isBefore(finishedBefore))
            .map(Job::id)
            .collect(Collectors.toList());
        for (String jobId : finished) {
            jobs.remove(jobId);
            attempts.remove(jobId);
        }
        return finished.size();
    }

    @Override
    public synchronized Optional<Job> findJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized List<JobAttempt> findAttempts(String jobId) {
        return List.copyOf(attempts.getOrDefault(jobId, List.of()));
    }

    @Override
    public synchronized Map<QueueName, QueueStats> stats() {
        Map<QueueName, QueueStats> stats = new EnumMap<>(QueueName.class);
        for (QueueName queue : QueueName.values()) {
            Map<JobStatus, Long> counts = jobs.values().stream()
                .filter(job -> job.queue() == queue)
                .collect(Collectors.groupingBy(Job::status, Collectors.counting()));
            stats.put(queue, new QueueStats(
                counts.getOrDefault(JobStatus.WAITING, 0L),
                counts.getOrDefault(JobStatus.ACTIVE, 0L),
                counts.getOrDefault(JobStatus.COMPLETED, 0L),
                counts.getOrDefault(JobStatus.DEAD_LETTERED, 0L)));
        }
        return stats;
    }

    @Override
    public synchronized long deadLetterCount() {
        return deadLetters.values().stream().filter(entry -> !entry.isResolved()).count();
    }

    @Override
    public synchronized List<DeadLetterEntry> findDeadLetters(int limit) {
        return deadLetters.values().stream()
            .filter(entry -> !entry.isResolved())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<DeadLetterEntry> findDeadLetter(String deadLetterId) {
        return Optional.ofNullable(deadLetters.get(deadLetterId));
    }

    @Override
    public synchronized boolean resolveDeadLetter(String deadLetterId, String note) {
        DeadLetterEntry entry = deadLetters.get(deadLetterId);
        if (entry == null || entry.isResolved()) {
            return false;
        }
        deadLetters.put(deadLetterId, entry.toBuilder().resolvedAt(clock.instant()).resolutionNote(note).build());
        return true;
    }

    private void skipStaleJobs(QueueName queue, Instant now) {
        Instant cutoff = now.minus(settings.getMaxJobAge());
        for (Job job : List.copyOf(jobs.values())) {
            if (job.queue() == queue && job.status() == JobStatus.WAITING
                    && job.firstClaimedAt() == null && job.createdAt().isBefore(cutoff)) {
                log.info("Skipping {} job {}: never claimed within {}", queue, job.id(), settings.getMaxJobAge());
                finish(job.toBuilder().status(JobStatus.COMPLETED).outcome(AttemptOutcome.SKIPPED).completedAt(now).build());
            }
        }
    }

    private void deadLetter(Job job, ErrorCategory category, String message, Instant now) {
        DeadLetterEntry entry = DeadLetterEntry.builder()
            .id(IdGenerator.newId())
            .jobId(job.id())
            .queue(job.queue())
            .idempotencyKey(job.idempotencyKey())
            .sourceName(job.sourceName())
            .payload(job.payload())
            .priority(job.priority())
            .category(category)
            .message(message)
            .attempts(job.attempts())
            .attemptHistory(attempts.getOrDefault(job.id(), List.of()))
            .deadLetteredAt(now)
            .build();
        deadLetters.put(entry.id(), entry);
        finish(job.toBuilder()
            .status(JobStatus.DEAD_LETTERED)
            .outcome(AttemptOutcome.FAILED)
            .leaseOwner(null)
            .leaseExpiresAt(null)
            .lastError(message)
            .completedAt(now)
            .build());
        log.error("Dead-lettered {} job {} ({}) after {} attempts: {} {}", job.queue(), job.id(), job.idempotencyKey(),
            job.attempts(), category, message);
    }

    private void finish(Job job) {
        jobs.put(job.id(), job);
        outstandingKeys.remove(job.idempotencyKey(), job.id());
    }

    private void recordAttempt(Job job, AttemptOutcome outcome, ErrorCategory category, String message, Instant now) {
        attempts.computeIfAbsent(job.id(), id -> new ArrayList<>()).add(new JobAttempt(
            job.attempts(), job.leaseOwner(), job.fenceToken(), outcome, category, message, job.claimedAt(), now));
    }

    private Job requireCurrent(String jobId, long fenceToken) {
        Job job = jobs.get(jobId);
        if (!isCurrent(job, fenceToken)) {
            throw new StaleFenceException(jobId, fenceToken);
        }
        return job;
    }

    private static boolean isCurrent(Job job, long fenceToken) {
        return job != null && job.status() == JobStatus.ACTIVE && job.fenceToken() != null && job.fenceToken() == fenceToken;
    }
}

/**
 * Postgres-backed durable job queue
 *
 * Features:
 * - Idempotent enqueue through a partial unique index over outstanding idempotency keys
 * - Claims use FOR UPDATE SKIP LOCKED so concurrent workers never lease the same row
 * - Every claim draws a fence token from sync_job_fence_seq; stale tokens are rejected on write
 * - Attempt history lives in sync_job_attempts and is copied into the dead-letter record as JSON
 * - Jobs not claimed within the maximum job age are completed as SKIPPED
 */

package com.williamcallahan.chapter_sync_engine.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.exception.StaleFenceException;
import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import com.williamcallahan.chapter_sync_engine.types.FailureDisposition;
import com.williamcallahan.chapter_sync_engine.types.JobStatus;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.util.IdGenerator;
import com.williamcallahan.chapter_sync_engine.util.JdbcUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
public class JdbcJobQueue implements JobQueue {

    private static final TypeReference<Map<String, String>> PAYLOAD_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<JobAttempt>> HISTORY_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final SyncEngineProperties.Queue settings;
    private final JobBackoffPolicy backoffPolicy;
    private final Clock clock;

    private final RowMapper<Job> jobMapper = this::mapJob;
    private final RowMapper<JobAttempt> attemptMapper = this::mapAttempt;
    private final RowMapper<DeadLetterEntry> deadLetterMapper = this::mapDeadLetter;

    public JdbcJobQueue(JdbcTemplate jdbcTemplate,
                        PlatformTransactionManager transactionManager,
                        ObjectMapper objectMapper,
                        SyncEngineProperties properties,
                        JobBackoffPolicy backoffPolicy,
                        Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.settings = properties.getQueue();
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
    }

    @Override
    public JobHandle enqueue(JobRequest request) {
        Instant now = clock.instant();
        List<String> inserted = jdbcTemplate.query(
            """
            INSERT INTO sync_jobs (id, queue_name, idempotency_key, source_name, payload, priority, status,
                                   attempts, max_attempts, available_at, created_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?, 'WAITING', 0, ?, ?, ?)
            ON CONFLICT (idempotency_key) WHERE status IN ('WAITING', 'ACTIVE') DO NOTHING
            RETURNING id
            """,
            (rs, rowNum) -> rs.getString("id"),
            IdGenerator.newId(),
            request.queue().queueId(),
            request.idempotencyKey(),
            request.sourceName(),
            writeJson(request.payload()),
            request.priority(),
            settings.jobType(request.queue()).getMaxAttempts(),
            JdbcUtils.timestamp(now),
            JdbcUtils.timestamp(now));
        if (!inserted.isEmpty()) {
            log.debug("Enqueued {} job {} ({})", request.queue(), inserted.get(0), request.idempotencyKey());
            return new JobHandle(inserted.get(0), request.idempotencyKey(), true);
        }
        String existingId = JdbcUtils.queryForOptional(jdbcTemplate,
                "SELECT id FROM sync_jobs WHERE idempotency_key = ? AND status IN ('WAITING', 'ACTIVE')",
                String.class, request.idempotencyKey())
            .orElse(null);
        log.debug("Job {} already outstanding as {}", request.idempotencyKey(), existingId);
        return new JobHandle(existingId, request.idempotencyKey(), false);
    }

    @Override
    public Optional<Job> claimNext(QueueName queue, String workerId, Set<String> excludedSources) {
        Instant now = clock.instant();
        int skipped = jdbcTemplate.update(
            """
            UPDATE sync_jobs
            SET status = 'COMPLETED', outcome = 'SKIPPED', completed_at = ?
            WHERE queue_name = ? AND status = 'WAITING' AND first_claimed_at IS NULL AND created_at < ?
            """,
            JdbcUtils.timestamp(now), queue.queueId(), JdbcUtils.timestamp(now.minus(settings.getMaxJobAge())));
        if (skipped > 0) {
            log.info("Skipped {} {} jobs never claimed within {}", skipped, queue, settings.getMaxJobAge());
        }
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            """
            UPDATE sync_jobs j
            SET status = 'ACTIVE',
                attempts = j.attempts + 1,
                lease_owner = ?,
                lease_expires_at = ?,
                fence_token = nextval('sync_job_fence_seq'),
                claimed_at = ?,
                first_claimed_at = COALESCE(j.first_claimed_at, ?)
            WHERE j.id = (
                SELECT id FROM sync_jobs
                WHERE queue_name = ? AND status = 'WAITING' AND available_at <= ?
                  AND (source_name IS NULL OR NOT (source_name = ANY(?)))
                ORDER BY priority ASC, available_at ASC, created_at ASC
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING j.*
            """,
            jobMapper,
            workerId,
            JdbcUtils.timestamp(now.plus(settings.getLeaseDuration())),
            JdbcUtils.timestamp(now),
            JdbcUtils.timestamp(now),
            queue.queueId(),
            JdbcUtils.timestamp(now),
            excludedSources.toArray(new String[0]));
    }

    @Override
    public boolean heartbeat(String jobId, long fenceToken) {
        return JdbcUtils.executeUpdate(jdbcTemplate,
            "UPDATE sync_jobs SET lease_expires_at = ? WHERE id = ? AND fence_token = ? AND status = 'ACTIVE'",
            JdbcUtils.timestamp(clock.instant().plus(settings.getLeaseDuration())), jobId, fenceToken);
    }

    @Override
    public void complete(String jobId, long fenceToken, AttemptOutcome outcome) {
        transactionTemplate.executeWithoutResult(status -> {
            Job job = lockCurrent(jobId, fenceToken);
            Instant now = clock.instant();
            insertAttempt(job, outcome, null, null, now);
            jdbcTemplate.update(
                """
                UPDATE sync_jobs
                SET status = 'COMPLETED', outcome = ?, lease_owner = NULL, lease_expires_at = NULL, completed_at = ?
                WHERE id = ?
                """,
                outcome.name(), JdbcUtils.timestamp(now), jobId);
        });
    }

    @Override
    public FailureDisposition fail(String jobId, long fenceToken, JobFailure failure) {
        return transactionTemplate.execute(status -> {
            Job job = lockCurrent(jobId, fenceToken);
            Instant now = clock.instant();
            insertAttempt(job, failure.outcome(), failure.category(), failure.safeMessage(), now);
            if (!failure.category().isRetryable() || !job.hasAttemptsLeft()) {
                deadLetter(job, failure.category(), failure.safeMessage(), now);
                return FailureDisposition.DEAD_LETTERED;
            }
            Duration delay = backoffPolicy.delayFor(settings.jobType(job.queue()), job.attempts(), failure.retryAfter());
            scheduleRetry(jobId, now.plus(delay), failure.safeMessage());
            log.debug("Job {} attempt {}/{} failed ({}), retrying in {}", jobId, job.attempts(), job.maxAttempts(),
                failure.category(), delay);
            return FailureDisposition.RETRY_SCHEDULED;
        });
    }

    @Override
    public boolean release(String jobId, long fenceToken) {
        return JdbcUtils.executeUpdate(jdbcTemplate,
            """
            UPDATE sync_jobs
            SET status = 'WAITING', attempts = attempts - 1, available_at = ?, lease_owner = NULL,
                lease_expires_at = NULL, fence_token = NULL
            WHERE id = ? AND fence_token = ? AND status = 'ACTIVE'
            """,
            JdbcUtils.timestamp(clock.instant()), jobId, fenceToken);
    }

    @Override
    public void assertFence(String jobId, long fenceToken) {
        lockCurrent(jobId, fenceToken);
    }

    @Override
    public int reclaimExpiredLeases() {
        Integer reclaimed = transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            List<Job> expired = jdbcTemplate.query(
                """
                SELECT * FROM sync_jobs
                WHERE status = 'ACTIVE' AND lease_expires_at <= ?
                FOR UPDATE SKIP LOCKED
                """,
                jobMapper, JdbcUtils.timestamp(now));
            for (Job job : expired) {
                insertAttempt(job, AttemptOutcome.LEASE_EXPIRED, ErrorCategory.TRANSIENT, "lease expired", now);
                if (job.hasAttemptsLeft()) {
                    scheduleRetry(job.id(), now, "lease expired");
                } else {
                    deadLetter(job, ErrorCategory.TRANSIENT, "lease expired", now);
                }
            }
            return expired.size();
        });
        return reclaimed == null ? 0 : reclaimed;
    }

    @Override
    public int purgeFinished(Instant finishedBefore) {
        // sync_job_attempts rows go with their job through ON DELETE CASCADE
        return jdbcTemplate.update(
            "DELETE FROM sync_jobs WHERE status IN ('COMPLETED', 'DEAD_LETTERED') AND completed_at < ?",
            JdbcUtils.timestamp(finishedBefore));
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate, "SELECT * FROM sync_jobs WHERE id = ?", jobMapper, jobId);
    }

    @Override
    public List<JobAttempt> findAttempts(String jobId) {
        return jdbcTemplate.query("SELECT * FROM sync_job_attempts WHERE job_id = ? ORDER BY attempt, id",
            attemptMapper, jobId);
    }

    @Override
    public Map<QueueName, QueueStats> stats() {
        Map<QueueName, QueueStats> stats = new EnumMap<>(QueueName.class);
        for (QueueName queue : QueueName.values()) {
            stats.put(queue, new QueueStats(0, 0, 0, 0));
        }
        jdbcTemplate.query(
            """
            SELECT queue_name,
                COUNT(*) FILTER (WHERE status = 'WAITING') AS waiting,
                COUNT(*) FILTER (WHERE status = 'ACTIVE') AS active,
                COUNT(*) FILTER (WHERE status = 'COMPLETED') AS completed,
                COUNT(*) FILTER (WHERE status = 'DEAD_LETTERED') AS dead_lettered
            FROM sync_jobs
            GROUP BY queue_name
            """,
            rs -> {
                stats.put(QueueName.fromQueueId(rs.getString("queue_name")), new QueueStats(
                    rs.getLong("waiting"),
                    rs.getLong("active"),
                    rs.getLong("completed"),
                    rs.getLong("dead_lettered")));
            });
        return stats;
    }

    @Override
    public long deadLetterCount() {
        return JdbcUtils.queryForCount(jdbcTemplate, "SELECT COUNT(*) FROM dead_letter_jobs WHERE resolved_at IS NULL");
    }

    @Override
    public List<DeadLetterEntry> findDeadLetters(int limit) {
        return jdbcTemplate.query(
            "SELECT * FROM dead_letter_jobs WHERE resolved_at IS NULL ORDER BY dead_lettered_at LIMIT ?",
            deadLetterMapper, limit);
    }

    @Override
    public Optional<DeadLetterEntry> findDeadLetter(String deadLetterId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate, "SELECT * FROM dead_letter_jobs WHERE id = ?",
            deadLetterMapper, deadLetterId);
    }

    @Override
    public boolean resolveDeadLetter(String deadLetterId, String note) {
        return JdbcUtils.executeUpdate(jdbcTemplate,
            "UPDATE dead_letter_jobs SET resolved_at = ?, resolution_note = ? WHERE id = ? AND resolved_at IS NULL",
            JdbcUtils.timestamp(clock.instant()), note, deadLetterId);
    }

    private Job lockCurrent(String jobId, long fenceToken) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
                "SELECT * FROM sync_jobs WHERE id = ? AND status = 'ACTIVE' AND fence_token = ? FOR UPDATE",
                jobMapper, jobId, fenceToken)
            .orElseThrow(() -> new StaleFenceException(jobId, fenceToken));
    }

    private void scheduleRetry(String jobId, Instant availableAt, String message) {
        jdbcTemplate.update(
            """
            UPDATE sync_jobs
            SET status = 'WAITING', available_at = ?, lease_owner = NULL, lease_expires_at = NULL,
                fence_token = NULL, last_error = ?
            WHERE id = ?
            """,
            JdbcUtils.timestamp(availableAt), message, jobId);
    }

    private void insertAttempt(Job job, AttemptOutcome outcome, ErrorCategory category, String message, Instant now) {
        jdbcTemplate.update(
            """
            INSERT INTO sync_job_attempts (job_id, attempt, worker_id, fence_token, outcome, category, message,
                                           started_at, finished_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            job.id(),
            job.attempts(),
            job.leaseOwner(),
            job.fenceToken(),
            outcome.name(),
            category == null ? null : category.name(),
            message,
            JdbcUtils.timestamp(job.claimedAt()),
            JdbcUtils.timestamp(now));
    }

    private void deadLetter(Job job, ErrorCategory category, String message, Instant now) {
        List<JobAttempt> history = findAttempts(job.id());
        jdbcTemplate.update(
            """
            INSERT INTO dead_letter_jobs (id, job_id, queue_name, idempotency_key, source_name, payload, priority,
                                          category, message, attempts, attempt_history, dead_lettered_at)
            VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?::jsonb, ?)
            """,
            IdGenerator.newId(),
            job.id(),
            job.queue().queueId(),
            job.idempotencyKey(),
            job.sourceName(),
            writeJson(job.payload()),
            job.priority(),
            category.name(),
            message,
            job.attempts(),
            writeJson(history),
            JdbcUtils.timestamp(now));
        jdbcTemplate.update(
            """
            UPDATE sync_jobs
            SET status = 'DEAD_LETTERED', outcome = 'FAILED', lease_owner = NULL, lease_expires_at = NULL,
                last_error = ?, completed_at = ?
            WHERE id = ?
            """,
            message, JdbcUtils.timestamp(now), job.id());
        log.error("Dead-lettered {} job {} ({}) after {} attempts: {} {}", job.queue(), job.id(), job.idempotencyKey(),
            job.attempts(), category, message);
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize job data", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read stored job data", e);
        }
    }

    private Job mapJob(ResultSet rs, int rowNum) throws SQLException {
        long fence = rs.getLong("fence_token");
        Long fenceToken = rs.wasNull() ? null : fence;
        String outcome = rs.getString("outcome");
        return Job.builder()
            .id(rs.getString("id"))
            .queue(QueueName.fromQueueId(rs.getString("queue_name")))
            .idempotencyKey(rs.getString("idempotency_key"))
            .sourceName(rs.getString("source_name"))
            .payload(readJson(rs.getString("payload"), PAYLOAD_TYPE))
            .priority(rs.getInt("priority"))
            .status(JobStatus.valueOf(rs.getString("status")))
            .attempts(rs.getInt("attempts"))
            .maxAttempts(rs.getInt("max_attempts"))
            .availableAt(JdbcUtils.instant(rs, "available_at"))
            .leaseOwner(rs.getString("lease_owner"))
            .leaseExpiresAt(JdbcUtils.instant(rs, "lease_expires_at"))
            .fenceToken(fenceToken)
            .lastError(rs.getString("last_error"))
            .outcome(outcome == null ? null : AttemptOutcome.valueOf(outcome))
            .createdAt(JdbcUtils.instant(rs, "created_at"))
            .claimedAt(JdbcUtils.instant(rs, "claimed_at"))
            .firstClaimedAt(JdbcUtils.instant(rs, "first_claimed_at"))
            .completedAt(JdbcUtils.instant(rs, "completed_at"))
            .build();
    }

    private JobAttempt mapAttempt(ResultSet rs, int rowNum) throws SQLException {
        long fence = rs.getLong("fence_token");
        Long fenceToken = rs.wasNull() ? null : fence;
        String category = rs.getString("category");
        return new JobAttempt(
            rs.getInt("attempt"),
            rs.getString("worker_id"),
            fenceToken,
            AttemptOutcome.valueOf(rs.getString("outcome")),
            category == null ? null : ErrorCategory.valueOf(category),
            rs.getString("message"),
            JdbcUtils.instant(rs, "started_at"),
            JdbcUtils.instant(rs, "finished_at"));
    }

    private DeadLetterEntry mapDeadLetter(ResultSet rs, int rowNum) throws SQLException {
        return DeadLetterEntry.builder()
            .id(rs.getString("id"))
            .jobId(rs.getString("job_id"))
            .queue(QueueName.fromQueueId(rs.getString("queue_name")))
            .idempotencyKey(rs.getString("idempotency_key"))
            .sourceName(rs.getString("source_name"))
            .payload(readJson(rs.getString("payload"), PAYLOAD_TYPE))
            .priority(rs.getInt("priority"))
            .category(ErrorCategory.valueOf(rs.getString("category")))
            .message(rs.getString("message"))
            .attempts(rs.getInt("attempts"))
            .attemptHistory(readJson(rs.getString("attempt_history"), HISTORY_TYPE))
            .deadLetteredAt(JdbcUtils.instant(rs, "dead_lettered_at"))
            .resolvedAt(JdbcUtils.instant(rs, "resolved_at"))
            .resolutionNote(rs.getString("resolution_note"))
            .build();
    }
}

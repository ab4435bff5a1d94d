/**
 * Claims jobs from the queue and runs them on the sync worker executor
 *
 * Features:
 * - Claims only while the global, per-queue and per-source caps have room
 * - Skips jobs of sources whose circuit breaker is open or that are at their cap
 * - Passes every handler a fence guard bound to the job's current fence token
 * - Heartbeats running jobs; a lost lease cancels the local run
 * - Gives up on jobs that exceed their type's timeout and fails them as TIMED_OUT
 * - Drains in-flight jobs on shutdown, then releases the leases of whatever is left
 */

package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.concurrency.FenceGuard;
import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.exception.LockUnavailableException;
import com.williamcallahan.chapter_sync_engine.exception.StaleFenceException;
import com.williamcallahan.chapter_sync_engine.monitoring.MetricsService;
import com.williamcallahan.chapter_sync_engine.service.ErrorClassifier;
import com.williamcallahan.chapter_sync_engine.service.SourceCircuitBreakerService;
import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import com.williamcallahan.chapter_sync_engine.types.FailureDisposition;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
public class WorkerPool {

    private static final long DRAIN_POLL_MILLIS = 50;

    private final JobQueue jobQueue;
    private final Map<QueueName, JobHandler> handlers = new EnumMap<>(QueueName.class);
    private final ConcurrencyLimiter limiter;
    private final SourceCircuitBreakerService circuitBreaker;
    private final ErrorClassifier errorClassifier;
    private final MetricsService metricsService;
    private final AsyncTaskExecutor executor;
    private final String workerId;
    private final SyncEngineProperties.Queue settings;
    private final Clock clock;

    private final Map<String, ActiveJob> active = new ConcurrentHashMap<>();
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public WorkerPool(JobQueue jobQueue,
                      List<JobHandler> jobHandlers,
                      ConcurrencyLimiter limiter,
                      SourceCircuitBreakerService circuitBreaker,
                      ErrorClassifier errorClassifier,
                      MetricsService metricsService,
                      @Qualifier("syncWorkerExecutor") AsyncTaskExecutor executor,
                      WorkerIdentity workerIdentity,
                      SyncEngineProperties properties,
                      Clock clock) {
        this.jobQueue = jobQueue;
        for (JobHandler handler : jobHandlers) {
            JobHandler previous = handlers.put(handler.queue(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for queue " + handler.queue().queueId()
                    + ": " + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        this.limiter = limiter;
        this.circuitBreaker = circuitBreaker;
        this.errorClassifier = errorClassifier;
        this.metricsService = metricsService;
        this.executor = executor;
        this.workerId = workerIdentity.workerId();
        this.settings = properties.getQueue();
        this.clock = clock;
    }

    /**
     * Claims and starts as many jobs as the caps allow.
     *
     * @return number of jobs started
     */
    public synchronized int pollOnce() {
        int started = 0;
        for (QueueName queue : handlers.keySet()) {
            while (accepting.get() && limiter.hasCapacity(queue)) {
                Set<String> excluded = new HashSet<>(limiter.saturatedSources());
                excluded.addAll(circuitBreaker.blockedSources());
                Optional<Job> claimed = jobQueue.claimNext(queue, workerId, excluded);
                if (claimed.isEmpty()) {
                    break;
                }
                Job job = claimed.get();
                if (!limiter.tryAcquire(queue, job.sourceName())) {
                    releaseLease(job, "worker at capacity");
                    break;
                }
                start(job);
                started++;
            }
        }
        if (started > 0) {
            log.debug("Worker {} started {} job(s), {} running", workerId, started, limiter.running());
        }
        return started;
    }

    /**
     * Extends the lease of every running job. A job whose fence is no longer current is cancelled locally;
     * its writes fail the fence check and roll back.
     */
    public void heartbeatActiveJobs() {
        for (ActiveJob activeJob : active.values()) {
            if (activeJob.isAbandoned()) {
                continue;
            }
            Job job = activeJob.job();
            try {
                if (!jobQueue.heartbeat(job.id(), job.fenceToken())) {
                    log.warn("Lost lease on {} job {} (fence {}); cancelling local run",
                        job.queue().queueId(), job.id(), job.fenceToken());
                    activeJob.abandon();
                    activeJob.cancel();
                }
            } catch (RuntimeException e) {
                LoggingUtils.warn(log, e, "Heartbeat failed for job {}", job.id());
            }
        }
    }

    /**
     * Fails running jobs that have exceeded their type's timeout.
     *
     * @return number of jobs timed out
     */
    public int enforceTimeouts() {
        Instant now = clock.instant();
        int timedOut = 0;
        for (ActiveJob activeJob : active.values()) {
            Job job = activeJob.job();
            Duration timeout = settings.jobType(job.queue()).getTimeout();
            if (activeJob.isAbandoned() || !now.isAfter(activeJob.startedAt().plus(timeout))) {
                continue;
            }
            activeJob.abandon();
            log.warn("{} job {} exceeded its {} timeout on attempt {}", job.queue().queueId(), job.id(), timeout,
                job.attempts());
            try {
                FailureDisposition disposition = jobQueue.fail(job.id(), job.fenceToken(),
                    JobFailure.timedOut("timed out after " + timeout));
                metricsService.recordJobOutcome(job.queue(), AttemptOutcome.TIMED_OUT);
                metricsService.recordJobFailure(job.queue(), ErrorCategory.TRANSIENT,
                    disposition == FailureDisposition.DEAD_LETTERED);
            } catch (StaleFenceException e) {
                log.info("Timed out job {} had already lost its lease", job.id());
            }
            activeJob.cancel();
            timedOut++;
        }
        return timedOut;
    }

    /**
     * Stops claiming, waits for running jobs to finish, then cancels the rest and hands their leases back.
     *
     * @return true when every job finished within the timeout
     */
    public boolean shutdown(Duration timeout) {
        if (!accepting.compareAndSet(true, false)) {
            return active.isEmpty();
        }
        log.info("Worker {} draining {} running job(s), waiting up to {}", workerId, active.size(), timeout);
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!active.isEmpty() && System.nanoTime() < deadline) {
            try {
                TimeUnit.MILLISECONDS.sleep(DRAIN_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining worker {}", workerId);
                break;
            }
        }
        if (active.isEmpty()) {
            log.info("Worker {} drained cleanly", workerId);
            return true;
        }
        log.warn("Worker {} cancelling {} job(s) still running after {}: {}", workerId, active.size(), timeout,
            new TreeSet<>(active.keySet()));
        for (ActiveJob activeJob : active.values()) {
            if (activeJob.isAbandoned()) {
                continue;
            }
            activeJob.abandon();
            releaseLease(activeJob.job(), "worker shutdown");
            activeJob.cancel();
        }
        return false;
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    public int activeCount() {
        return active.size();
    }

    public Set<String> activeJobIds() {
        return Set.copyOf(active.keySet());
    }

    public String workerId() {
        return workerId;
    }

    private void start(Job job) {
        ActiveJob activeJob = new ActiveJob(job, clock.instant());
        active.put(job.id(), activeJob);
        metricsService.incrementActiveJobs();
        FenceGuard fence = () -> jobQueue.assertFence(job.id(), job.fenceToken());
        JobContext context = new JobContext(job, workerId, fence);
        try {
            activeJob.attach(executor.submit(() -> run(activeJob, context)));
        } catch (TaskRejectedException e) {
            LoggingUtils.warn(log, e, "Executor rejected job {}", job.id());
            activeJob.abandon();
            releaseLease(job, "executor rejected job");
            finish(activeJob);
        }
    }

    private void run(ActiveJob activeJob, JobContext context) {
        Job job = context.job();
        JobHandler handler = handlers.get(job.queue());
        try {
            AttemptOutcome outcome = handler.handle(context);
            if (activeJob.isAbandoned()) {
                log.info("Job {} finished after its lease was given up; result discarded", job.id());
                return;
            }
            complete(job, outcome);
        } catch (Exception e) {
            Throwable error = ErrorClassifier.unwrap(e);
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (activeJob.isAbandoned()) {
                log.debug("Abandoned job {} ended with {}", job.id(), error.getClass().getSimpleName());
            } else if (error instanceof LockUnavailableException) {
                log.info("{} job {} skipped: {}", job.queue().queueId(), job.id(), error.getMessage());
                complete(job, AttemptOutcome.SKIPPED);
            } else if (error instanceof StaleFenceException) {
                log.warn("{} job {} lost its lease mid-run; uncommitted writes rolled back",
                    job.queue().queueId(), job.id());
            } else {
                failJob(job, e);
            }
        } finally {
            finish(activeJob);
        }
    }

    private void complete(Job job, AttemptOutcome outcome) {
        try {
            jobQueue.complete(job.id(), job.fenceToken(), outcome);
            metricsService.recordJobOutcome(job.queue(), outcome);
            log.debug("{} job {} completed as {} on attempt {}", job.queue().queueId(), job.id(), outcome,
                job.attempts());
        } catch (StaleFenceException e) {
            log.warn("{} job {} finished but its lease had moved on; completion ignored",
                job.queue().queueId(), job.id());
        }
    }

    private void failJob(Job job, Exception e) {
        JobFailure failure = errorClassifier.toJobFailure(e);
        if (failure.category() == ErrorCategory.TRANSIENT) {
            log.warn("{} job {} failed on attempt {}/{}: {}", job.queue().queueId(), job.id(), job.attempts(),
                job.maxAttempts(), LoggingUtils.describe(e));
        } else {
            LoggingUtils.error(log, e, "{} job {} failed with {} error on attempt {}", job.queue().queueId(),
                job.id(), failure.category(), job.attempts());
        }
        try {
            FailureDisposition disposition = jobQueue.fail(job.id(), job.fenceToken(), failure);
            metricsService.recordJobOutcome(job.queue(), AttemptOutcome.FAILED);
            metricsService.recordJobFailure(job.queue(), failure.category(),
                disposition == FailureDisposition.DEAD_LETTERED);
            if (disposition == FailureDisposition.DEAD_LETTERED) {
                log.error("{} job {} dead-lettered ({})", job.queue().queueId(), job.id(), failure.safeMessage());
            }
        } catch (StaleFenceException stale) {
            log.warn("{} job {} failed after its lease had moved on; failure not recorded",
                job.queue().queueId(), job.id());
        }
    }

    private void releaseLease(Job job, String reason) {
        try {
            if (jobQueue.release(job.id(), job.fenceToken())) {
                log.debug("Released job {} back to the queue ({})", job.id(), reason);
            } else {
                log.debug("Lease on job {} already gone ({})", job.id(), reason);
            }
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Could not release lease on job {}; it returns once the lease expires", job.id());
        }
    }

    private void finish(ActiveJob activeJob) {
        if (active.remove(activeJob.job().id(), activeJob)) {
            limiter.release(activeJob.job().queue(), activeJob.job().sourceName());
            metricsService.decrementActiveJobs();
        }
    }

    private static final class ActiveJob {

        private final Job job;
        private final Instant startedAt;
        private final AtomicBoolean abandoned = new AtomicBoolean(false);
        private volatile Future<?> future;

        ActiveJob(Job job, Instant startedAt) {
            this.job = job;
            this.startedAt = startedAt;
        }

        Job job() {
            return job;
        }

        Instant startedAt() {
            return startedAt;
        }

        boolean isAbandoned() {
            return abandoned.get();
        }

        void abandon() {
            abandoned.set(true);
        }

        void attach(Future<?> future) {
            this.future = future;
        }

        void cancel() {
            Future<?> running = future;
            if (running != null) {
                running.cancel(true);
            }
        }
    }
}

package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.exception.LockUnavailableException;
import com.williamcallahan.chapter_sync_engine.exception.SourceNetworkException;
import com.williamcallahan.chapter_sync_engine.model.Series;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.testutil.FakeSourceClient;
import com.williamcallahan.chapter_sync_engine.testutil.SyncTestEngine;
import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.CircuitState;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import com.williamcallahan.chapter_sync_engine.types.JobStatus;
import com.williamcallahan.chapter_sync_engine.types.MetadataStatus;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncStatus;
import com.williamcallahan.chapter_sync_engine.types.SyncType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.candidate;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.chapters;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.series;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.source;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test suite for WorkerPool claiming, outcomes, timeouts and draining
 */
class WorkerPoolTest {

    private FakeSourceClient mangadex;
    private SyncTestEngine engine;
    private ThreadPoolTaskExecutor threads;

    @BeforeEach
    void setUp() {
        mangadex = new FakeSourceClient("mangadex");
        engine = new SyncTestEngine(mangadex);
    }

    @AfterEach
    void tearDown() {
        if (threads != null) {
            threads.shutdown();
        }
        engine.close();
    }

    @Test
    void newSourceFlowsThroughCanonicalizeEnrichAndSync() {
        mangadex.withSeries(candidate("mangadex", "sl", "Solo Leveling").language("ko").build())
            .withChapters("sl", chapters(1, 3));
        WorkerPool pool = inlinePool(realHandlers());
        engine.queue.enqueue(JobPayloads.canonicalize("mangadex", "sl", null));

        int started = 0;
        int round;
        while ((round = pool.pollOnce()) > 0) {
            started += round;
        }

        assertEquals(3, started);
        SeriesSource source = engine.store.findSourceByIdentity("mangadex", "sl").orElseThrow();
        assertEquals(MetadataStatus.ENRICHED, source.metadataStatus());
        assertEquals(3, source.chapterCount());
        assertEquals("ko", engine.store.findSeries(source.seriesId()).orElseThrow().language());
        engine.queue.stats().values().forEach(stats -> assertEquals(0, stats.waiting() + stats.active()));
    }

    @Test
    void lockContention_completesTheJobAsSkipped() {
        WorkerPool pool = inlinePool(List.of(handler(QueueName.SYNC_SOURCE, context -> {
            throw new LockUnavailableException("series source src-1", 42L);
        })));
        JobHandle handle = engine.queue.enqueue(
            JobPayloads.syncSource("src-1", "mangadex", SyncType.INCREMENTAL, SyncPriority.WARM));

        pool.pollOnce();

        Job job = engine.queue.findJob(handle.jobId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(AttemptOutcome.SKIPPED, job.outcome());
    }

    @Test
    void transientFailure_returnsTheJobForRetryWithBackoff() {
        WorkerPool pool = inlinePool(List.of(handler(QueueName.SYNC_SOURCE, context -> {
            throw new SourceNetworkException("mangadex", "connection reset");
        })));
        JobHandle handle = engine.queue.enqueue(
            JobPayloads.syncSource("src-1", "mangadex", SyncType.INCREMENTAL, SyncPriority.WARM));

        pool.pollOnce();

        Job job = engine.queue.findJob(handle.jobId()).orElseThrow();
        assertEquals(JobStatus.WAITING, job.status());
        assertEquals(1, job.attempts());
        assertTrue(job.availableAt().isAfter(engine.clock.instant()));
        assertEquals(AttemptOutcome.FAILED, engine.queue.findAttempts(handle.jobId()).get(0).outcome());
        assertEquals(0, pool.activeCount());
    }

    @Test
    void jobsOfSourcesWithAnOpenCircuitStayQueued() {
        WorkerPool pool = inlinePool(List.of(handler(QueueName.SYNC_SOURCE, context -> AttemptOutcome.SUCCEEDED)));
        for (int i = 0; i < 5; i++) {
            engine.circuitBreaker.recordFailure("mangadex");
        }
        JobHandle blocked = engine.queue.enqueue(
            JobPayloads.syncSource("src-1", "mangadex", SyncType.INCREMENTAL, SyncPriority.HOT));
        JobHandle other = engine.queue.enqueue(
            JobPayloads.syncSource("src-2", "comick", SyncType.INCREMENTAL, SyncPriority.COLD));

        assertEquals(1, pool.pollOnce());

        assertEquals(JobStatus.WAITING, engine.queue.findJob(blocked.jobId()).orElseThrow().status());
        assertEquals(JobStatus.COMPLETED, engine.queue.findJob(other.jobId()).orElseThrow().status());
    }

    @Test
    void perSourceCapLimitsConcurrentJobs() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        WorkerPool pool = threadedPool(List.of(handler(QueueName.SYNC_SOURCE, context -> {
            release.await(5, TimeUnit.SECONDS);
            return AttemptOutcome.SUCCEEDED;
        })));
        for (int i = 0; i < 3; i++) {
            engine.queue.enqueue(JobPayloads.syncSource("src-" + i, "mangadex", SyncType.INCREMENTAL, SyncPriority.WARM));
        }

        assertEquals(2, pool.pollOnce());
        assertEquals(0, pool.pollOnce());

        release.countDown();
        waitUntil(() -> pool.activeCount() == 0);
        assertEquals(1, pool.pollOnce());
    }

    @Test
    void overrunningJob_isTimedOutAndReturnedToTheQueue() {
        CountDownLatch interrupted = new CountDownLatch(1);
        WorkerPool pool = threadedPool(List.of(handler(QueueName.ENRICH_METADATA, context -> {
            try {
                new CountDownLatch(1).await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return AttemptOutcome.SUCCEEDED;
        })));
        JobHandle handle = engine.queue.enqueue(JobPayloads.enrichMetadata("src-1", "mangadex"));
        pool.pollOnce();

        assertEquals(0, pool.enforceTimeouts());
        engine.clock.advance(Duration.ofMinutes(1).plusSeconds(1));
        assertEquals(1, pool.enforceTimeouts());

        List<JobAttempt> attempts = engine.queue.findAttempts(handle.jobId());
        assertEquals(AttemptOutcome.TIMED_OUT, attempts.get(0).outcome());
        assertEquals(JobStatus.WAITING, engine.queue.findJob(handle.jobId()).orElseThrow().status());
        waitUntil(() -> interrupted.getCount() == 0 && pool.activeCount() == 0);
    }

    @Test
    void lostLease_cancelsTheLocalRun() {
        CountDownLatch interrupted = new CountDownLatch(1);
        WorkerPool pool = threadedPool(List.of(handler(QueueName.SYNC_SOURCE, context -> {
            try {
                new CountDownLatch(1).await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return AttemptOutcome.SUCCEEDED;
        })));
        JobHandle handle = engine.queue.enqueue(
            JobPayloads.syncSource("src-1", "mangadex", SyncType.FULL, SyncPriority.WARM));
        pool.pollOnce();

        engine.clock.advance(Duration.ofSeconds(61));
        assertEquals(1, engine.queue.reclaimExpiredLeases());
        pool.heartbeatActiveJobs();

        waitUntil(() -> interrupted.getCount() == 0 && pool.activeCount() == 0);
        assertEquals(JobStatus.WAITING, engine.queue.findJob(handle.jobId()).orElseThrow().status());
    }

    @Test
    void shutdown_handsBackLeasesOfJobsThatDoNotFinish() {
        WorkerPool pool = threadedPool(List.of(handler(QueueName.SYNC_SOURCE, context -> {
            new CountDownLatch(1).await(5, TimeUnit.SECONDS);
            return AttemptOutcome.SUCCEEDED;
        })));
        JobHandle handle = engine.queue.enqueue(
            JobPayloads.syncSource("src-1", "mangadex", SyncType.FULL, SyncPriority.WARM));
        pool.pollOnce();

        assertFalse(pool.shutdown(Duration.ofMillis(100)));

        assertFalse(pool.isAccepting());
        assertEquals(JobStatus.WAITING, engine.queue.findJob(handle.jobId()).orElseThrow().status());
        engine.clock.advance(Duration.ofHours(1));
        assertEquals(0, pool.pollOnce());
    }

    @Test
    void shutdown_handsBackLastAttemptWithoutDeadLettering() {
        JobHandle handle = engine.queue.enqueue(
            JobPayloads.syncSource("src-1", "mangadex", SyncType.FULL, SyncPriority.WARM));
        for (int i = 0; i < 4; i++) {
            Job job = engine.queue.claimNext(QueueName.SYNC_SOURCE, "w", Set.of()).orElseThrow();
            engine.queue.fail(job.id(), job.fenceToken(), JobFailure.of(ErrorCategory.TRANSIENT, "transient: timeout"));
            engine.clock.advance(Duration.ofMinutes(15));
        }
        WorkerPool pool = threadedPool(List.of(handler(QueueName.SYNC_SOURCE, context -> {
            new CountDownLatch(1).await(5, TimeUnit.SECONDS);
            return AttemptOutcome.SUCCEEDED;
        })));
        assertEquals(1, pool.pollOnce());
        assertEquals(5, engine.queue.findJob(handle.jobId()).orElseThrow().attempts());

        assertFalse(pool.shutdown(Duration.ofMillis(100)));

        Job released = engine.queue.findJob(handle.jobId()).orElseThrow();
        assertEquals(JobStatus.WAITING, released.status());
        assertEquals(4, released.attempts());
        assertEquals(4, engine.queue.findAttempts(handle.jobId()).size());
        assertEquals(0, engine.queue.deadLetterCount());
    }

    @Test
    void persistentNetworkFailures_deadLetterWithFullHistoryAndOpenTheCircuit() {
        Series series = engine.store.insertSeries(series("Solo Leveling").build());
        SeriesSource source = engine.store.findOrCreateSource(source(series.id(), "mangadex", "sl").build()).source();
        for (int i = 0; i < 5; i++) {
            mangadex.failNext(new SourceNetworkException("mangadex", "connection reset"));
        }
        WorkerPool pool = inlinePool(realHandlers());
        JobHandle handle = engine.queue.enqueue(
            JobPayloads.syncSource(source.id(), "mangadex", SyncType.FULL, SyncPriority.WARM));

        for (int attempt = 1; attempt <= 5; attempt++) {
            if (attempt > 1) {
                engine.clock.advance(Duration.ofMinutes(15));
            }
            assertEquals(1, pool.pollOnce());
        }

        assertEquals(JobStatus.DEAD_LETTERED, engine.queue.findJob(handle.jobId()).orElseThrow().status());
        List<DeadLetterEntry> deadLetters = engine.queue.findDeadLetters(10);
        assertEquals(1, deadLetters.size());
        DeadLetterEntry entry = deadLetters.get(0);
        assertEquals(handle.jobId(), entry.jobId());
        assertEquals(ErrorCategory.TRANSIENT, entry.category());
        assertEquals(5, entry.attempts());
        assertEquals(List.of(1, 2, 3, 4, 5),
            entry.attemptHistory().stream().map(JobAttempt::attempt).collect(Collectors.toList()));
        assertTrue(entry.attemptHistory().stream().allMatch(attempt -> attempt.outcome() == AttemptOutcome.FAILED));
        assertEquals(5, mangadex.chapterCalls());
        assertEquals(CircuitState.OPEN, engine.circuitBreaker.state("mangadex"));
        assertEquals(SyncStatus.BROKEN, engine.store.findSource(source.id()).orElseThrow().syncStatus());
    }

    @Test
    void shutdown_withNothingRunningDrainsImmediately() {
        WorkerPool pool = inlinePool(List.of(handler(QueueName.SYNC_SOURCE, context -> AttemptOutcome.SUCCEEDED)));

        assertTrue(pool.shutdown(Duration.ofSeconds(1)));
        assertTrue(pool.activeJobIds().isEmpty());
    }

    @Test
    void twoHandlersForOneQueueAreRejected() {
        List<JobHandler> handlers = List.of(
            handler(QueueName.CANONICALIZE, context -> AttemptOutcome.SUCCEEDED),
            handler(QueueName.CANONICALIZE, context -> AttemptOutcome.SKIPPED));

        assertThrows(IllegalStateException.class, () -> inlinePool(handlers));
    }

    @Test
    void canonicalizeRerun_doesNotDuplicateFollowUps() throws Exception {
        mangadex.withSeries(candidate("mangadex", "sl", "Solo Leveling").build());
        CanonicalizeJobHandler handler = new CanonicalizeJobHandler(engine.gateway, engine.canonicalization,
            engine.store, engine.queue);
        JobHandle first = engine.queue.enqueue(JobPayloads.canonicalize("mangadex", "sl", null));
        Job job = engine.queue.claimNext(QueueName.CANONICALIZE, "w", Set.of()).orElseThrow();

        assertEquals(AttemptOutcome.SUCCEEDED, handler.handle(new JobContext(job, "w", () -> { })));
        assertEquals(AttemptOutcome.SKIPPED, handler.handle(new JobContext(job, "w", () -> { })));

        assertEquals(1, engine.queue.depth(QueueName.ENRICH_METADATA));
        assertEquals(1, engine.queue.depth(QueueName.SYNC_SOURCE));
        assertEquals(first.jobId(), job.id());
    }

    private List<JobHandler> realHandlers() {
        return List.of(
            new SyncSourceJobHandler(engine.ingestion),
            new CanonicalizeJobHandler(engine.gateway, engine.canonicalization, engine.store, engine.queue),
            new EnrichMetadataJobHandler(engine.enrichment));
    }

    private WorkerPool inlinePool(List<JobHandler> handlers) {
        return pool(handlers, new TaskExecutorAdapter(Runnable::run));
    }

    private WorkerPool threadedPool(List<JobHandler> handlers) {
        threads = new ThreadPoolTaskExecutor();
        threads.setCorePoolSize(4);
        threads.setMaxPoolSize(4);
        threads.setThreadNamePrefix("pool-test-");
        threads.initialize();
        return pool(handlers, threads);
    }

    private WorkerPool pool(List<JobHandler> handlers, AsyncTaskExecutor executor) {
        return new WorkerPool(engine.queue, handlers, new ConcurrencyLimiter(engine.properties.getQueue()),
            engine.circuitBreaker, engine.errorClassifier, engine.metrics, executor,
            new WorkerIdentity("pool-test"), engine.properties, engine.clock);
    }

    private static JobHandler handler(QueueName queue, Body body) {
        return new JobHandler() {
            @Override
            public QueueName queue() {
                return queue;
            }

            @Override
            public AttemptOutcome handle(JobContext context) throws Exception {
                return body.run(context);
            }
        };
    }

    private static void waitUntil(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("interrupted while waiting", e);
            }
        }
    }

    @FunctionalInterface
    private interface Body {
        AttemptOutcome run(JobContext context) throws Exception;
    }
}

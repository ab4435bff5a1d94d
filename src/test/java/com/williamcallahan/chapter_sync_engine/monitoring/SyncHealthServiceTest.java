package com.williamcallahan.chapter_sync_engine.monitoring;

import com.williamcallahan.chapter_sync_engine.model.Series;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.queue.Job;
import com.williamcallahan.chapter_sync_engine.queue.JobFailure;
import com.williamcallahan.chapter_sync_engine.queue.JobPayloads;
import com.williamcallahan.chapter_sync_engine.queue.WorkerPool;
import com.williamcallahan.chapter_sync_engine.testutil.SyncTestEngine;
import com.williamcallahan.chapter_sync_engine.types.CircuitState;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncStatus;
import com.williamcallahan.chapter_sync_engine.types.SyncType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.T0;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.series;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.source;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SyncHealthServiceTest {

    private SyncTestEngine engine;
    private SyncHealthService healthService;

    @BeforeEach
    void setUp() {
        engine = new SyncTestEngine();
        WorkerPool workerPool = mock(WorkerPool.class);
        when(workerPool.activeCount()).thenReturn(2);
        healthService = new SyncHealthService(engine.queue, engine.store, engine.circuitBreaker, workerPool,
            engine.properties, engine.clock);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void snapshot_reportsQueuesBreakersDeadLettersAndStaleness() {
        engine.queue.enqueue(JobPayloads.syncSource("a", "mangadex", SyncType.FULL, SyncPriority.WARM));
        engine.queue.enqueue(JobPayloads.syncSource("b", "mangadex", SyncType.FULL, SyncPriority.WARM));
        engine.queue.enqueue(JobPayloads.canonicalize("comick", "x", null));
        Job doomed = engine.queue.claimNext(QueueName.CANONICALIZE, "w", Set.of()).orElseThrow();
        engine.queue.fail(doomed.id(), doomed.fenceToken(), JobFailure.of(ErrorCategory.FATAL, "schema violation"));
        for (int i = 0; i < 5; i++) {
            engine.circuitBreaker.recordFailure("MangaDex");
        }
        engine.circuitBreaker.recordSuccess("comick");

        Series series = engine.store.insertSeries(series("Monster").build());
        engine.store.findOrCreateSource(source(series.id(), "mangadex", "never").syncPriority(SyncPriority.HOT).build());
        SeriesSource fresh = engine.store.findOrCreateSource(source(series.id(), "mangadex", "fresh").build()).source();
        engine.store.updateSource(fresh.toBuilder().syncStatus(SyncStatus.ACTIVE).lastSuccessAt(T0).build());
        engine.clock.advance(Duration.ofSeconds(30));

        SyncHealthSnapshot snapshot = healthService.snapshot();

        assertEquals(2, snapshot.queueDepth(QueueName.SYNC_SOURCE));
        assertEquals(0, snapshot.queueDepth(QueueName.ENRICH_METADATA));
        assertEquals(1, snapshot.deadLetterCount());
        assertEquals(CircuitState.OPEN, snapshot.circuitBreakers().get("mangadex"));
        assertEquals(Set.of("mangadex"), snapshot.openCircuits());
        assertEquals(1L, snapshot.staleByTier().get(SyncPriority.HOT));
        assertEquals(0L, snapshot.staleByTier().get(SyncPriority.WARM));
        assertEquals(0L, snapshot.staleByTier().get(SyncPriority.COLD));
        assertEquals(2, snapshot.activeJobs());
        assertEquals(T0.plus(Duration.ofSeconds(30)), snapshot.takenAt());
    }
}

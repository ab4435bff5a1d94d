package com.williamcallahan.chapter_sync_engine.scheduler;

import com.williamcallahan.chapter_sync_engine.concurrency.LockHandle;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceLocks;
import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.model.Series;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.model.SyncCandidate;
import com.williamcallahan.chapter_sync_engine.queue.Job;
import com.williamcallahan.chapter_sync_engine.queue.JobPayloads;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.testutil.SyncTestData;
import com.williamcallahan.chapter_sync_engine.testutil.SyncTestEngine;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.types.ResourceKind;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncStatus;
import com.williamcallahan.chapter_sync_engine.types.SyncType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.T0;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.series;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.source;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Test suite for SyncScheduler job selection
 */
class SyncSchedulerTest {

    private SyncTestEngine engine;
    private SyncScheduler scheduler;
    private Series series;

    @BeforeEach
    void setUp() {
        engine = new SyncTestEngine();
        engine.clock.set(T0.plus(Duration.ofDays(3)));
        scheduler = new SyncScheduler(engine.store, engine.queue, engine.locks, engine.metrics, engine.properties,
            engine.clock);
        series = engine.store.insertSeries(series("Berserk").build());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void neverSyncedSource_getsAFullSyncAtItsTierPriority() {
        SeriesSource hot = addSource("hot", SyncPriority.HOT, null, null);

        SyncCycleResult result = scheduler.runSyncCycle();

        assertEquals(1, result.enqueued());
        Job job = onlySyncJob();
        assertEquals(hot.id(), job.payloadValue(JobPayloads.SERIES_SOURCE_ID));
        assertEquals(SyncType.FULL.name(), job.payloadValue(JobPayloads.SYNC_TYPE));
        assertEquals(1, job.priority());
    }

    @Test
    void recentlyFullySyncedSource_getsAnIncrementalSync() {
        Instant now = engine.clock.instant();
        addSource("warm", SyncPriority.WARM, now.minus(Duration.ofHours(7)), now.minus(Duration.ofHours(7)));

        scheduler.runSyncCycle();

        assertEquals(SyncType.INCREMENTAL.name(), onlySyncJob().payloadValue(JobPayloads.SYNC_TYPE));
    }

    @Test
    void sourcesFreshEnoughForTheirTier_areNotDue() {
        Instant now = engine.clock.instant();
        addSource("warm", SyncPriority.WARM, now.minus(Duration.ofHours(1)), now.minus(Duration.ofHours(1)));
        addSource("cold", SyncPriority.COLD, now.minus(Duration.ofHours(20)), now.minus(Duration.ofHours(20)));

        SyncCycleResult result = scheduler.runSyncCycle();

        assertEquals(2, result.scanned());
        assertEquals(2, result.notDue());
        assertEquals(0, result.enqueued());
    }

    @Test
    void lockedAndDisabledSources_areLeftAlone() {
        SeriesSource locked = addSource("locked", SyncPriority.WARM, null, null);
        SeriesSource disabled = addSource("disabled", SyncPriority.WARM, null, null);
        engine.store.updateSource(disabled.toBuilder().syncStatus(SyncStatus.DISABLED).build());

        try (LockHandle held = engine.locks.tryAcquire(
                ResourceLocks.resourceLock(ResourceKind.SERIES_SOURCE, locked.id()), Duration.ZERO).orElseThrow()) {
            SyncCycleResult result = scheduler.runSyncCycle();

            assertEquals(1, result.scanned());
            assertEquals(1, result.locked());
            assertEquals(0, result.enqueued());
        }
    }

    @Test
    void secondCycle_countsOutstandingJobsAsDuplicates() {
        addSource("a", SyncPriority.WARM, null, null);

        scheduler.runSyncCycle();
        SyncCycleResult second = scheduler.runSyncCycle();

        assertEquals(0, second.enqueued());
        assertEquals(1, second.duplicates());
        assertEquals(1, engine.queue.depth(QueueName.SYNC_SOURCE));
    }

    @Test
    void batchCap_limitsJobsPerCycle() {
        engine.properties.getScheduler().setBatchCap(2);
        SyncScheduler capped = new SyncScheduler(engine.store, engine.queue, engine.locks, engine.metrics,
            engine.properties, engine.clock);
        for (int i = 0; i < 5; i++) {
            addSource("s" + i, SyncPriority.WARM, null, null);
        }

        SyncCycleResult result = capped.runSyncCycle();

        assertEquals(2, result.enqueued());
        assertEquals(5, result.scanned());
    }

    @Test
    void malformedRows_areSkippedAndCounted() {
        ChapterSyncStore store = mock(ChapterSyncStore.class);
        when(store.findSyncCandidates(any(), anyInt())).thenReturn(List.of(
            new SyncCandidate("bad-1", "mangadex", "LUKEWARM", null, null),
            new SyncCandidate("good", "mangadex", "WARM", null, null),
            new SyncCandidate("bad-2", "mangadex", null, null, null)));
        SyncScheduler withBadRows = new SyncScheduler(store, engine.queue, engine.locks, engine.metrics,
            engine.properties, engine.clock);

        SyncCycleResult result = withBadRows.runSyncCycle();

        assertEquals(1, result.enqueued());
        assertEquals(2, result.errors());
        assertFalse(result.halted());
        assertEquals(List.of("bad-1: IllegalArgumentException", "bad-2: IllegalArgumentException"), result.errorSamples());
        assertEquals(2.0, engine.meterRegistry.counter("sync.scheduler.row_errors").count());
    }

    @Test
    void runHaltsOnceRowErrorsPassTheCeiling() {
        SyncEngineProperties properties = SyncTestData.properties();
        properties.getScheduler().setHaltAfterErrors(1);
        ChapterSyncStore store = mock(ChapterSyncStore.class);
        when(store.findSyncCandidates(any(), anyInt())).thenReturn(List.of(
            new SyncCandidate("bad-1", "mangadex", "?", null, null),
            new SyncCandidate("bad-2", "mangadex", "?", null, null),
            new SyncCandidate("good", "mangadex", "HOT", null, null)));
        SyncScheduler strict = new SyncScheduler(store, engine.queue, engine.locks, engine.metrics, properties,
            engine.clock);

        SyncCycleResult result = strict.runSyncCycle();

        assertTrue(result.halted());
        assertEquals(0, result.enqueued());
    }

    @Test
    void disabledScheduler_doesNothingOnTheTimer() {
        engine.properties.getScheduler().setEnabled(false);
        addSource("a", SyncPriority.HOT, null, null);

        scheduler.scheduledSyncCycle();

        assertEquals(0, engine.queue.depth(QueueName.SYNC_SOURCE));
    }

    private SeriesSource addSource(String sourceId, SyncPriority tier, Instant lastSuccess, Instant lastFull) {
        SeriesSource created = engine.store.findOrCreateSource(source(series.id(), "mangadex", sourceId)
            .syncPriority(tier)
            .build()).source();
        return engine.store.updateSource(created.toBuilder()
            .syncStatus(lastSuccess == null ? SyncStatus.PENDING : SyncStatus.ACTIVE)
            .lastSuccessAt(lastSuccess)
            .lastFullSyncAt(lastFull)
            .build());
    }

    private Job onlySyncJob() {
        return engine.queue.claimNext(QueueName.SYNC_SOURCE, "test", Set.of()).orElseThrow();
    }
}

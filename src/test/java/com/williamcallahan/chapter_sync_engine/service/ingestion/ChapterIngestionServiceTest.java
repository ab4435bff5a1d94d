package com.williamcallahan.chapter_sync_engine.service.ingestion;

import com.williamcallahan.chapter_sync_engine.concurrency.FenceGuard;
import com.williamcallahan.chapter_sync_engine.concurrency.LockHandle;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceLocks;
import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.exception.LockUnavailableException;
import com.williamcallahan.chapter_sync_engine.exception.SourceNetworkException;
import com.williamcallahan.chapter_sync_engine.exception.StaleFenceException;
import com.williamcallahan.chapter_sync_engine.model.LogicalChapter;
import com.williamcallahan.chapter_sync_engine.model.RawChapter;
import com.williamcallahan.chapter_sync_engine.model.Series;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.model.StoredChapter;
import com.williamcallahan.chapter_sync_engine.testutil.FakeSourceClient;
import com.williamcallahan.chapter_sync_engine.testutil.SyncTestData;
import com.williamcallahan.chapter_sync_engine.testutil.SyncTestEngine;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import com.williamcallahan.chapter_sync_engine.types.ResourceKind;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncStatus;
import com.williamcallahan.chapter_sync_engine.types.SyncType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.T0;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.chapter;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.chapters;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.plus;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.series;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.source;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test suite for ChapterIngestionService against the in-memory store
 */
class ChapterIngestionServiceTest {

    private FakeSourceClient mangadex;
    private FakeSourceClient comick;
    private SyncTestEngine engine;
    private Series onePiece;
    private SeriesSource source;

    @BeforeEach
    void setUp() {
        mangadex = new FakeSourceClient("mangadex");
        comick = new FakeSourceClient("comick");
        engine = new SyncTestEngine(mangadex, comick);
        onePiece = engine.store.insertSeries(series("One Piece").build());
        source = engine.store.findOrCreateSource(source(onePiece.id(), "mangadex", "op").build()).source();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void firstSync_insertsEveryChapterWithoutWarmingTheTier() throws Exception {
        mangadex.withChapters("op", chapters(1, 10));

        SyncResult result = full();

        assertFalse(result.skipped());
        assertEquals(10, result.fetched());
        assertEquals(10, result.added());
        assertEquals(0, result.tombstoned());
        assertEquals(1, result.chunksCommitted());
        assertEquals(10, engine.store.findLogicalChapters(onePiece.id()).size());

        SeriesSource after = reload();
        assertEquals(SyncStatus.ACTIVE, after.syncStatus());
        assertEquals(SyncPriority.WARM, after.syncPriority());
        assertEquals(T0, after.lastSuccessAt());
        assertEquals(T0, after.lastFullSyncAt());
        assertEquals(10, after.chapterCount());
        assertEquals(1.0, after.trustScore(), 1e-9);
        assertEquals(10.0, engine.meterRegistry.counter("sync.chapters.added").count());
    }

    @Test
    void rerunWithSameList_changesNothing() throws Exception {
        mangadex.withChapters("op", chapters(1, 10));
        full();

        SyncResult second = full();

        assertEquals(0, second.added());
        assertEquals(0, second.updated());
        assertEquals(10, second.unchanged());
        assertEquals(0, second.chunksCommitted());
        assertEquals(10, engine.store.findChapterSources(source.id()).size());
    }

    @Test
    void newChapterAfterAPriorSuccess_promotesSourceToHot() throws Exception {
        mangadex.withChapters("op", chapters(1, 10));
        full();
        engine.clock.advance(Duration.ofHours(1));
        mangadex.withChapters("op", chapters(1, 11));

        SyncResult result = engine.ingestion.sync(SyncRequest.unfenced(source.id(), SyncType.INCREMENTAL));

        assertEquals(1, result.added());
        SeriesSource after = reload();
        assertEquals(SyncPriority.HOT, after.syncPriority());
        assertEquals(T0.plus(Duration.ofHours(1)), after.lastChapterDetectedAt());
        assertEquals(T0, after.lastFullSyncAt(), "incremental syncs leave the full-sync stamp alone");
        assertEquals(11, after.chapterCount());
    }

    @Test
    void incrementalSync_neverTombstones() throws Exception {
        mangadex.withChapters("op", chapters(1, 10));
        full();
        mangadex.withChapters("op", chapters(6, 10));

        SyncResult result = engine.ingestion.sync(SyncRequest.unfenced(source.id(), SyncType.INCREMENTAL));

        assertEquals(0, result.tombstoned());
        assertFalse(result.structuralWarning());
        assertTrue(engine.store.findChapterSources(source.id()).stream().allMatch(StoredChapter::isAvailable));
    }

    @Test
    void fullSync_tombstonesMissingChaptersAndOrphanedLogicalChapters() throws Exception {
        mangadex.withChapters("op", chapters(1, 10));
        full();
        mangadex.withChapters("op", chapters(1, 8));

        SyncResult result = full();

        assertEquals(2, result.tombstoned());
        assertFalse(result.structuralWarning());
        assertEquals(8, reload().chapterCount());
        List<LogicalChapter> deleted = engine.store.findLogicalChapters(onePiece.id()).stream()
            .filter(LogicalChapter::isDeleted)
            .toList();
        assertEquals(List.of("9", "10"), deleted.stream().map(c -> c.number().display()).toList());
        assertEquals(2.0, engine.meterRegistry.counter("sync.chapters.tombstoned").count());
    }

    @Test
    void tombstonedChapter_isRestoredWhenItReappears() throws Exception {
        mangadex.withChapters("op", chapters(1, 10));
        full();
        mangadex.withChapters("op", chapters(1, 9));
        full();
        mangadex.withChapters("op", chapters(1, 10));

        SyncResult result = full();

        assertEquals(0, result.added());
        assertEquals(1, result.updated());
        assertEquals(10, reload().chapterCount());
        assertTrue(engine.store.findChapterSources(source.id()).stream().allMatch(StoredChapter::isAvailable));
    }

    @Test
    void massDisappearance_isReportedAsStructuralAndNothingIsTombstoned() throws Exception {
        mangadex.withChapters("op", chapters(1, 10));
        full();
        double trustBefore = reload().trustScore();
        mangadex.withChapters("op", chapters(1, 4));

        SyncResult result = full();

        assertTrue(result.structuralWarning());
        assertEquals(0, result.tombstoned());
        assertTrue(result.warnings().stream().anyMatch(w -> w.startsWith("6 of 10 chapters missing")));
        assertEquals(10, engine.store.findChapterSources(source.id()).stream().filter(StoredChapter::isAvailable).count());
        assertEquals(trustBefore, reload().trustScore(), 1e-9);
        assertEquals(1.0, engine.meterRegistry.counter("sync.structural_warnings").count());
    }

    @Test
    void largeLists_areWrittenInChunks() throws Exception {
        SyncEngineProperties properties = SyncTestData.properties();
        properties.getIngestion().setMaxChaptersPerSync(3);
        SyncTestEngine chunked = new SyncTestEngine(properties, mangadex);
        Series series = chunked.store.insertSeries(series("Chunked").build());
        SeriesSource chunkedSource = chunked.store.findOrCreateSource(source(series.id(), "mangadex", "op").build()).source();
        mangadex.withChapters("op", chapters(1, 10));

        SyncResult result = chunked.ingestion.sync(SyncRequest.unfenced(chunkedSource.id(), SyncType.FULL));

        assertEquals(4, result.chunksCommitted());
        assertEquals(10, chunked.store.findChapterSources(chunkedSource.id()).size());
        chunked.close();
    }

    @Test
    void staleFence_rollsBackTheFailingChunkButKeepsEarlierOnes() {
        SyncEngineProperties properties = SyncTestData.properties();
        properties.getIngestion().setMaxChaptersPerSync(3);
        SyncTestEngine chunked = new SyncTestEngine(properties, mangadex);
        Series series = chunked.store.insertSeries(series("Fenced").build());
        SeriesSource fencedSource = chunked.store.findOrCreateSource(source(series.id(), "mangadex", "op").build()).source();
        mangadex.withChapters("op", chapters(1, 10));
        AtomicInteger checks = new AtomicInteger();
        FenceGuard fence = () -> {
            if (checks.incrementAndGet() > 1) {
                throw new StaleFenceException("job-1", 1L);
            }
        };

        assertThrows(StaleFenceException.class,
            () -> chunked.ingestion.sync(new SyncRequest(fencedSource.id(), SyncType.FULL, fence)));

        assertEquals(3, chunked.store.findChapterSources(fencedSource.id()).size());
        assertNull(chunked.store.findSource(fencedSource.id()).orElseThrow().lastSuccessAt());
        chunked.close();
    }

    @Test
    void sourcesOfOneSeries_shareLogicalChapters() throws Exception {
        mangadex.withChapters("op", chapters(1, 10));
        full();
        SeriesSource second = engine.store.findOrCreateSource(source(onePiece.id(), "comick", "one-piece").build()).source();
        comick.withChapters("one-piece", List.of(
            new RawChapter("Chapter 5", null, null, null, null, null),
            new RawChapter("Chapter 11", null, null, null, null, null)));

        SyncResult result = engine.ingestion.sync(SyncRequest.unfenced(second.id(), SyncType.FULL));

        assertEquals(2, result.added());
        assertEquals(11, engine.store.findLogicalChapters(onePiece.id()).size());
        assertEquals(2, engine.store.findChapterSources(second.id()).size());
    }

    @Test
    void upstreamOddities_areCountedAndWarned() throws Exception {
        mangadex.withChapters("op", chapters(1, 30));
        full();
        mangadex.withChapters("op", plus(chapters(1, 30),
            chapter("5.5"),
            new RawChapter(null, null, null, null, "x", null)));

        SyncResult result = full();

        assertEquals(1, result.added());
        assertEquals(1, result.invalidItems());
        assertTrue(result.reordered());
        assertEquals(List.of("chapter 5.5 arrived below stored maximum 30"), result.warnings());
    }

    @Test
    void fetchFailure_isRecordedAndRethrown() {
        mangadex.failNext(new SourceNetworkException("mangadex", "connection reset"));

        assertThrows(SourceNetworkException.class, this::full);

        SeriesSource after = reload();
        assertEquals(SyncStatus.DEGRADED, after.syncStatus());
        assertEquals(1, after.consecutiveFailures());
        assertEquals(0.95, after.trustScore(), 1e-9);
        assertNull(after.lastSuccessAt());
    }

    @Test
    void repeatedFailures_markSourceBrokenAndCold_thenSuccessRecovers() throws Exception {
        for (int i = 0; i < 5; i++) {
            mangadex.failNext(new SourceNetworkException("mangadex", "timeout"));
            assertThrows(SourceNetworkException.class, this::full);
        }

        SeriesSource broken = reload();
        assertEquals(SyncStatus.BROKEN, broken.syncStatus());
        assertEquals(SyncPriority.COLD, broken.syncPriority());
        assertEquals(0.75, broken.trustScore(), 1e-9);

        engine.circuitBreaker.reset("mangadex");
        mangadex.withChapters("op", chapters(1, 3));
        full();

        SeriesSource recovered = reload();
        assertEquals(SyncStatus.ACTIVE, recovered.syncStatus());
        assertEquals(0, recovered.consecutiveFailures());
        assertEquals(0.77, recovered.trustScore(), 1e-9);
    }

    @Test
    void trustScore_neverDropsBelowTheFloor() {
        for (int i = 0; i < 20; i++) {
            engine.ingestion.recordFailure(source.id(), ErrorCategory.TRANSIENT);
        }

        assertEquals(0.5, reload().trustScore(), 1e-9);
    }

    @Test
    void failuresThatSayNothingAboutTheSource_leaveItUntouched() {
        SeriesSource after = engine.ingestion.recordFailure(source.id(), ErrorCategory.FATAL);

        assertEquals(0, after.consecutiveFailures());
        assertEquals(1.0, after.trustScore(), 1e-9);
    }

    @Test
    void heldSourceLock_raisesLockUnavailableWithoutFetching() {
        mangadex.withChapters("op", chapters(1, 3));
        try (LockHandle held = engine.locks.tryAcquire(
                ResourceLocks.resourceLock(ResourceKind.SERIES_SOURCE, source.id()), Duration.ZERO).orElseThrow()) {
            assertNotNull(held);
            assertThrows(LockUnavailableException.class, this::full);
        }
        assertEquals(0, mangadex.chapterCalls());
    }

    @Test
    void disabledSource_isSkipped() throws Exception {
        engine.store.updateSource(source.toBuilder().syncStatus(SyncStatus.DISABLED).build());

        SyncResult result = full();

        assertTrue(result.skipped());
        assertEquals(0, mangadex.chapterCalls());
    }

    private SyncResult full() throws Exception {
        return engine.ingestion.sync(SyncRequest.unfenced(source.id(), SyncType.FULL));
    }

    private SeriesSource reload() {
        return engine.store.findSource(source.id()).orElseThrow();
    }
}

package com.williamcallahan.chapter_sync_engine.service;

import com.williamcallahan.chapter_sync_engine.concurrency.FenceGuard;
import com.williamcallahan.chapter_sync_engine.exception.SourceNetworkException;
import com.williamcallahan.chapter_sync_engine.exception.SourceUnavailableException;
import com.williamcallahan.chapter_sync_engine.exception.StaleFenceException;
import com.williamcallahan.chapter_sync_engine.model.Series;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.service.MetadataEnrichmentService.EnrichmentResult;
import com.williamcallahan.chapter_sync_engine.testutil.FakeSourceClient;
import com.williamcallahan.chapter_sync_engine.testutil.SyncTestEngine;
import com.williamcallahan.chapter_sync_engine.types.MetadataSourceRank;
import com.williamcallahan.chapter_sync_engine.types.MetadataStatus;
import com.williamcallahan.chapter_sync_engine.types.ReconcileAction;
import com.williamcallahan.chapter_sync_engine.types.SeriesStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.candidate;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.series;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.source;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataEnrichmentServiceTest {

    private FakeSourceClient mangadex;
    private SyncTestEngine engine;
    private Series series;
    private SeriesSource source;

    @BeforeEach
    void setUp() {
        mangadex = new FakeSourceClient("mangadex");
        engine = new SyncTestEngine(mangadex);
        series = engine.store.insertSeries(series("Solo Leveling").build());
        source = engine.store.findOrCreateSource(source(series.id(), "mangadex", "sl").build()).source();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void enrich_fillsMissingMetadataAndMarksSourceEnriched() throws Exception {
        mangadex.withSeries(candidate("mangadex", "sl", "Na Honjaman Level-eop")
            .alternativeTitles(Set.of("I Level Up Alone"))
            .creators(List.of("Chugong"))
            .language("ko")
            .publicationYear(2018)
            .status("ongoing")
            .followerCount(1200)
            .externalIds(Map.of("anilist", "105398"))
            .build());

        EnrichmentResult result = engine.enrichment.enrich(source.id(), FenceGuard.unfenced());

        assertFalse(result.skipped());
        assertEquals(MetadataStatus.ENRICHED, result.status());
        Series enriched = engine.store.findSeries(series.id()).orElseThrow();
        assertEquals("Solo Leveling", enriched.title());
        assertEquals(Set.of("Na Honjaman Level-eop", "I Level Up Alone"), enriched.alternativeTitles());
        assertEquals(List.of("Chugong"), enriched.creators());
        assertEquals("ko", enriched.language());
        assertEquals(2018, enriched.publicationYear());
        assertEquals(SeriesStatus.ONGOING, enriched.status());
        assertEquals(1200, enriched.followerCount());
        assertEquals(MetadataSourceRank.CANONICAL_CONFIRMED, enriched.metadataSource());
        assertEquals(Map.of("anilist", "105398"), engine.store.findExternalIds(series.id()));

        SeriesSource after = engine.store.findSource(source.id()).orElseThrow();
        assertEquals(MetadataStatus.ENRICHED, after.metadataStatus());
        assertEquals("Na Honjaman Level-eop", after.sourceTitle());
    }

    @Test
    void enrich_keepsKnownValuesAndNeverReopensACompletedSeries() throws Exception {
        engine.store.updateSeries(series.toBuilder()
            .creators(List.of("Chugong", "Dubu"))
            .language("ko")
            .publicationYear(2016)
            .status(SeriesStatus.COMPLETED)
            .followerCount(5000)
            .build());
        mangadex.withSeries(candidate("mangadex", "sl", "Solo Leveling")
            .creators(List.of("Someone Else"))
            .language("en")
            .publicationYear(2018)
            .status("ongoing")
            .followerCount(10)
            .build());

        engine.enrichment.enrich(source.id(), FenceGuard.unfenced());

        Series enriched = engine.store.findSeries(series.id()).orElseThrow();
        assertEquals(List.of("Chugong", "Dubu"), enriched.creators());
        assertEquals("ko", enriched.language());
        assertEquals(2016, enriched.publicationYear());
        assertEquals(SeriesStatus.COMPLETED, enriched.status());
        assertEquals(5000, enriched.followerCount());
        assertTrue(enriched.alternativeTitles().isEmpty(), "the canonical title is never listed as an alternative");
    }

    @Test
    void enrich_alreadyEnrichedSourceIsANoOp() throws Exception {
        engine.store.updateSource(source.toBuilder().metadataStatus(MetadataStatus.ENRICHED).build());

        EnrichmentResult result = engine.enrichment.enrich(source.id(), FenceGuard.unfenced());

        assertTrue(result.skipped());
        assertEquals(0, mangadex.seriesCalls());
    }

    @Test
    void enrich_failuresCountRetriesUntilUnavailable() {
        mangadex.failNext(
            new SourceNetworkException("mangadex", "reset"),
            new SourceNetworkException("mangadex", "reset"),
            new SourceNetworkException("mangadex", "reset"));

        assertThrows(SourceNetworkException.class, () -> engine.enrichment.enrich(source.id(), FenceGuard.unfenced()));
        SeriesSource once = engine.store.findSource(source.id()).orElseThrow();
        assertEquals(MetadataStatus.FAILED, once.metadataStatus());
        assertEquals(1, once.metadataRetryCount());

        assertThrows(SourceNetworkException.class, () -> engine.enrichment.enrich(source.id(), FenceGuard.unfenced()));
        assertThrows(SourceNetworkException.class, () -> engine.enrichment.enrich(source.id(), FenceGuard.unfenced()));

        SeriesSource exhausted = engine.store.findSource(source.id()).orElseThrow();
        assertEquals(MetadataStatus.UNAVAILABLE, exhausted.metadataStatus());
        assertEquals(3, exhausted.metadataRetryCount());
    }

    @Test
    void enrich_openCircuitDoesNotUseARetry() {
        for (int i = 0; i < 5; i++) {
            engine.circuitBreaker.recordFailure("mangadex");
        }

        assertThrows(SourceUnavailableException.class, () -> engine.enrichment.enrich(source.id(), FenceGuard.unfenced()));

        SeriesSource after = engine.store.findSource(source.id()).orElseThrow();
        assertEquals(MetadataStatus.PENDING, after.metadataStatus());
        assertEquals(0, after.metadataRetryCount());
        assertEquals(0, mangadex.seriesCalls());
    }

    @Test
    void enrich_externalIdOwnedByAnotherSeriesMergesThem() throws Exception {
        Series duplicate = engine.store.insertSeries(series("Only I Level Up").build());
        engine.store.addExternalIds(duplicate.id(), Map.of("anilist", "105398"));
        mangadex.withSeries(candidate("mangadex", "sl", "Solo Leveling")
            .externalIds(Map.of("anilist", "105398", "mal", "121496"))
            .build());

        EnrichmentResult result = engine.enrichment.enrich(source.id(), FenceGuard.unfenced());

        assertEquals(1, result.reconciliations().size());
        assertEquals(ReconcileAction.MERGED, result.reconciliations().get(0).action());
        assertEquals(engine.canonicalization.canonicalIdOf(series.id()),
            engine.canonicalization.canonicalIdOf(duplicate.id()));
        assertEquals(1, engine.store.canonicalSeriesIds().size());
    }

    @Test
    void enrich_staleFenceRollsBackEverything() {
        mangadex.withSeries(candidate("mangadex", "sl", "Solo Leveling")
            .language("ko")
            .externalIds(Map.of("anilist", "105398"))
            .build());
        FenceGuard stale = () -> {
            throw new StaleFenceException("job-7", 3L);
        };

        assertThrows(StaleFenceException.class, () -> engine.enrichment.enrich(source.id(), stale));

        assertEquals(MetadataStatus.PENDING, engine.store.findSource(source.id()).orElseThrow().metadataStatus());
        assertNull(engine.store.findSeries(series.id()).orElseThrow().language());
        assertTrue(engine.store.findExternalIds(series.id()).isEmpty());
    }
}

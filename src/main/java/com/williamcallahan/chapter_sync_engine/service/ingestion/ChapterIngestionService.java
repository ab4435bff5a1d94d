/**
 * Converges the stored chapters of one series source with the upstream list
 *
 * Features:
 * - Holds the series-source advisory lock for the whole sync; a held lock means another worker is on it
 * - Writes are chunked; each chunk is one transaction that checks the job fence before commit
 * - Logical chapters and availability rows are upserted on their unique keys, so concurrent
 *   sources of one series converge instead of duplicating
 * - Missing chapters are tombstoned only on full syncs, and never when more than the configured
 *   share vanished at once (reported as a structural warning instead)
 * - Source health (trust score, failure streak, sync status, tier) is updated with the final chunk
 */

package com.williamcallahan.chapter_sync_engine.service.ingestion;

import com.williamcallahan.chapter_sync_engine.concurrency.LockHandle;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceKey;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceLockProvider;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceLocks;
import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.exception.LockUnavailableException;
import com.williamcallahan.chapter_sync_engine.exception.SourceClientException;
import com.williamcallahan.chapter_sync_engine.model.ChapterList;
import com.williamcallahan.chapter_sync_engine.model.ChapterSource;
import com.williamcallahan.chapter_sync_engine.model.LogicalChapter;
import com.williamcallahan.chapter_sync_engine.model.NormalizedChapter;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.model.StoredChapter;
import com.williamcallahan.chapter_sync_engine.monitoring.MetricsService;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.service.ErrorClassifier;
import com.williamcallahan.chapter_sync_engine.service.SourceGateway;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import com.williamcallahan.chapter_sync_engine.types.ResourceKind;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncStatus;
import com.williamcallahan.chapter_sync_engine.types.SyncType;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ChapterIngestionService {

    private final ChapterSyncStore store;
    private final ResourceLockProvider lockProvider;
    private final SourceGateway sourceGateway;
    private final ErrorClassifier errorClassifier;
    private final MetricsService metricsService;
    private final SyncEngineProperties.Ingestion settings;
    private final Clock clock;

    public ChapterIngestionService(ChapterSyncStore store,
                                   ResourceLockProvider lockProvider,
                                   SourceGateway sourceGateway,
                                   ErrorClassifier errorClassifier,
                                   MetricsService metricsService,
                                   SyncEngineProperties properties,
                                   Clock clock) {
        this.store = store;
        this.lockProvider = lockProvider;
        this.sourceGateway = sourceGateway;
        this.errorClassifier = errorClassifier;
        this.metricsService = metricsService;
        this.settings = properties.getIngestion();
        this.clock = clock;
    }

    /**
     * Fetches the upstream list for a source and applies the difference.
     *
     * @throws LockUnavailableException when another worker is syncing the same source
     * @throws SourceClientException    when the upstream call fails; the failure is recorded on the source first
     */
    public SyncResult sync(SyncRequest request) throws SourceClientException {
        SeriesSource source = store.findSource(request.seriesSourceId())
            .orElseThrow(() -> new IllegalArgumentException("Unknown series source " + request.seriesSourceId()));
        if (!source.syncStatus().isSchedulable()) {
            log.info("Skipping sync of {}: source is {}", source.id(), source.syncStatus());
            return SyncResult.skipped(source.id(), request.syncType(), "source " + source.syncStatus().dbValue());
        }

        ResourceKey key = ResourceLocks.resourceLock(ResourceKind.SERIES_SOURCE, source.id());
        try (LockHandle lock = lockProvider.tryAcquire(key, settings.getLockTimeout())
                .orElseThrow(() -> new LockUnavailableException(key.describe(), key.value()))) {
            Timer.Sample sample = metricsService.startSyncTimer();
            try {
                return syncLocked(source, request);
            } finally {
                metricsService.stopSyncTimer(sample);
            }
        }
    }

    /**
     * Records a failed sync: decays trust, extends the failure streak and demotes a broken source to COLD.
     * Failures that say nothing about the upstream leave the source untouched.
     */
    public SeriesSource recordFailure(String seriesSourceId, ErrorCategory category) {
        return store.inTransaction(() -> {
            SeriesSource source = store.findSource(seriesSourceId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown series source " + seriesSourceId));
            if (!category.countsAgainstSource()) {
                return source;
            }
            int failures = source.consecutiveFailures() + 1;
            SyncStatus status = source.syncStatus().afterFailure(failures, settings.getBrokenAfterFailures());
            SyncPriority priority = status == SyncStatus.BROKEN ? SyncPriority.COLD : tierOf(source);
            if (status == SyncStatus.BROKEN && source.syncStatus() != SyncStatus.BROKEN) {
                log.warn("Source {} ({}) marked broken after {} consecutive failures",
                    source.id(), source.sourceName(), failures);
            }
            return store.updateSource(source.toBuilder()
                .consecutiveFailures(failures)
                .syncStatus(status)
                .syncPriority(priority)
                .trustScore(clampTrust(source.trustScore() - settings.getTrustFailureDelta()))
                .lastCheckedAt(clock.instant())
                .build());
        });
    }

    private SyncResult syncLocked(SeriesSource source, SyncRequest request) throws SourceClientException {
        ChapterList upstream;
        try {
            upstream = sourceGateway.fetchChapters(source.sourceName(), source.sourceId());
        } catch (SourceClientException | RuntimeException e) {
            recordFailure(source.id(), errorClassifier.classify(e));
            throw e;
        }

        ChapterDiffer.NormalizedList normalized = ChapterDiffer.normalize(upstream.chapters());
        if (normalized.reordered()) {
            log.warn("Upstream chapter list for {} was out of order; sorted before diffing", source.id());
        }
        if (normalized.invalid() > 0) {
            log.warn("Skipped {} unidentifiable chapter entries from {}", normalized.invalid(), source.id());
        }

        List<StoredChapter> stored = store.findChapterSources(source.id());
        ChapterDiff diff = ChapterDiffer.diff(normalized.chapters(), stored);
        List<String> warnings = new ArrayList<>(
            ChapterDiffer.outOfOrderWarnings(diff.added(), stored, settings.getOutOfOrderTolerance()));
        warnings.forEach(warning -> log.warn("Source {}: {}", source.id(), warning));

        boolean tombstoning = request.syncType().allowsTombstoning();
        boolean structural = tombstoning && diff.exceedsMissingThreshold(settings.getTombstoneThreshold());
        if (structural) {
            metricsService.incrementStructuralWarning();
            String warning = String.format("%d of %d chapters missing upstream; suspected source error, no tombstones applied",
                diff.missing().size(), diff.storedAvailable());
            warnings.add(warning);
            log.warn("Source {}: {}", source.id(), warning);
        }

        int chunks = writeChunks(source, diff.writes(), request);

        boolean applyTombstones = tombstoning && !structural && !diff.missing().isEmpty();
        Instant now = clock.instant();
        int tombstoned = store.inTransaction(() -> {
            int removed = 0;
            if (applyTombstones) {
                removed = store.tombstoneChapterSources(
                    diff.missing().stream().map(row -> row.source().id()).collect(Collectors.toList()), now);
                store.tombstoneOrphanedChapters(
                    diff.missing().stream().map(row -> row.source().chapterId()).collect(Collectors.toList()), now);
            }
            SeriesSource current = store.findSource(source.id()).orElse(source);
            int available = diff.storedAvailable() + diff.added().size() + diff.restored() - removed;
            store.updateSource(afterSuccess(current, request.syncType(), diff, available, structural, now));
            request.fence().assertCurrent();
            return removed;
        });

        if (!diff.added().isEmpty()) {
            metricsService.incrementChaptersAdded(diff.added().size());
        }
        if (tombstoned > 0) {
            metricsService.incrementTombstones(tombstoned);
        }
        log.info("Synced {} ({} {}): {} added, {} updated, {} tombstoned, {} unchanged in {} chunk(s)",
            source.id(), source.sourceName(), request.syncType(), diff.added().size(), diff.changed().size(),
            tombstoned, diff.unchanged(), chunks);

        return new SyncResult(source.id(), request.syncType(), false, upstream.size(), diff.added().size(),
            diff.changed().size(), tombstoned, diff.unchanged(), normalized.invalid(), chunks, structural,
            normalized.reordered(), warnings);
    }

    private int writeChunks(SeriesSource source, List<NormalizedChapter> writes, SyncRequest request) {
        int chunkSize = Math.max(1, settings.getMaxChaptersPerSync());
        int chunks = 0;
        for (int start = 0; start < writes.size(); start += chunkSize) {
            List<NormalizedChapter> chunk = writes.subList(start, Math.min(writes.size(), start + chunkSize));
            store.inTransaction(() -> {
                Instant now = clock.instant();
                for (NormalizedChapter chapter : chunk) {
                    writeChapter(source, chapter, now);
                }
                request.fence().assertCurrent();
            });
            chunks++;
            log.debug("Committed chunk {} ({} chapters) for {}", chunks, chunk.size(), source.id());
        }
        return chunks;
    }

    private void writeChapter(SeriesSource source, NormalizedChapter chapter, Instant now) {
        LogicalChapter logical = store.upsertLogicalChapter(LogicalChapter.builder()
            .seriesId(source.seriesId())
            .number(chapter.number())
            .chapterTitle(chapter.title())
            .volumeNumber(chapter.volume())
            .publishedAt(chapter.publishedAt())
            .firstSeenAt(now)
            .build());
        store.upsertChapterSource(ChapterSource.builder()
            .chapterId(logical.id())
            .seriesSourceId(source.id())
            .sourceChapterId(chapter.sourceChapterId())
            .sourceChapterUrl(chapter.url())
            .chapterTitle(chapter.title())
            .available(true)
            .detectedAt(now)
            .sourcePublishedAt(chapter.publishedAt())
            .lastCheckedAt(now)
            .build());
    }

    private SeriesSource afterSuccess(SeriesSource current, SyncType syncType, ChapterDiff diff, int available,
                                      boolean structural, Instant now) {
        boolean newChapters = !diff.added().isEmpty();
        // The first sync of a source finds every chapter "new"; only later arrivals warm the tier
        boolean detectedNew = newChapters && current.lastSuccessAt() != null;
        return current.toBuilder()
            .lastSuccessAt(now)
            .lastCheckedAt(now)
            .lastFullSyncAt(syncType == SyncType.FULL ? now : current.lastFullSyncAt())
            .lastChapterDetectedAt(newChapters ? now : current.lastChapterDetectedAt())
            .consecutiveFailures(0)
            .syncStatus(current.syncStatus().afterSuccess())
            .syncPriority(detectedNew ? SyncPriority.HOT : tierOf(current))
            .trustScore(structural ? current.trustScore() : clampTrust(current.trustScore() + settings.getTrustSuccessDelta()))
            .chapterCount(Math.max(0, available))
            .build();
    }

    private static SyncPriority tierOf(SeriesSource source) {
        return source.syncPriority() != null ? source.syncPriority() : SyncPriority.WARM;
    }

    private double clampTrust(double value) {
        return Math.max(settings.getTrustMin(), Math.min(settings.getTrustMax(), value));
    }
}

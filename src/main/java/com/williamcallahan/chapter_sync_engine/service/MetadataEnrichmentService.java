/**
 * Service for enriching series metadata from the upstream source of a series source
 *
 * Features:
 * - Merges alternative titles, creators, language and year into the canonical series
 * - Applies the upstream publication status without ever regressing a completed series
 * - Records cross-provider external ids; an id already owned by another series triggers reconciliation
 * - Failed attempts increment the retry count; at the ceiling the metadata is marked unavailable
 * - Already enriched sources are left untouched, so a retried job is a no-op
 */

package com.williamcallahan.chapter_sync_engine.service;

import com.williamcallahan.chapter_sync_engine.concurrency.FenceGuard;
import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.exception.SourceClientException;
import com.williamcallahan.chapter_sync_engine.exception.SourceUnavailableException;
import com.williamcallahan.chapter_sync_engine.model.Series;
import com.williamcallahan.chapter_sync_engine.model.SeriesCandidate;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.service.canonical.CanonicalizationService;
import com.williamcallahan.chapter_sync_engine.service.canonical.ReconcileResult;
import com.williamcallahan.chapter_sync_engine.types.MetadataSourceRank;
import com.williamcallahan.chapter_sync_engine.types.MetadataStatus;
import com.williamcallahan.chapter_sync_engine.types.SeriesStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
@Service
public class MetadataEnrichmentService {

    private final ChapterSyncStore store;
    private final SourceGateway sourceGateway;
    private final CanonicalizationService canonicalizationService;
    private final int maxRetries;
    private final Clock clock;

    public MetadataEnrichmentService(ChapterSyncStore store,
                                     SourceGateway sourceGateway,
                                     CanonicalizationService canonicalizationService,
                                     SyncEngineProperties properties,
                                     Clock clock) {
        this.store = store;
        this.sourceGateway = sourceGateway;
        this.canonicalizationService = canonicalizationService;
        this.maxRetries = properties.getMetadata().getMaxRetries();
        this.clock = clock;
    }

    public record EnrichmentResult(
        String seriesSourceId,
        String seriesId,
        MetadataStatus status,
        boolean skipped,
        List<ReconcileResult> reconciliations
    ) {}

    /**
     * Fetches series metadata for a source and folds it into the canonical series.
     *
     * @param fence checked before the enrichment transaction commits
     * @throws SourceClientException when the upstream call fails; the failure is counted first
     */
    public EnrichmentResult enrich(String seriesSourceId, FenceGuard fence) throws SourceClientException {
        SeriesSource source = store.findSource(seriesSourceId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown series source " + seriesSourceId));
        if (source.metadataStatus() == MetadataStatus.ENRICHED) {
            log.debug("Source {} already enriched", seriesSourceId);
            return new EnrichmentResult(source.id(), source.seriesId(), MetadataStatus.ENRICHED, true, List.of());
        }

        SeriesCandidate metadata;
        try {
            metadata = sourceGateway.fetchSeries(source.sourceName(), source.sourceId());
        } catch (SourceUnavailableException e) {
            // Call never reached the upstream, so it does not use up a metadata retry
            throw e;
        } catch (SourceClientException | RuntimeException e) {
            MetadataStatus status = recordFailure(seriesSourceId);
            log.warn("Metadata enrichment failed for {} ({}), status now {}", seriesSourceId,
                e.getClass().getSimpleName(), status);
            throw e;
        }

        Instant now = clock.instant();
        Map<String, String> foreignIds = new LinkedHashMap<>();
        String seriesId = store.inTransaction(() -> {
            SeriesSource current = store.findSource(seriesSourceId).orElse(source);
            String canonicalId = canonicalizationService.canonicalIdOf(current.seriesId());
            Series series = store.findSeries(canonicalId).orElseThrow();
            store.updateSeries(absorb(series, metadata, now));

            Map<String, String> ownIds = new LinkedHashMap<>();
            metadata.externalIds().forEach((provider, externalId) -> {
                Optional<Series> owner = store.findSeriesByExternalId(provider, externalId);
                if (owner.isEmpty()) {
                    ownIds.put(provider, externalId);
                } else if (!canonicalizationService.canonicalIdOf(owner.get().id()).equals(canonicalId)) {
                    foreignIds.put(provider, owner.get().id());
                }
            });
            store.addExternalIds(canonicalId, ownIds);

            store.updateSource(current.toBuilder()
                .metadataStatus(MetadataStatus.ENRICHED)
                .metadataAttemptedAt(now)
                .sourceTitle(metadata.title() != null ? metadata.title() : current.sourceTitle())
                .build());
            fence.assertCurrent();
            return canonicalId;
        });

        List<ReconcileResult> reconciliations = new ArrayList<>();
        for (String otherSeriesId : new TreeSet<>(foreignIds.values())) {
            log.info("External id of series {} already belongs to {}, reconciling", seriesId, otherSeriesId);
            reconciliations.add(canonicalizationService.reconcile(seriesId, otherSeriesId, 1.0));
        }
        log.info("Enriched metadata for source {} (series {})", seriesSourceId, seriesId);
        return new EnrichmentResult(seriesSourceId, seriesId, MetadataStatus.ENRICHED, false, reconciliations);
    }

    /**
     * Counts a failed enrichment attempt.
     *
     * @return the resulting status, FAILED or UNAVAILABLE once the retry ceiling is reached
     */
    public MetadataStatus recordFailure(String seriesSourceId) {
        return store.inTransaction(() -> {
            SeriesSource source = store.findSource(seriesSourceId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown series source " + seriesSourceId));
            int retries = source.metadataRetryCount() + 1;
            MetadataStatus status = source.metadataStatus().afterFailure(retries, maxRetries);
            store.updateSource(source.toBuilder()
                .metadataStatus(status)
                .metadataRetryCount(retries)
                .metadataAttemptedAt(clock.instant())
                .build());
            return status;
        });
    }

    static Series absorb(Series series, SeriesCandidate metadata, Instant now) {
        Set<String> titles = new LinkedHashSet<>(series.alternativeTitles());
        if (metadata.title() != null && !metadata.title().isBlank()) {
            titles.add(metadata.title().trim());
        }
        titles.addAll(metadata.alternativeTitles());
        titles.remove(series.title());

        SeriesStatus status = series.status();
        Optional<SeriesStatus> upstreamStatus = SeriesStatus.parse(metadata.status());
        if (upstreamStatus.isPresent() && (status == null || status.canTransitionTo(upstreamStatus.get()))) {
            status = upstreamStatus.get();
        }

        MetadataSourceRank rank = series.metadataSource() == MetadataSourceRank.INFERRED
            ? MetadataSourceRank.CANONICAL_CONFIRMED
            : series.metadataSource();

        return series.toBuilder()
            .alternativeTitles(titles)
            .creators(series.creators().isEmpty() ? metadata.creators() : series.creators())
            .language(series.language() != null ? series.language() : metadata.language())
            .publicationYear(series.publicationYear() != null ? series.publicationYear() : metadata.publicationYear())
            .status(status)
            .followerCount(Math.max(series.followerCount(), metadata.followerCount()))
            .metadataSource(rank)
            .updatedAt(now)
            .build();
    }
}

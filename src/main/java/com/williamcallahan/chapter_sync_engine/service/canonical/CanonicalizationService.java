/**
 * Resolves newly observed source entities to canonical series and merges duplicates
 *
 * Features:
 * - Re-running on an already linked source returns the existing link unchanged
 * - Exact external-id or source-url matches link immediately with confidence 1.0
 * - Fuzzy matches at or above the link threshold link automatically; the review band creates a
 *   new series flagged for review; anything lower creates an unrelated series
 * - Decisions run under advisory locks on the source identity and the normalized title
 * - Merges pick the survivor by a strict total order and re-parent everything in one transaction
 * - Series are never deleted; a merged series becomes a one-hop alias of the survivor
 */

package com.williamcallahan.chapter_sync_engine.service.canonical;

import com.williamcallahan.chapter_sync_engine.concurrency.LockHandle;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceKey;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceLockProvider;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceLocks;
import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.exception.InvariantViolationException;
import com.williamcallahan.chapter_sync_engine.exception.LockUnavailableException;
import com.williamcallahan.chapter_sync_engine.model.MergeRecord;
import com.williamcallahan.chapter_sync_engine.model.ReviewItem;
import com.williamcallahan.chapter_sync_engine.model.Series;
import com.williamcallahan.chapter_sync_engine.model.SeriesCandidate;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.monitoring.MetricsService;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.types.CanonicalizationAction;
import com.williamcallahan.chapter_sync_engine.types.MetadataSourceRank;
import com.williamcallahan.chapter_sync_engine.types.MetadataStatus;
import com.williamcallahan.chapter_sync_engine.types.ReconcileAction;
import com.williamcallahan.chapter_sync_engine.types.ResourceKind;
import com.williamcallahan.chapter_sync_engine.types.ReviewReason;
import com.williamcallahan.chapter_sync_engine.types.ReviewResolution;
import com.williamcallahan.chapter_sync_engine.types.ReviewStatus;
import com.williamcallahan.chapter_sync_engine.types.SeriesStatus;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncStatus;
import com.williamcallahan.chapter_sync_engine.util.TextUtils;
import com.williamcallahan.chapter_sync_engine.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Slf4j
@Service
public class CanonicalizationService {

    private static final Comparator<Series> MERGE_ORDER = Comparator
        .comparingInt((Series series) -> series.metadataSource().weight()).reversed()
        .thenComparing(Comparator.comparingLong(Series::followerCount).reversed())
        .thenComparing(Series::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Series::id);

    private final ChapterSyncStore store;
    private final ResourceLockProvider lockProvider;
    private final SeriesMatcher matcher;
    private final MetricsService metricsService;
    private final Clock clock;
    private final double linkThreshold;
    private final double reviewThreshold;
    private final int candidateLimit;
    private final Duration lockTimeout;

    public CanonicalizationService(ChapterSyncStore store,
                                   ResourceLockProvider lockProvider,
                                   SeriesMatcher matcher,
                                   MetricsService metricsService,
                                   SyncEngineProperties properties,
                                   Clock clock) {
        this.store = store;
        this.lockProvider = lockProvider;
        this.matcher = matcher;
        this.metricsService = metricsService;
        this.clock = clock;
        SyncEngineProperties.Canonicalization settings = properties.getCanonicalization();
        this.linkThreshold = settings.getLinkThreshold();
        this.reviewThreshold = settings.getReviewThreshold();
        this.candidateLimit = settings.getCandidateLimit();
        this.lockTimeout = settings.getLockTimeout();
    }

    private record Decision(CanonicalizationResult result, List<MatchAssessment> duplicates) {}

    /**
     * Links a source entity to a canonical series, creating one when nothing matches well enough.
     *
     * @param candidate the upstream entity; source name, source id and title are required
     * @return the decision, identical on every re-run once the source is linked
     * @throws LockUnavailableException when another worker is deciding the same identity or title
     */
    public CanonicalizationResult canonicalize(SeriesCandidate candidate) {
        validate(candidate);
        Optional<CanonicalizationResult> linked = existingLink(candidate);
        if (linked.isPresent()) {
            log.debug("Source {}:{} already linked to {}", candidate.sourceName(), candidate.sourceId(),
                linked.get().seriesId());
            return linked.get();
        }

        ResourceKey identityKey = ResourceLocks.resourceLock(ResourceKind.SOURCE_IDENTITY,
            candidate.sourceName(), candidate.sourceId());
        ResourceKey titleKey = ResourceLocks.resourceLock(ResourceKind.SERIES_TITLE, titleLockId(candidate.title()));

        Decision decision;
        try (LockHandle identityLock = acquire(identityKey);
             LockHandle titleLock = acquire(titleKey)) {
            decision = store.inTransaction(() -> decide(candidate));
        }

        CanonicalizationResult result = decision.result();
        log.info("Canonicalized {}:{} -> {} ({}, confidence {})", candidate.sourceName(), candidate.sourceId(),
            result.seriesId(), result.action(), String.format(Locale.ROOT, "%.2f", result.confidence()));

        for (MatchAssessment duplicate : decision.duplicates()) {
            try {
                reconcileDuplicate(result.seriesId(), duplicate.series().id());
            } catch (LockUnavailableException e) {
                log.warn("Deferred reconciling {} with {}: merge lock held elsewhere",
                    result.seriesId(), duplicate.series().id());
            }
        }
        return result;
    }

    /**
     * Picks the surviving series of a merge: higher metadata rank, then more followers, then the
     * older row, then the smaller id. Symmetric in its arguments.
     */
    public MergeDecision decideMerge(Series a, Series b) {
        if (a.id().equals(b.id())) {
            throw new IllegalArgumentException("Cannot merge series " + a.id() + " with itself");
        }
        boolean aWins = MERGE_ORDER.compare(a, b) < 0;
        Series primary = aWins ? a : b;
        Series secondary = aWins ? b : a;
        return new MergeDecision(primary, secondary, decidingRule(a, b));
    }

    /**
     * Merges two series. Either id may be an alias; both are resolved to their canonical rows first.
     */
    public MergeResult mergeSeries(String seriesIdA, String seriesIdB, String reason) {
        String a = canonicalIdOf(seriesIdA);
        String b = canonicalIdOf(seriesIdB);
        if (a.equals(b)) {
            return MergeResult.alreadyMerged(a, seriesIdB);
        }
        try (LockHandle mergeLock = acquire(ResourceLocks.pairLock(ResourceKind.SERIES_MERGE, a, b))) {
            return store.inTransaction(() -> applyMerge(a, b, reason));
        }
    }

    /**
     * Acts on two canonical series found to match. Merges them when confident, unless either side is
     * already flagged for review; then a re-evaluation item is queued instead.
     */
    public ReconcileResult reconcile(String seriesIdA, String seriesIdB, double confidence) {
        if (confidence < linkThreshold) {
            return ReconcileResult.of(ReconcileAction.BELOW_THRESHOLD);
        }
        String a = canonicalIdOf(seriesIdA);
        String b = canonicalIdOf(seriesIdB);
        if (a.equals(b)) {
            return ReconcileResult.of(ReconcileAction.ALREADY_MERGED);
        }
        Series seriesA = requireSeries(a);
        Series seriesB = requireSeries(b);
        if (seriesA.needsReview() || seriesB.needsReview()) {
            ReviewItem item = queuePairReview(a, b, ReviewReason.MERGE_REEVALUATION, confidence);
            log.info("Queued merge re-evaluation {} for flagged series {} and {}", item.id(), a, b);
            return new ReconcileResult(ReconcileAction.REVIEW_QUEUED, null, item);
        }
        MergeResult merge = mergeSeries(a, b, "duplicate:" + String.format(Locale.ROOT, "%.2f", confidence));
        return new ReconcileResult(ReconcileAction.MERGED, merge, null);
    }

    /**
     * Reconciles another series that matched the same candidate. The candidate resembling both is not
     * evidence that the two series are the same work, so the pair is scored on its own before merging.
     */
    ReconcileResult reconcileDuplicate(String linkedSeriesId, String duplicateSeriesId) {
        String a = canonicalIdOf(linkedSeriesId);
        String b = canonicalIdOf(duplicateSeriesId);
        if (a.equals(b)) {
            return ReconcileResult.of(ReconcileAction.ALREADY_MERGED);
        }
        MatchAssessment pair = matcher.assess(requireSeries(a), requireSeries(b));
        if (pair.isIncompatible() || pair.confidence() < linkThreshold) {
            log.info("Kept series {} and {} apart: pair confidence {}, year drift {}", a, b,
                String.format(Locale.ROOT, "%.2f", pair.confidence()), pair.yearDrift().compatibility());
            return ReconcileResult.of(ReconcileAction.BELOW_THRESHOLD);
        }
        if (pair.blocksAutomaticLink()) {
            ReviewItem item = queuePairReview(a, b, ReviewReason.YEAR_DRIFT, pair.confidence());
            log.info("Queued year drift review {} for series {} and {}", item.id(), a, b);
            return new ReconcileResult(ReconcileAction.REVIEW_QUEUED, null, item);
        }
        return reconcile(a, b, pair.confidence());
    }

    /**
     * Closes a review item. MERGE merges the two series and marks the survivor as user-confirmed;
     * KEEP_SEPARATE clears the review flag. Resolving an already resolved item returns it unchanged.
     */
    public ReviewItem resolveReview(String reviewItemId, ReviewResolution resolution) {
        ReviewItem item = store.findReviewItem(reviewItemId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown review item " + reviewItemId));
        if (item.status() == ReviewStatus.RESOLVED) {
            log.debug("Review item {} already resolved as {}", reviewItemId, item.resolution());
            return item;
        }

        String confirmedSeriesId = switch (resolution) {
            case MERGE -> {
                if (item.candidateSeriesId() == null) {
                    throw new IllegalArgumentException("Review item " + reviewItemId + " has no candidate series to merge");
                }
                yield mergeSeries(item.seriesId(), item.candidateSeriesId(), "review:" + reviewItemId).primarySeriesId();
            }
            case KEEP_SEPARATE -> canonicalIdOf(item.seriesId());
        };

        Instant now = clock.instant();
        return store.inTransaction(() -> {
            Series series = requireSeries(confirmedSeriesId);
            Series.SeriesBuilder updated = series.toBuilder().needsReview(false).updatedAt(now);
            if (resolution == ReviewResolution.MERGE) {
                updated.metadataSource(MetadataSourceRank.USER_OVERRIDE);
            }
            store.updateSeries(updated.build());
            log.info("Resolved review item {} as {}", reviewItemId, resolution);
            return store.updateReviewItem(item.toBuilder()
                .status(ReviewStatus.RESOLVED)
                .resolution(resolution)
                .resolvedAt(now)
                .build());
        });
    }

    public List<ReviewItem> findOpenReviews(int limit) {
        return store.findOpenReviewItems(limit);
    }

    /**
     * Id of the canonical row a series resolves to.
     *
     * @throws InvariantViolationException when the alias chain is longer than one hop
     */
    public String canonicalIdOf(String seriesId) {
        Series series = requireSeries(seriesId);
        if (!series.isAlias()) {
            return series.id();
        }
        Series target = requireSeries(series.canonicalSeriesId());
        if (target.isAlias()) {
            throw new InvariantViolationException("Alias chain longer than one hop: " + seriesId + " -> "
                + target.id() + " -> " + target.canonicalSeriesId());
        }
        return target.id();
    }

    private ReviewItem queuePairReview(String a, String b, ReviewReason reason, double confidence) {
        String first = a.compareTo(b) <= 0 ? a : b;
        String second = first.equals(a) ? b : a;
        return store.insertReviewItem(ReviewItem.builder()
            .seriesId(first)
            .candidateSeriesId(second)
            .reason(reason)
            .confidence(confidence)
            .status(ReviewStatus.OPEN)
            .createdAt(clock.instant())
            .build());
    }

    // ---- decision ----

    private Decision decide(SeriesCandidate candidate) {
        Optional<CanonicalizationResult> raced = existingLink(candidate);
        if (raced.isPresent()) {
            return new Decision(raced.get(), List.of());
        }
        Instant now = clock.instant();

        String urlHash = UrlUtils.hashSourceUrl(candidate.sourceUrl());
        if (urlHash != null) {
            Optional<SeriesSource> urlOwner = store.findSourceByUrlHash(urlHash);
            if (urlOwner.isPresent()) {
                String seriesId = canonicalIdOf(urlOwner.get().seriesId());
                log.warn("Source url of {}:{} already belongs to source {}, linking to series {} without the url",
                    candidate.sourceName(), candidate.sourceId(), urlOwner.get().id(), seriesId);
                SeriesSource source = link(candidate, seriesId, false, now);
                return new Decision(new CanonicalizationResult(CanonicalizationAction.LINKED, seriesId, source.id(),
                    1.0, seriesId, null), List.of());
            }
        }

        Optional<Series> byExternalId = findByExternalId(candidate.externalIds());
        if (byExternalId.isPresent()) {
            String seriesId = canonicalIdOf(byExternalId.get().id());
            addCandidateTitles(seriesId, candidate, now);
            SeriesSource source = link(candidate, seriesId, true, now);
            return new Decision(new CanonicalizationResult(CanonicalizationAction.LINKED, seriesId, source.id(),
                1.0, seriesId, null), List.of());
        }

        Set<String> titles = TextUtils.normalizeTitles(candidate.title(), candidate.alternativeTitles());
        List<MatchAssessment> ranked = matcher.rank(candidate, store.findMatchCandidates(titles, candidateLimit));

        List<MatchAssessment> linkable = ranked.stream()
            .filter(assessment -> assessment.confidence() >= linkThreshold && !assessment.blocksAutomaticLink())
            .collect(Collectors.toList());
        if (!linkable.isEmpty()) {
            MatchAssessment best = linkable.get(0);
            String seriesId = best.series().id();
            addCandidateTitles(seriesId, candidate, now);
            SeriesSource source = link(candidate, seriesId, true, now);
            List<MatchAssessment> duplicates = new ArrayList<>(linkable.subList(1, linkable.size()));
            return new Decision(new CanonicalizationResult(CanonicalizationAction.LINKED, seriesId, source.id(),
                best.confidence(), seriesId, null), duplicates);
        }

        Optional<MatchAssessment> reviewable = ranked.stream()
            .filter(assessment -> assessment.confidence() >= reviewThreshold && !assessment.isIncompatible())
            .findFirst();
        if (reviewable.isPresent()) {
            MatchAssessment match = reviewable.get();
            Series created = createSeries(candidate, true, now);
            SeriesSource source = link(candidate, created.id(), true, now);
            ReviewReason reason = match.blocksAutomaticLink() ? ReviewReason.YEAR_DRIFT : ReviewReason.LOW_CONFIDENCE_MATCH;
            ReviewItem item = store.insertReviewItem(ReviewItem.builder()
                .seriesId(created.id())
                .candidateSeriesId(match.series().id())
                .seriesSourceId(source.id())
                .reason(reason)
                .confidence(match.confidence())
                .status(ReviewStatus.OPEN)
                .createdAt(now)
                .build());
            return new Decision(new CanonicalizationResult(CanonicalizationAction.CREATED_NEEDS_REVIEW, created.id(),
                source.id(), match.confidence(), match.series().id(), item.id()), List.of());
        }

        Series created = createSeries(candidate, false, now);
        SeriesSource source = link(candidate, created.id(), true, now);
        double confidence = ranked.isEmpty() ? 0.0 : ranked.get(0).confidence();
        return new Decision(new CanonicalizationResult(CanonicalizationAction.CREATED, created.id(), source.id(),
            confidence, null, null), List.of());
    }

    private Optional<CanonicalizationResult> existingLink(SeriesCandidate candidate) {
        return store.findSourceByIdentity(candidate.sourceName(), candidate.sourceId())
            .map(source -> new CanonicalizationResult(CanonicalizationAction.ALREADY_LINKED,
                canonicalIdOf(source.seriesId()), source.id(), 1.0, null, null));
    }

    // Providers in sorted order so the same candidate always resolves the same way
    private Optional<Series> findByExternalId(Map<String, String> externalIds) {
        for (Map.Entry<String, String> entry : new TreeMap<>(externalIds).entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                continue;
            }
            Optional<Series> series = store.findSeriesByExternalId(entry.getKey(), entry.getValue());
            if (series.isPresent()) {
                return series;
            }
        }
        return Optional.empty();
    }

    private Series createSeries(SeriesCandidate candidate, boolean needsReview, Instant now) {
        return store.insertSeries(Series.builder()
            .title(candidate.title().trim())
            .alternativeTitles(candidate.alternativeTitles())
            .creators(candidate.creators())
            .language(candidate.language())
            .publicationYear(candidate.publicationYear())
            .status(SeriesStatus.parse(candidate.status()).orElse(null))
            .metadataSchemaVersion(1)
            .needsReview(needsReview)
            .metadataSource(MetadataSourceRank.INFERRED)
            .followerCount(candidate.followerCount())
            .createdAt(now)
            .updatedAt(now)
            .build());
    }

    private SeriesSource link(SeriesCandidate candidate, String seriesId, boolean withUrl, Instant now) {
        String normalizedUrl = withUrl ? UrlUtils.normalizeSourceUrl(candidate.sourceUrl()) : null;
        SeriesSource draft = SeriesSource.builder()
            .seriesId(seriesId)
            .sourceName(candidate.sourceName())
            .sourceId(candidate.sourceId())
            .sourceUrl(normalizedUrl)
            .sourceUrlHash(withUrl ? UrlUtils.hashSourceUrl(candidate.sourceUrl()) : null)
            .sourceTitle(candidate.title())
            .trustScore(1.0)
            .syncPriority(SyncPriority.WARM)
            .syncStatus(SyncStatus.PENDING)
            .metadataStatus(MetadataStatus.PENDING)
            .createdAt(now)
            .build();
        ChapterSyncStore.SourceLink sourceLink = store.findOrCreateSource(draft);
        if (!sourceLink.created()) {
            // Rolls back the series this transaction may have created; the retry sees the winner's link
            throw new DuplicateKeyException("Source " + candidate.sourceName() + ":" + candidate.sourceId()
                + " was linked concurrently");
        }
        store.addExternalIds(seriesId, candidate.externalIds());
        return sourceLink.source();
    }

    private void addCandidateTitles(String seriesId, SeriesCandidate candidate, Instant now) {
        Series series = requireSeries(seriesId);
        Set<String> titles = new LinkedHashSet<>(series.alternativeTitles());
        titles.add(candidate.title().trim());
        titles.addAll(candidate.alternativeTitles());
        titles.remove(series.title());
        if (!titles.equals(series.alternativeTitles())) {
            store.updateSeries(series.toBuilder().alternativeTitles(titles).updatedAt(now).build());
        }
    }

    // ---- merge ----

    private MergeResult applyMerge(String seriesIdA, String seriesIdB, String reason) {
        String a = canonicalIdOf(seriesIdA);
        String b = canonicalIdOf(seriesIdB);
        if (a.equals(b)) {
            return MergeResult.alreadyMerged(a, seriesIdB);
        }
        MergeDecision decision = decideMerge(requireSeries(a), requireSeries(b));
        Series primary = decision.primary();
        Series secondary = decision.secondary();
        Instant now = clock.instant();

        int aliases = store.redirectAliases(secondary.id(), primary.id());
        store.updateSeries(secondary.toBuilder().canonicalSeriesId(primary.id()).updatedAt(now).build());
        int sources = store.reparentSources(secondary.id(), primary.id());
        store.reparentExternalIds(secondary.id(), primary.id());
        ChapterSyncStore.ChapterMergeResult chapters = store.mergeChapters(secondary.id(), primary.id(), now);
        store.updateSeries(absorb(primary, secondary, now));
        store.insertMergeRecord(new MergeRecord(primary.id(), secondary.id(), reason, now));

        metricsService.incrementSeriesMerged();
        log.info("Merged series {} into {} ({} by {}): {} sources, {} chapters moved, {} collapsed",
            secondary.id(), primary.id(), reason, decision.decidedBy(), sources, chapters.moved(), chapters.collapsed());
        return new MergeResult(primary.id(), secondary.id(), sources, chapters.moved(), chapters.collapsed(),
            aliases, false);
    }

    private static Series absorb(Series primary, Series secondary, Instant now) {
        Set<String> titles = new LinkedHashSet<>(primary.alternativeTitles());
        titles.add(secondary.title());
        titles.addAll(secondary.alternativeTitles());
        titles.remove(primary.title());
        return primary.toBuilder()
            .alternativeTitles(titles)
            .creators(primary.creators().isEmpty() ? secondary.creators() : primary.creators())
            .language(primary.language() != null ? primary.language() : secondary.language())
            .publicationYear(primary.publicationYear() != null ? primary.publicationYear() : secondary.publicationYear())
            .status(primary.status() != null ? primary.status() : secondary.status())
            .updatedAt(now)
            .build();
    }

    private static MergeDecision.Rule decidingRule(Series a, Series b) {
        if (a.metadataSource().weight() != b.metadataSource().weight()) {
            return MergeDecision.Rule.METADATA_RANK;
        }
        if (a.followerCount() != b.followerCount()) {
            return MergeDecision.Rule.FOLLOWER_COUNT;
        }
        if (a.createdAt() != null && b.createdAt() != null && !a.createdAt().equals(b.createdAt())) {
            return MergeDecision.Rule.CREATED_AT;
        }
        if ((a.createdAt() == null) != (b.createdAt() == null)) {
            return MergeDecision.Rule.CREATED_AT;
        }
        return MergeDecision.Rule.SERIES_ID;
    }

    // ---- helpers ----

    private Series requireSeries(String seriesId) {
        return store.findSeries(seriesId)
            .orElseThrow(() -> new InvariantViolationException("Series " + seriesId + " does not exist"));
    }

    private LockHandle acquire(ResourceKey key) {
        return lockProvider.tryAcquire(key, lockTimeout)
            .orElseThrow(() -> new LockUnavailableException(key.describe(), key.value()));
    }

    private static String titleLockId(String title) {
        String normalized = TextUtils.normalizeTitle(title);
        return normalized.isEmpty() ? title.trim().toLowerCase(Locale.ROOT) : normalized;
    }

    private static void validate(SeriesCandidate candidate) {
        if (candidate == null) {
            throw new IllegalArgumentException("Candidate is required");
        }
        if (isBlank(candidate.sourceName()) || isBlank(candidate.sourceId())) {
            throw new IllegalArgumentException("Candidate source name and source id are required");
        }
        if (isBlank(candidate.title())) {
            throw new IllegalArgumentException("Candidate " + candidate.sourceName() + ":" + candidate.sourceId()
                + " has no title");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

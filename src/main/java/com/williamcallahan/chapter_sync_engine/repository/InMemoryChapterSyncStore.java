/**
 * In-memory store used when no datasource is configured and in tests
 *
 * Features:
 * - One reentrant lock serializes transactions, so readers never observe partial writes
 * - The outermost transaction snapshots all tables and restores them when the work throws
 * - Unique keys mirror the database constraints and raise DuplicateKeyException on violation
 */

package com.williamcallahan.chapter_sync_engine.repository;

import com.williamcallahan.chapter_sync_engine.concurrency.ResourceKey;
import com.williamcallahan.chapter_sync_engine.model.ChapterNumber;
import com.williamcallahan.chapter_sync_engine.model.ChapterSource;
import com.williamcallahan.chapter_sync_engine.model.LogicalChapter;
import com.williamcallahan.chapter_sync_engine.model.MergeRecord;
import com.williamcallahan.chapter_sync_engine.model.ReviewItem;
import com.williamcallahan.chapter_sync_engine.model.Series;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.model.StoredChapter;
import com.williamcallahan.chapter_sync_engine.model.SyncCandidate;
import com.williamcallahan.chapter_sync_engine.types.MetadataStatus;
import com.williamcallahan.chapter_sync_engine.types.ReviewStatus;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncStatus;
import com.williamcallahan.chapter_sync_engine.util.IdGenerator;
import com.williamcallahan.chapter_sync_engine.util.SimilarityUtils;
import com.williamcallahan.chapter_sync_engine.util.TextUtils;
import org.springframework.dao.DuplicateKeyException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

public class InMemoryChapterSyncStore implements ChapterSyncStore {

    private static final double CANDIDATE_SIMILARITY_FLOOR = 0.3;

    private final ReentrantLock lock = new ReentrantLock(true);
    private State state = new State();

    private record ExternalKey(String provider, String externalId) {}

    private static final class State {
        final Map<String, Series> series = new LinkedHashMap<>();
        final Map<ExternalKey, String> externalIds = new LinkedHashMap<>();
        final Map<String, SeriesSource> sources = new LinkedHashMap<>();
        final Map<String, LogicalChapter> chapters = new LinkedHashMap<>();
        final Map<String, ChapterSource> chapterSources = new LinkedHashMap<>();
        final List<MergeRecord> merges = new ArrayList<>();
        final Map<String, ReviewItem> reviews = new LinkedHashMap<>();

        State copy() {
            State copy = new State();
            copy.series.putAll(series);
            copy.externalIds.putAll(externalIds);
            copy.sources.putAll(sources);
            copy.chapters.putAll(chapters);
            copy.chapterSources.putAll(chapterSources);
            copy.merges.addAll(merges);
            copy.reviews.putAll(reviews);
            return copy;
        }
    }

    // ---- transactions and locks ----

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        lock.lock();
        boolean outermost = lock.getHoldCount() == 1;
        State snapshot = outermost ? state.copy() : null;
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            if (outermost) {
                state = snapshot;
            }
            throw e;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean tryTransactionLock(ResourceKey key) {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Transaction lock requested outside a transaction");
        }
        // Transactions are already serialized
        return true;
    }

    // ---- series ----

    @Override
    public Series insertSeries(Series series) {
        return inTransaction(() -> {
            Series stored = series.id() == null ? series.toBuilder().id(IdGenerator.newId()).build() : series;
            if (state.series.containsKey(stored.id())) {
                throw new DuplicateKeyException("series " + stored.id() + " already exists");
            }
            state.series.put(stored.id(), stored);
            return stored;
        });
    }

    @Override
    public Series updateSeries(Series series) {
        return inTransaction(() -> {
            requirePresent(state.series, series.id(), "series");
            if (series.id().equals(series.canonicalSeriesId())) {
                throw new IllegalArgumentException("Series cannot alias itself: " + series.id());
            }
            state.series.put(series.id(), series);
            return series;
        });
    }

    @Override
    public Optional<Series> findSeries(String seriesId) {
        return read(() -> Optional.ofNullable(state.series.get(seriesId)));
    }

    @Override
    public List<Series> findMatchCandidates(Set<String> normalizedTitles, int limit) {
        return read(() -> state.series.values().stream()
            .filter(series -> !series.isAlias())
            .map(series -> Map.entry(series, SimilarityUtils.bestTitleSimilarity(
                normalizedTitles, TextUtils.normalizeTitles(series.title(), series.alternativeTitles()))))
            .filter(entry -> entry.getValue() >= CANDIDATE_SIMILARITY_FLOOR)
            .sorted(Map.Entry.<Series, Double>comparingByValue().reversed())
            .limit(limit)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList()));
    }

    @Override
    public List<Series> findAliasesOf(String seriesId) {
        return read(() -> state.series.values().stream()
            .filter(series -> seriesId.equals(series.canonicalSeriesId()))
            .collect(Collectors.toList()));
    }

    @Override
    public int redirectAliases(String fromSeriesId, String toSeriesId) {
        return inTransaction(() -> {
            int updated = 0;
            for (Series series : List.copyOf(state.series.values())) {
                if (fromSeriesId.equals(series.canonicalSeriesId()) && !series.id().equals(toSeriesId)) {
                    state.series.put(series.id(), series.toBuilder().canonicalSeriesId(toSeriesId).build());
                    updated++;
                }
            }
            return updated;
        });
    }

    @Override
    public Optional<Series> findSeriesByExternalId(String provider, String externalId) {
        return read(() -> Optional.ofNullable(state.externalIds.get(new ExternalKey(provider, externalId)))
            .map(state.series::get));
    }

    @Override
    public Map<String, String> findExternalIds(String seriesId) {
        return read(() -> {
            Map<String, String> ids = new LinkedHashMap<>();
            state.externalIds.forEach((key, owner) -> {
                if (owner.equals(seriesId)) {
                    ids.put(key.provider(), key.externalId());
                }
            });
            return ids;
        });
    }

    @Override
    public void addExternalIds(String seriesId, Map<String, String> externalIds) {
        inTransaction(() -> externalIds.forEach((provider, externalId) ->
            state.externalIds.putIfAbsent(new ExternalKey(provider, externalId), seriesId)));
    }

    @Override
    public int reparentExternalIds(String fromSeriesId, String toSeriesId) {
        return inTransaction(() -> {
            int moved = 0;
            for (Map.Entry<ExternalKey, String> entry : state.externalIds.entrySet()) {
                if (entry.getValue().equals(fromSeriesId)) {
                    entry.setValue(toSeriesId);
                    moved++;
                }
            }
            return moved;
        });
    }

    // ---- series sources ----

    @Override
    public Optional<SeriesSource> findSource(String seriesSourceId) {
        return read(() -> Optional.ofNullable(state.sources.get(seriesSourceId)));
    }

    @Override
    public Optional<SeriesSource> findSourceByIdentity(String sourceName, String sourceId) {
        return read(() -> state.sources.values().stream()
            .filter(source -> source.sourceName().equals(sourceName) && source.sourceId().equals(sourceId))
            .findFirst());
    }

    @Override
    public Optional<SeriesSource> findSourceByUrlHash(String sourceUrlHash) {
        if (sourceUrlHash == null) {
            return Optional.empty();
        }
        return read(() -> state.sources.values().stream()
            .filter(source -> sourceUrlHash.equals(source.sourceUrlHash()))
            .findFirst());
    }

    @Override
    public SourceLink findOrCreateSource(SeriesSource draft) {
        return inTransaction(() -> {
            Optional<SeriesSource> existing = findSourceByIdentity(draft.sourceName(), draft.sourceId());
            if (existing.isPresent()) {
                return new SourceLink(existing.get(), false);
            }
            requirePresent(state.series, draft.seriesId(), "series");
            if (draft.sourceUrlHash() != null && findSourceByUrlHash(draft.sourceUrlHash()).isPresent()) {
                throw new DuplicateKeyException("source url already linked: " + draft.sourceUrl());
            }
            SeriesSource stored = draft.id() == null ? draft.toBuilder().id(IdGenerator.newId()).build() : draft;
            state.sources.put(stored.id(), stored);
            return new SourceLink(stored, true);
        });
    }

    @Override
    public SeriesSource updateSource(SeriesSource source) {
        return inTransaction(() -> {
            requirePresent(state.sources, source.id(), "series source");
            state.sources.put(source.id(), source);
            return source;
        });
    }

    @Override
    public List<SeriesSource> findSourcesForSeries(String seriesId) {
        return read(() -> state.sources.values().stream()
            .filter(source -> seriesId.equals(source.seriesId()))
            .collect(Collectors.toList()));
    }

    @Override
    public int reparentSources(String fromSeriesId, String toSeriesId) {
        return inTransaction(() -> {
            int moved = 0;
            for (SeriesSource source : List.copyOf(state.sources.values())) {
                if (fromSeriesId.equals(source.seriesId())) {
                    state.sources.put(source.id(), source.toBuilder().seriesId(toSeriesId).build());
                    moved++;
                }
            }
            return moved;
        });
    }

    @Override
    public List<SyncCandidate> findSyncCandidates(Instant lastSuccessBefore, int limit) {
        return read(() -> state.sources.values().stream()
            .filter(source -> source.syncStatus() != SyncStatus.DISABLED)
            .filter(source -> source.lastSuccessAt() == null || !source.lastSuccessAt().isAfter(lastSuccessBefore))
            .sorted(Comparator.comparing(SeriesSource::lastSuccessAt, Comparator.nullsFirst(Comparator.naturalOrder())))
            .limit(limit)
            .map(source -> new SyncCandidate(
                source.id(),
                source.sourceName(),
                source.syncPriority() == null ? null : source.syncPriority().dbValue(),
                source.lastSuccessAt(),
                source.lastFullSyncAt()))
            .collect(Collectors.toList()));
    }

    @Override
    public int promoteSourcesWithFollowers(long followerThreshold) {
        return inTransaction(() -> {
            int promoted = 0;
            for (SeriesSource source : List.copyOf(state.sources.values())) {
                Series series = state.series.get(source.seriesId());
                if (series != null && series.followerCount() > followerThreshold
                        && source.syncPriority() != SyncPriority.HOT
                        && source.syncStatus() != SyncStatus.BROKEN
                        && source.syncStatus() != SyncStatus.DISABLED) {
                    state.sources.put(source.id(), source.toBuilder().syncPriority(SyncPriority.HOT).build());
                    promoted++;
                }
            }
            return promoted;
        });
    }

    @Override
    public int demoteIdleSources(SyncPriority from, SyncPriority to, Instant noNewChapterSince) {
        return inTransaction(() -> {
            int demoted = 0;
            for (SeriesSource source : List.copyOf(state.sources.values())) {
                Instant lastActivity = source.lastChapterDetectedAt() != null ? source.lastChapterDetectedAt() : source.createdAt();
                if (source.syncPriority() == from && lastActivity != null && lastActivity.isBefore(noNewChapterSince)) {
                    state.sources.put(source.id(), source.toBuilder().syncPriority(to).build());
                    demoted++;
                }
            }
            return demoted;
        });
    }

    @Override
    public List<SeriesSource> findHealableSources(int maxRetries, Instant attemptedBefore, int limit) {
        return read(() -> state.sources.values().stream()
            .filter(source -> source.metadataStatus() != null && source.metadataStatus().isHealable())
            .filter(source -> source.metadataRetryCount() < maxRetries)
            .filter(source -> source.metadataAttemptedAt() == null || source.metadataAttemptedAt().isBefore(attemptedBefore))
            .sorted(Comparator.comparingInt(SeriesSource::metadataRetryCount))
            .limit(limit)
            .collect(Collectors.toList()));
    }

    @Override
    public int markStuckPendingFailed(Instant attemptedBefore) {
        return inTransaction(() -> {
            int marked = 0;
            for (SeriesSource source : List.copyOf(state.sources.values())) {
                Instant since = source.metadataAttemptedAt() != null ? source.metadataAttemptedAt() : source.createdAt();
                if (source.metadataStatus() == MetadataStatus.PENDING && since != null && since.isBefore(attemptedBefore)) {
                    state.sources.put(source.id(), source.toBuilder().metadataStatus(MetadataStatus.FAILED).build());
                    marked++;
                }
            }
            return marked;
        });
    }

    @Override
    public Map<SyncPriority, Long> countStaleByTier(Instant now, Map<SyncPriority, Duration> intervals) {
        return read(() -> {
            Map<SyncPriority, Long> counts = new EnumMap<>(SyncPriority.class);
            for (SyncPriority priority : SyncPriority.values()) {
                counts.put(priority, 0L);
            }
            for (SeriesSource source : state.sources.values()) {
                if (source.syncPriority() == null || source.syncStatus() == SyncStatus.DISABLED) {
                    continue;
                }
                Instant threshold = now.minus(intervals.get(source.syncPriority()));
                if (source.lastSuccessAt() == null || !source.lastSuccessAt().isAfter(threshold)) {
                    counts.merge(source.syncPriority(), 1L, Long::sum);
                }
            }
            return counts;
        });
    }

    // ---- chapters ----

    @Override
    public List<StoredChapter> findChapterSources(String seriesSourceId) {
        return read(() -> state.chapterSources.values().stream()
            .filter(row -> seriesSourceId.equals(row.seriesSourceId()))
            .map(row -> new StoredChapter(row, state.chapters.get(row.chapterId()).number()))
            .sorted(Comparator.comparing(StoredChapter::number))
            .collect(Collectors.toList()));
    }

    @Override
    public LogicalChapter upsertLogicalChapter(LogicalChapter draft) {
        return inTransaction(() -> {
            requirePresent(state.series, draft.seriesId(), "series");
            Optional<LogicalChapter> existing = findLogicalChapter(draft.seriesId(), draft.number());
            if (existing.isPresent()) {
                LogicalChapter current = existing.get();
                LogicalChapter merged = current.toBuilder()
                    .chapterTitle(current.chapterTitle() != null ? current.chapterTitle() : draft.chapterTitle())
                    .volumeNumber(current.volumeNumber() != null ? current.volumeNumber() : draft.volumeNumber())
                    .publishedAt(current.publishedAt() != null ? current.publishedAt() : draft.publishedAt())
                    .deletedAt(null)
                    .build();
                state.chapters.put(merged.id(), merged);
                return merged;
            }
            LogicalChapter stored = draft.toBuilder()
                .id(draft.id() != null ? draft.id() : IdGenerator.newId())
                .deletedAt(null)
                .build();
            state.chapters.put(stored.id(), stored);
            return stored;
        });
    }

    @Override
    public ChapterSource upsertChapterSource(ChapterSource draft) {
        return inTransaction(() -> {
            requirePresent(state.chapters, draft.chapterId(), "logical chapter");
            requirePresent(state.sources, draft.seriesSourceId(), "series source");
            Optional<ChapterSource> existing = state.chapterSources.values().stream()
                .filter(row -> row.seriesSourceId().equals(draft.seriesSourceId()) && row.chapterId().equals(draft.chapterId()))
                .findFirst();
            ChapterSource stored;
            if (existing.isPresent()) {
                stored = existing.get().toBuilder()
                    .sourceChapterId(draft.sourceChapterId())
                    .sourceChapterUrl(draft.sourceChapterUrl())
                    .chapterTitle(draft.chapterTitle())
                    .available(true)
                    .sourcePublishedAt(draft.sourcePublishedAt() != null ? draft.sourcePublishedAt() : existing.get().sourcePublishedAt())
                    .lastCheckedAt(draft.lastCheckedAt())
                    .deletedAt(null)
                    .build();
            } else {
                stored = draft.toBuilder()
                    .id(draft.id() != null ? draft.id() : IdGenerator.newId())
                    .available(true)
                    .deletedAt(null)
                    .build();
            }
            state.chapterSources.put(stored.id(), stored);
            return stored;
        });
    }

    @Override
    public int tombstoneChapterSources(Collection<String> chapterSourceIds, Instant deletedAt) {
        return inTransaction(() -> {
            int updated = 0;
            for (String id : chapterSourceIds) {
                ChapterSource row = state.chapterSources.get(id);
                if (row != null && row.deletedAt() == null) {
                    state.chapterSources.put(id, row.toBuilder().available(false).deletedAt(deletedAt).lastCheckedAt(deletedAt).build());
                    updated++;
                }
            }
            return updated;
        });
    }

    @Override
    public int tombstoneOrphanedChapters(Collection<String> chapterIds, Instant deletedAt) {
        return inTransaction(() -> {
            int updated = 0;
            for (String id : chapterIds) {
                LogicalChapter chapter = state.chapters.get(id);
                if (chapter == null || chapter.isDeleted()) {
                    continue;
                }
                boolean stillServed = state.chapterSources.values().stream()
                    .anyMatch(row -> row.chapterId().equals(id) && row.available() && row.deletedAt() == null);
                if (!stillServed) {
                    state.chapters.put(id, chapter.toBuilder().deletedAt(deletedAt).build());
                    updated++;
                }
            }
            return updated;
        });
    }

    @Override
    public Optional<LogicalChapter> findLogicalChapter(String seriesId, ChapterNumber number) {
        return read(() -> state.chapters.values().stream()
            .filter(chapter -> chapter.seriesId().equals(seriesId) && chapter.number().equals(number))
            .findFirst());
    }

    @Override
    public List<LogicalChapter> findLogicalChapters(String seriesId) {
        return read(() -> state.chapters.values().stream()
            .filter(chapter -> chapter.seriesId().equals(seriesId))
            .sorted(Comparator.comparing(LogicalChapter::number))
            .collect(Collectors.toList()));
    }

    @Override
    public ChapterMergeResult mergeChapters(String fromSeriesId, String toSeriesId, Instant now) {
        return inTransaction(() -> {
            int moved = 0;
            int collapsed = 0;
            for (LogicalChapter chapter : findLogicalChapters(fromSeriesId)) {
                Optional<LogicalChapter> target = findLogicalChapter(toSeriesId, chapter.number());
                if (target.isPresent()) {
                    String targetId = target.get().id();
                    for (ChapterSource row : List.copyOf(state.chapterSources.values())) {
                        if (row.chapterId().equals(chapter.id())) {
                            state.chapterSources.put(row.id(), row.toBuilder().chapterId(targetId).build());
                        }
                    }
                    if (!chapter.isDeleted()) {
                        state.chapters.put(chapter.id(), chapter.toBuilder().deletedAt(now).build());
                    }
                    collapsed++;
                } else {
                    state.chapters.put(chapter.id(), chapter.toBuilder().seriesId(toSeriesId).build());
                    moved++;
                }
            }
            return new ChapterMergeResult(moved, collapsed);
        });
    }

    // ---- merges and review ----

    @Override
    public void insertMergeRecord(MergeRecord record) {
        inTransaction(() -> {
            state.merges.add(record);
        });
    }

    @Override
    public List<MergeRecord> findMergeRecords(String seriesId) {
        return read(() -> state.merges.stream()
            .filter(record -> record.primarySeriesId().equals(seriesId) || record.secondarySeriesId().equals(seriesId))
            .collect(Collectors.toList()));
    }

    @Override
    public ReviewItem insertReviewItem(ReviewItem item) {
        return inTransaction(() -> {
            Optional<ReviewItem> open = state.reviews.values().stream()
                .filter(existing -> existing.status() == ReviewStatus.OPEN)
                .filter(existing -> existing.seriesId().equals(item.seriesId())
                    && Objects.equals(existing.candidateSeriesId(), item.candidateSeriesId())
                    && existing.reason() == item.reason())
                .findFirst();
            if (open.isPresent()) {
                return open.get();
            }
            ReviewItem stored = item.id() == null ? item.toBuilder().id(IdGenerator.newId()).build() : item;
            state.reviews.put(stored.id(), stored);
            return stored;
        });
    }

    @Override
    public Optional<ReviewItem> findReviewItem(String reviewItemId) {
        return read(() -> Optional.ofNullable(state.reviews.get(reviewItemId)));
    }

    @Override
    public List<ReviewItem> findOpenReviewItems(int limit) {
        return read(() -> state.reviews.values().stream()
            .filter(item -> item.status() == ReviewStatus.OPEN)
            .sorted(Comparator.comparing(ReviewItem::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
            .limit(limit)
            .collect(Collectors.toList()));
    }

    @Override
    public ReviewItem updateReviewItem(ReviewItem item) {
        return inTransaction(() -> {
            requirePresent(state.reviews, item.id(), "review item");
            state.reviews.put(item.id(), item);
            return item;
        });
    }

    /**
     * Number of series rows, aliases included.
     */
    public int seriesCount() {
        return read(() -> state.series.size());
    }

    /**
     * Ids of every canonical (non-alias) series.
     */
    public Set<String> canonicalSeriesIds() {
        return read(() -> state.series.values().stream()
            .filter(series -> !series.isAlias())
            .map(Series::id)
            .collect(Collectors.toCollection(HashSet::new)));
    }

    private <T> T read(Supplier<T> reader) {
        lock.lock();
        try {
            return reader.get();
        } finally {
            lock.unlock();
        }
    }

    private static void requirePresent(Map<String, ?> table, String id, String entity) {
        if (id == null || !table.containsKey(id)) {
            throw new IllegalArgumentException("Unknown " + entity + ": " + id);
        }
    }
}

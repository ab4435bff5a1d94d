/**
 * Transactional persistence for series, sources, chapters and review state
 *
 * Features:
 * - inTransaction() runs work atomically; nested calls join the outer transaction
 * - Upserts rely on storage-level unique constraints: (source_name, source_id) and source_url_hash
 *   for sources, (series_id, chapter number) for logical chapters, (series_source_id, chapter_id)
 *   for chapter sources
 * - findOrCreateSource() is the atomic linking primitive used by canonicalization
 * - Merge helpers re-parent rows and must be called inside one transaction
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
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

public interface ChapterSyncStore {

    /**
     * Result of {@link #findOrCreateSource(SeriesSource)}.
     */
    record SourceLink(SeriesSource source, boolean created) {}

    /**
     * Result of {@link #mergeChapters(String, String, Instant)}.
     *
     * @param moved     chapters re-parented to the primary series
     * @param collapsed secondary chapters whose number already existed on the primary; their
     *                  availability rows moved over and the duplicate was tombstoned
     */
    record ChapterMergeResult(int moved, int collapsed) {}

    // ---- transactions and locks ----

    <T> T inTransaction(Supplier<T> work);

    default void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Transaction-scoped advisory lock, released automatically at commit or rollback.
     * Must be called inside {@link #inTransaction(Supplier)}.
     *
     * @return false when another transaction holds the lock
     */
    boolean tryTransactionLock(ResourceKey key);

    // ---- series ----

    Series insertSeries(Series series);

    Series updateSeries(Series series);

    Optional<Series> findSeries(String seriesId);

    /**
     * Canonical (non-alias) series whose titles resemble any of the given normalized titles.
     */
    List<Series> findMatchCandidates(Set<String> normalizedTitles, int limit);

    List<Series> findAliasesOf(String seriesId);

    /**
     * Points every alias of {@code fromSeriesId} at {@code toSeriesId}, keeping alias chains one hop long.
     */
    int redirectAliases(String fromSeriesId, String toSeriesId);

    Optional<Series> findSeriesByExternalId(String provider, String externalId);

    Map<String, String> findExternalIds(String seriesId);

    /**
     * Records external ids for a series. Ids already owned by any series are left untouched.
     */
    void addExternalIds(String seriesId, Map<String, String> externalIds);

    int reparentExternalIds(String fromSeriesId, String toSeriesId);

    // ---- series sources ----

    Optional<SeriesSource> findSource(String seriesSourceId);

    Optional<SeriesSource> findSourceByIdentity(String sourceName, String sourceId);

    Optional<SeriesSource> findSourceByUrlHash(String sourceUrlHash);

    /**
     * Atomically inserts the source or returns the row already holding {@code (sourceName, sourceId)}.
     */
    SourceLink findOrCreateSource(SeriesSource draft);

    SeriesSource updateSource(SeriesSource source);

    List<SeriesSource> findSourcesForSeries(String seriesId);

    int reparentSources(String fromSeriesId, String toSeriesId);

    List<SyncCandidate> findSyncCandidates(Instant lastSuccessBefore, int limit);

    int promoteSourcesWithFollowers(long followerThreshold);

    int demoteIdleSources(SyncPriority from, SyncPriority to, Instant noNewChapterSince);

    List<SeriesSource> findHealableSources(int maxRetries, Instant attemptedBefore, int limit);

    int markStuckPendingFailed(Instant attemptedBefore);

    /**
     * Count of sources per tier whose last success is older than the tier's interval (or missing).
     */
    Map<SyncPriority, Long> countStaleByTier(Instant now, Map<SyncPriority, Duration> intervals);

    // ---- chapters ----

    List<StoredChapter> findChapterSources(String seriesSourceId);

    /**
     * Inserts the logical chapter or returns the existing one for {@code (seriesId, number)}.
     * Missing title, volume and publish date are filled in; a tombstone is cleared.
     */
    LogicalChapter upsertLogicalChapter(LogicalChapter draft);

    /**
     * Inserts or refreshes availability for {@code (seriesSourceId, chapterId)}, keeping the original detection time.
     */
    ChapterSource upsertChapterSource(ChapterSource draft);

    int tombstoneChapterSources(Collection<String> chapterSourceIds, Instant deletedAt);

    /**
     * Tombstones the given logical chapters that no available source still serves.
     */
    int tombstoneOrphanedChapters(Collection<String> chapterIds, Instant deletedAt);

    Optional<LogicalChapter> findLogicalChapter(String seriesId, ChapterNumber number);

    List<LogicalChapter> findLogicalChapters(String seriesId);

    ChapterMergeResult mergeChapters(String fromSeriesId, String toSeriesId, Instant now);

    // ---- merges and review ----

    void insertMergeRecord(MergeRecord record);

    List<MergeRecord> findMergeRecords(String seriesId);

    /**
     * Inserts a review item unless an open one with the same series, candidate and reason exists.
     */
    ReviewItem insertReviewItem(ReviewItem item);

    Optional<ReviewItem> findReviewItem(String reviewItemId);

    List<ReviewItem> findOpenReviewItems(int limit);

    ReviewItem updateReviewItem(ReviewItem item);
}

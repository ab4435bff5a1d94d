/**
 * Postgres-backed store for series, sources, chapters and review items
 *
 * Features:
 * - Outermost transactions run through a TransactionTemplate wrapped in the store retry template,
 *   so serialization failures and lock timeouts are retried as a whole
 * - Nested calls join the surrounding transaction and are never retried on their own
 * - Upserts use ON CONFLICT against the schema's unique constraints
 * - Transaction-scoped advisory locks via pg_try_advisory_xact_lock
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
import com.williamcallahan.chapter_sync_engine.types.ChapterBand;
import com.williamcallahan.chapter_sync_engine.types.MetadataSourceRank;
import com.williamcallahan.chapter_sync_engine.types.MetadataStatus;
import com.williamcallahan.chapter_sync_engine.types.ReviewReason;
import com.williamcallahan.chapter_sync_engine.types.ReviewResolution;
import com.williamcallahan.chapter_sync_engine.types.ReviewStatus;
import com.williamcallahan.chapter_sync_engine.types.SeriesStatus;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncStatus;
import com.williamcallahan.chapter_sync_engine.util.IdGenerator;
import com.williamcallahan.chapter_sync_engine.util.JdbcUtils;
import com.williamcallahan.chapter_sync_engine.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Slf4j
public class JdbcChapterSyncStore implements ChapterSyncStore {

    private static final String SERIES_COLUMNS = """
        s.id, s.title, s.creators, s.language, s.publication_year, s.status, s.metadata_schema_version,
        s.canonical_series_id, s.needs_review, s.metadata_source, s.follower_count, s.created_at, s.updated_at,
        ARRAY(SELECT t.title FROM series_titles t WHERE t.series_id = s.id AND NOT t.is_primary ORDER BY t.title)
            AS alternative_titles
        """;

    private static final String CHAPTER_SOURCE_WITH_NUMBER = """
        SELECT cs.*, lc.chapter_band, lc.chapter_int, lc.chapter_frac
        FROM chapter_sources cs
        JOIN logical_chapters lc ON lc.id = cs.chapter_id
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;

    private final RowMapper<Series> seriesMapper = this::mapSeries;
    private final RowMapper<SeriesSource> sourceMapper = this::mapSource;
    private final RowMapper<LogicalChapter> chapterMapper = this::mapLogicalChapter;
    private final RowMapper<ChapterSource> chapterSourceMapper = this::mapChapterSource;
    private final RowMapper<ReviewItem> reviewMapper = this::mapReviewItem;

    public JdbcChapterSyncStore(JdbcTemplate jdbcTemplate,
                                PlatformTransactionManager transactionManager,
                                RetryTemplate storeRetryTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.retryTemplate = storeRetryTemplate;
    }

    // ---- transactions and locks ----

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.info("Retrying store transaction (attempt {}) after {}", context.getRetryCount() + 1,
                    context.getLastThrowable() == null ? "unknown" : context.getLastThrowable().getClass().getSimpleName());
            }
            return transactionTemplate.execute(status -> work.get());
        });
    }

    @Override
    public boolean tryTransactionLock(ResourceKey key) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Transaction lock requested outside a transaction: " + key.describe());
        }
        Boolean acquired = jdbcTemplate.queryForObject("SELECT pg_try_advisory_xact_lock(?)", Boolean.class, key.value());
        return Boolean.TRUE.equals(acquired);
    }

    // ---- series ----

    @Override
    public Series insertSeries(Series series) {
        return inTransaction(() -> {
            String id = series.id() != null ? series.id() : IdGenerator.newId();
            jdbcTemplate.update("""
                INSERT INTO series (id, title, creators, language, publication_year, status, metadata_schema_version,
                                    canonical_series_id, needs_review, metadata_source, follower_count, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, COALESCE(?, NOW()), COALESCE(?, NOW()))
                """,
                id,
                series.title(),
                series.creators().toArray(new String[0]),
                series.language(),
                series.publicationYear(),
                series.status() == null ? null : series.status().dbValue(),
                series.metadataSchemaVersion(),
                series.canonicalSeriesId(),
                series.needsReview(),
                series.metadataSource().dbValue(),
                series.followerCount(),
                JdbcUtils.timestamp(series.createdAt()),
                JdbcUtils.timestamp(series.updatedAt()));
            writeTitles(id, series.title(), series.alternativeTitles());
            return findSeries(id).orElseThrow(() -> new IllegalStateException("Inserted series vanished: " + id));
        });
    }

    @Override
    public Series updateSeries(Series series) {
        return inTransaction(() -> {
            int updated = jdbcTemplate.update("""
                UPDATE series
                SET title = ?, creators = ?, language = ?, publication_year = ?, status = ?,
                    metadata_schema_version = ?, canonical_series_id = ?, needs_review = ?,
                    metadata_source = ?, follower_count = ?, updated_at = COALESCE(?, NOW())
                WHERE id = ?
                """,
                series.title(),
                series.creators().toArray(new String[0]),
                series.language(),
                series.publicationYear(),
                series.status() == null ? null : series.status().dbValue(),
                series.metadataSchemaVersion(),
                series.canonicalSeriesId(),
                series.needsReview(),
                series.metadataSource().dbValue(),
                series.followerCount(),
                JdbcUtils.timestamp(series.updatedAt()),
                series.id());
            if (updated == 0) {
                throw new IllegalArgumentException("Unknown series: " + series.id());
            }
            writeTitles(series.id(), series.title(), series.alternativeTitles());
            return series;
        });
    }

    @Override
    public Optional<Series> findSeries(String seriesId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            "SELECT " + SERIES_COLUMNS + " FROM series s WHERE s.id = ?", seriesMapper, seriesId);
    }

    @Override
    public List<Series> findMatchCandidates(Set<String> normalizedTitles, int limit) {
        if (normalizedTitles.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT " + SERIES_COLUMNS + """
            FROM series s
            JOIN (
                SELECT t.series_id, MAX(similarity(t.normalized_title, q.title)) AS score
                FROM series_titles t
                JOIN unnest(?::text[]) AS q(title)
                  ON t.normalized_title = q.title OR t.normalized_title % q.title
                GROUP BY t.series_id
            ) m ON m.series_id = s.id
            WHERE s.canonical_series_id IS NULL
            ORDER BY m.score DESC, s.created_at ASC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, seriesMapper, normalizedTitles.toArray(new String[0]), limit);
    }

    @Override
    public List<Series> findAliasesOf(String seriesId) {
        return jdbcTemplate.query("SELECT " + SERIES_COLUMNS + " FROM series s WHERE s.canonical_series_id = ?",
            seriesMapper, seriesId);
    }

    @Override
    public int redirectAliases(String fromSeriesId, String toSeriesId) {
        return jdbcTemplate.update("""
            UPDATE series SET canonical_series_id = ?, updated_at = NOW()
            WHERE canonical_series_id = ? AND id <> ?
            """, toSeriesId, fromSeriesId, toSeriesId);
    }

    @Override
    public Optional<Series> findSeriesByExternalId(String provider, String externalId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate, "SELECT " + SERIES_COLUMNS + """
            FROM series s
            JOIN series_external_ids e ON e.series_id = s.id
            WHERE e.provider = ? AND e.external_id = ?
            """, seriesMapper, provider, externalId);
    }

    @Override
    public Map<String, String> findExternalIds(String seriesId) {
        Map<String, String> ids = new LinkedHashMap<>();
        jdbcTemplate.query("SELECT provider, external_id FROM series_external_ids WHERE series_id = ? ORDER BY provider",
            rs -> {
                ids.put(rs.getString("provider"), rs.getString("external_id"));
            }, seriesId);
        return ids;
    }

    @Override
    public void addExternalIds(String seriesId, Map<String, String> externalIds) {
        if (externalIds.isEmpty()) {
            return;
        }
        inTransaction(() -> externalIds.forEach((provider, externalId) -> jdbcTemplate.update("""
            INSERT INTO series_external_ids (series_id, provider, external_id)
            VALUES (?, ?, ?)
            ON CONFLICT (provider, external_id) DO NOTHING
            """, seriesId, provider, externalId)));
    }

    @Override
    public int reparentExternalIds(String fromSeriesId, String toSeriesId) {
        return jdbcTemplate.update("UPDATE series_external_ids SET series_id = ? WHERE series_id = ?", toSeriesId, fromSeriesId);
    }

    // ---- series sources ----

    @Override
    public Optional<SeriesSource> findSource(String seriesSourceId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate, "SELECT * FROM series_sources WHERE id = ?",
            sourceMapper, seriesSourceId);
    }

    @Override
    public Optional<SeriesSource> findSourceByIdentity(String sourceName, String sourceId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            "SELECT * FROM series_sources WHERE source_name = ? AND source_id = ?", sourceMapper, sourceName, sourceId);
    }

    @Override
    public Optional<SeriesSource> findSourceByUrlHash(String sourceUrlHash) {
        if (sourceUrlHash == null) {
            return Optional.empty();
        }
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            "SELECT * FROM series_sources WHERE source_url_hash = ?", sourceMapper, sourceUrlHash);
    }

    @Override
    public SourceLink findOrCreateSource(SeriesSource draft) {
        return inTransaction(() -> {
            String id = draft.id() != null ? draft.id() : IdGenerator.newId();
            List<SeriesSource> inserted = jdbcTemplate.query("""
                INSERT INTO series_sources (id, series_id, source_name, source_id, source_url, source_url_hash, source_title,
                                            trust_score, sync_priority, sync_status, metadata_status, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, COALESCE(?, NOW()))
                ON CONFLICT (source_name, source_id) DO NOTHING
                RETURNING *
                """,
                sourceMapper,
                id,
                draft.seriesId(),
                draft.sourceName(),
                draft.sourceId(),
                draft.sourceUrl(),
                draft.sourceUrlHash(),
                draft.sourceTitle(),
                draft.trustScore(),
                draft.syncPriority() == null ? SyncPriority.WARM.dbValue() : draft.syncPriority().dbValue(),
                draft.syncStatus() == null ? SyncStatus.PENDING.dbValue() : draft.syncStatus().dbValue(),
                draft.metadataStatus() == null ? MetadataStatus.PENDING.dbValue() : draft.metadataStatus().dbValue(),
                JdbcUtils.timestamp(draft.createdAt()));
            if (!inserted.isEmpty()) {
                return new SourceLink(inserted.get(0), true);
            }
            SeriesSource existing = findSourceByIdentity(draft.sourceName(), draft.sourceId())
                .orElseThrow(() -> new IllegalStateException(
                    "Source conflict without a row: " + draft.sourceName() + "/" + draft.sourceId()));
            return new SourceLink(existing, false);
        });
    }

    @Override
    public SeriesSource updateSource(SeriesSource source) {
        int updated = jdbcTemplate.update("""
            UPDATE series_sources
            SET series_id = ?, source_url = ?, source_url_hash = ?, source_title = ?, trust_score = ?,
                sync_priority = ?, sync_status = ?, metadata_status = ?, metadata_retry_count = ?,
                metadata_attempted_at = ?, consecutive_failures = ?, chapter_count = ?, last_success_at = ?,
                last_full_sync_at = ?, last_checked_at = ?, last_chapter_detected_at = ?
            WHERE id = ?
            """,
            source.seriesId(),
            source.sourceUrl(),
            source.sourceUrlHash(),
            source.sourceTitle(),
            source.trustScore(),
            source.syncPriority() == null ? SyncPriority.WARM.dbValue() : source.syncPriority().dbValue(),
            source.syncStatus() == null ? SyncStatus.PENDING.dbValue() : source.syncStatus().dbValue(),
            source.metadataStatus() == null ? MetadataStatus.PENDING.dbValue() : source.metadataStatus().dbValue(),
            source.metadataRetryCount(),
            JdbcUtils.timestamp(source.metadataAttemptedAt()),
            source.consecutiveFailures(),
            source.chapterCount(),
            JdbcUtils.timestamp(source.lastSuccessAt()),
            JdbcUtils.timestamp(source.lastFullSyncAt()),
            JdbcUtils.timestamp(source.lastCheckedAt()),
            JdbcUtils.timestamp(source.lastChapterDetectedAt()),
            source.id());
        if (updated == 0) {
            throw new IllegalArgumentException("Unknown series source: " + source.id());
        }
        return source;
    }

    @Override
    public List<SeriesSource> findSourcesForSeries(String seriesId) {
        return jdbcTemplate.query("SELECT * FROM series_sources WHERE series_id = ? ORDER BY created_at", sourceMapper, seriesId);
    }

    @Override
    public int reparentSources(String fromSeriesId, String toSeriesId) {
        return jdbcTemplate.update("UPDATE series_sources SET series_id = ? WHERE series_id = ?", toSeriesId, fromSeriesId);
    }

    @Override
    public List<SyncCandidate> findSyncCandidates(Instant lastSuccessBefore, int limit) {
        return jdbcTemplate.query("""
            SELECT id, source_name, sync_priority, last_success_at, last_full_sync_at
            FROM series_sources
            WHERE sync_status <> 'disabled'
              AND (last_success_at IS NULL OR last_success_at <= ?)
            ORDER BY last_success_at ASC NULLS FIRST
            LIMIT ?
            """,
            (rs, rowNum) -> new SyncCandidate(
                rs.getString("id"),
                rs.getString("source_name"),
                rs.getString("sync_priority"),
                JdbcUtils.instant(rs, "last_success_at"),
                JdbcUtils.instant(rs, "last_full_sync_at")),
            JdbcUtils.timestamp(lastSuccessBefore), limit);
    }

    @Override
    public int promoteSourcesWithFollowers(long followerThreshold) {
        return jdbcTemplate.update("""
            UPDATE series_sources ss
            SET sync_priority = 'HOT'
            FROM series s
            WHERE s.id = ss.series_id
              AND s.follower_count > ?
              AND ss.sync_priority <> 'HOT'
              AND ss.sync_status NOT IN ('broken', 'disabled')
            """, followerThreshold);
    }

    @Override
    public int demoteIdleSources(SyncPriority from, SyncPriority to, Instant noNewChapterSince) {
        return jdbcTemplate.update("""
            UPDATE series_sources
            SET sync_priority = ?
            WHERE sync_priority = ?
              AND COALESCE(last_chapter_detected_at, created_at) < ?
            """, to.dbValue(), from.dbValue(), JdbcUtils.timestamp(noNewChapterSince));
    }

    @Override
    public List<SeriesSource> findHealableSources(int maxRetries, Instant attemptedBefore, int limit) {
        return jdbcTemplate.query("""
            SELECT * FROM series_sources
            WHERE metadata_status IN ('failed', 'unavailable')
              AND metadata_retry_count < ?
              AND (metadata_attempted_at IS NULL OR metadata_attempted_at < ?)
            ORDER BY metadata_retry_count ASC, metadata_attempted_at ASC NULLS FIRST
            LIMIT ?
            """, sourceMapper, maxRetries, JdbcUtils.timestamp(attemptedBefore), limit);
    }

    @Override
    public int markStuckPendingFailed(Instant attemptedBefore) {
        return jdbcTemplate.update("""
            UPDATE series_sources
            SET metadata_status = 'failed'
            WHERE metadata_status = 'pending'
              AND COALESCE(metadata_attempted_at, created_at) < ?
            """, JdbcUtils.timestamp(attemptedBefore));
    }

    @Override
    public Map<SyncPriority, Long> countStaleByTier(Instant now, Map<SyncPriority, Duration> intervals) {
        Map<SyncPriority, Long> counts = new EnumMap<>(SyncPriority.class);
        for (SyncPriority priority : SyncPriority.values()) {
            Instant threshold = now.minus(intervals.get(priority));
            counts.put(priority, JdbcUtils.queryForCount(jdbcTemplate, """
                SELECT COUNT(*) FROM series_sources
                WHERE sync_priority = ?
                  AND sync_status <> 'disabled'
                  AND (last_success_at IS NULL OR last_success_at <= ?)
                """, priority.dbValue(), JdbcUtils.timestamp(threshold)));
        }
        return counts;
    }

    // ---- chapters ----

    @Override
    public List<StoredChapter> findChapterSources(String seriesSourceId) {
        List<StoredChapter> rows = jdbcTemplate.query(CHAPTER_SOURCE_WITH_NUMBER + " WHERE cs.series_source_id = ?",
            (rs, rowNum) -> new StoredChapter(mapChapterSource(rs, rowNum), mapNumber(rs)), seriesSourceId);
        rows.sort(Comparator.comparing(StoredChapter::number));
        return rows;
    }

    @Override
    public LogicalChapter upsertLogicalChapter(LogicalChapter draft) {
        ChapterNumber number = draft.number();
        return jdbcTemplate.queryForObject("""
            INSERT INTO logical_chapters (id, series_id, chapter_band, chapter_int, chapter_frac, chapter_title,
                                          volume_number, published_at, first_seen_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, COALESCE(?, NOW()))
            ON CONFLICT (series_id, chapter_band, chapter_int, chapter_frac) DO UPDATE
            SET chapter_title = COALESCE(logical_chapters.chapter_title, EXCLUDED.chapter_title),
                volume_number = COALESCE(logical_chapters.volume_number, EXCLUDED.volume_number),
                published_at = COALESCE(logical_chapters.published_at, EXCLUDED.published_at),
                deleted_at = NULL
            RETURNING *
            """,
            chapterMapper,
            draft.id() != null ? draft.id() : IdGenerator.newId(),
            draft.seriesId(),
            number.band().name(),
            number.integerPart(),
            number.fractionalPart(),
            draft.chapterTitle(),
            draft.volumeNumber(),
            JdbcUtils.timestamp(draft.publishedAt()),
            JdbcUtils.timestamp(draft.firstSeenAt()));
    }

    @Override
    public ChapterSource upsertChapterSource(ChapterSource draft) {
        return jdbcTemplate.queryForObject("""
            INSERT INTO chapter_sources (id, chapter_id, series_source_id, source_chapter_id, source_chapter_url,
                                         chapter_title, is_available, detected_at, source_published_at, last_checked_at)
            VALUES (?, ?, ?, ?, ?, ?, TRUE, COALESCE(?, NOW()), ?, ?)
            ON CONFLICT (series_source_id, chapter_id) DO UPDATE
            SET source_chapter_id = EXCLUDED.source_chapter_id,
                source_chapter_url = EXCLUDED.source_chapter_url,
                chapter_title = EXCLUDED.chapter_title,
                is_available = TRUE,
                source_published_at = COALESCE(EXCLUDED.source_published_at, chapter_sources.source_published_at),
                last_checked_at = EXCLUDED.last_checked_at,
                deleted_at = NULL
            RETURNING *
            """,
            chapterSourceMapper,
            draft.id() != null ? draft.id() : IdGenerator.newId(),
            draft.chapterId(),
            draft.seriesSourceId(),
            draft.sourceChapterId(),
            draft.sourceChapterUrl(),
            draft.chapterTitle(),
            JdbcUtils.timestamp(draft.detectedAt()),
            JdbcUtils.timestamp(draft.sourcePublishedAt()),
            JdbcUtils.timestamp(draft.lastCheckedAt()));
    }

    @Override
    public int tombstoneChapterSources(Collection<String> chapterSourceIds, Instant deletedAt) {
        if (chapterSourceIds.isEmpty()) {
            return 0;
        }
        return jdbcTemplate.update("""
            UPDATE chapter_sources
            SET is_available = FALSE, deleted_at = ?, last_checked_at = ?
            WHERE id = ANY(?) AND deleted_at IS NULL
            """,
            JdbcUtils.timestamp(deletedAt), JdbcUtils.timestamp(deletedAt), chapterSourceIds.toArray(new String[0]));
    }

    @Override
    public int tombstoneOrphanedChapters(Collection<String> chapterIds, Instant deletedAt) {
        if (chapterIds.isEmpty()) {
            return 0;
        }
        return jdbcTemplate.update("""
            UPDATE logical_chapters lc
            SET deleted_at = ?
            WHERE lc.id = ANY(?)
              AND lc.deleted_at IS NULL
              AND NOT EXISTS (
                  SELECT 1 FROM chapter_sources cs
                  WHERE cs.chapter_id = lc.id AND cs.is_available AND cs.deleted_at IS NULL
              )
            """, JdbcUtils.timestamp(deletedAt), chapterIds.toArray(new String[0]));
    }

    @Override
    public Optional<LogicalChapter> findLogicalChapter(String seriesId, ChapterNumber number) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate, """
            SELECT * FROM logical_chapters
            WHERE series_id = ? AND chapter_band = ? AND chapter_int = ? AND chapter_frac = ?
            """, chapterMapper, seriesId, number.band().name(), number.integerPart(), number.fractionalPart());
    }

    @Override
    public List<LogicalChapter> findLogicalChapters(String seriesId) {
        List<LogicalChapter> chapters = jdbcTemplate.query("SELECT * FROM logical_chapters WHERE series_id = ?",
            chapterMapper, seriesId);
        chapters.sort(Comparator.comparing(LogicalChapter::number));
        return chapters;
    }

    @Override
    public ChapterMergeResult mergeChapters(String fromSeriesId, String toSeriesId, Instant now) {
        return inTransaction(() -> {
            String sameNumber = """
                p.series_id = ? AND p.chapter_band = sc.chapter_band
                AND p.chapter_int = sc.chapter_int AND p.chapter_frac = sc.chapter_frac
                """;
            jdbcTemplate.update("""
                UPDATE chapter_sources cs
                SET chapter_id = p.id
                FROM logical_chapters sc
                JOIN logical_chapters p ON
                """ + sameNumber + """
                WHERE sc.series_id = ? AND cs.chapter_id = sc.id
                """, toSeriesId, fromSeriesId);
            int collapsed = jdbcTemplate.update("""
                UPDATE logical_chapters sc
                SET deleted_at = COALESCE(sc.deleted_at, ?)
                FROM logical_chapters p
                WHERE sc.series_id = ? AND
                """ + sameNumber, JdbcUtils.timestamp(now), fromSeriesId, toSeriesId);
            int moved = jdbcTemplate.update("""
                UPDATE logical_chapters sc
                SET series_id = ?
                WHERE sc.series_id = ?
                  AND NOT EXISTS (SELECT 1 FROM logical_chapters p WHERE
                """ + sameNumber + ")", toSeriesId, fromSeriesId, toSeriesId);
            return new ChapterMergeResult(moved, collapsed);
        });
    }

    // ---- merges and review ----

    @Override
    public void insertMergeRecord(MergeRecord record) {
        jdbcTemplate.update("""
            INSERT INTO series_merges (primary_series_id, secondary_series_id, reason, merged_at)
            VALUES (?, ?, ?, COALESCE(?, NOW()))
            """, record.primarySeriesId(), record.secondarySeriesId(), record.reason(), JdbcUtils.timestamp(record.mergedAt()));
    }

    @Override
    public List<MergeRecord> findMergeRecords(String seriesId) {
        return jdbcTemplate.query("""
            SELECT primary_series_id, secondary_series_id, reason, merged_at
            FROM series_merges
            WHERE primary_series_id = ? OR secondary_series_id = ?
            ORDER BY merged_at, id
            """,
            (rs, rowNum) -> new MergeRecord(
                rs.getString("primary_series_id"),
                rs.getString("secondary_series_id"),
                rs.getString("reason"),
                JdbcUtils.instant(rs, "merged_at")),
            seriesId, seriesId);
    }

    @Override
    public ReviewItem insertReviewItem(ReviewItem item) {
        return inTransaction(() -> {
            List<ReviewItem> inserted = jdbcTemplate.query("""
                INSERT INTO series_review_items (id, series_id, candidate_series_id, series_source_id, reason,
                                                 confidence, status, created_at)
                VALUES (?, ?, ?, ?, ?, ?, 'OPEN', COALESCE(?, NOW()))
                ON CONFLICT DO NOTHING
                RETURNING *
                """,
                reviewMapper,
                item.id() != null ? item.id() : IdGenerator.newId(),
                item.seriesId(),
                item.candidateSeriesId(),
                item.seriesSourceId(),
                item.reason().name(),
                item.confidence(),
                JdbcUtils.timestamp(item.createdAt()));
            if (!inserted.isEmpty()) {
                return inserted.get(0);
            }
            return JdbcUtils.queryForOptionalObject(jdbcTemplate, """
                SELECT * FROM series_review_items
                WHERE series_id = ? AND COALESCE(candidate_series_id, '') = COALESCE(?, '') AND reason = ? AND status = 'OPEN'
                """, reviewMapper, item.seriesId(), item.candidateSeriesId(), item.reason().name())
                .orElseThrow(() -> new IllegalStateException("Review conflict without an open item for series " + item.seriesId()));
        });
    }

    @Override
    public Optional<ReviewItem> findReviewItem(String reviewItemId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate, "SELECT * FROM series_review_items WHERE id = ?",
            reviewMapper, reviewItemId);
    }

    @Override
    public List<ReviewItem> findOpenReviewItems(int limit) {
        return jdbcTemplate.query("SELECT * FROM series_review_items WHERE status = 'OPEN' ORDER BY created_at LIMIT ?",
            reviewMapper, limit);
    }

    @Override
    public ReviewItem updateReviewItem(ReviewItem item) {
        int updated = jdbcTemplate.update("""
            UPDATE series_review_items
            SET status = ?, resolution = ?, resolved_at = ?, confidence = ?
            WHERE id = ?
            """,
            item.status().name(),
            item.resolution() == null ? null : item.resolution().name(),
            JdbcUtils.timestamp(item.resolvedAt()),
            item.confidence(),
            item.id());
        if (updated == 0) {
            throw new IllegalArgumentException("Unknown review item: " + item.id());
        }
        return item;
    }

    // ---- helpers ----

    private void writeTitles(String seriesId, String title, Set<String> alternativeTitles) {
        jdbcTemplate.update("DELETE FROM series_titles WHERE series_id = ?", seriesId);
        insertTitle(seriesId, title, true);
        for (String alternative : alternativeTitles) {
            insertTitle(seriesId, alternative, false);
        }
    }

    private void insertTitle(String seriesId, String title, boolean primary) {
        String normalized = TextUtils.normalizeTitle(title);
        if (normalized.isEmpty()) {
            return;
        }
        jdbcTemplate.update("""
            INSERT INTO series_titles (series_id, title, normalized_title, is_primary)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (series_id, normalized_title) DO NOTHING
            """, seriesId, title, normalized, primary);
    }

    private Series mapSeries(ResultSet rs, int rowNum) throws SQLException {
        return Series.builder()
            .id(rs.getString("id"))
            .title(rs.getString("title"))
            .alternativeTitles(new LinkedHashSet<>(JdbcUtils.stringList(rs, "alternative_titles")))
            .creators(JdbcUtils.stringList(rs, "creators"))
            .language(rs.getString("language"))
            .publicationYear(JdbcUtils.nullableInt(rs, "publication_year"))
            .status(SeriesStatus.parse(rs.getString("status")).orElse(null))
            .metadataSchemaVersion(rs.getInt("metadata_schema_version"))
            .canonicalSeriesId(rs.getString("canonical_series_id"))
            .needsReview(rs.getBoolean("needs_review"))
            .metadataSource(MetadataSourceRank.fromDbValue(rs.getString("metadata_source")))
            .followerCount(rs.getLong("follower_count"))
            .createdAt(JdbcUtils.instant(rs, "created_at"))
            .updatedAt(JdbcUtils.instant(rs, "updated_at"))
            .build();
    }

    private SeriesSource mapSource(ResultSet rs, int rowNum) throws SQLException {
        String id = rs.getString("id");
        return SeriesSource.builder()
            .id(id)
            .seriesId(rs.getString("series_id"))
            .sourceName(rs.getString("source_name"))
            .sourceId(rs.getString("source_id"))
            .sourceUrl(rs.getString("source_url"))
            .sourceUrlHash(rs.getString("source_url_hash"))
            .sourceTitle(rs.getString("source_title"))
            .trustScore(rs.getDouble("trust_score"))
            .syncPriority(parsePriority(id, rs.getString("sync_priority")))
            .syncStatus(SyncStatus.fromDbValue(rs.getString("sync_status")))
            .metadataStatus(MetadataStatus.fromDbValue(rs.getString("metadata_status")))
            .metadataRetryCount(rs.getInt("metadata_retry_count"))
            .metadataAttemptedAt(JdbcUtils.instant(rs, "metadata_attempted_at"))
            .consecutiveFailures(rs.getInt("consecutive_failures"))
            .chapterCount(rs.getInt("chapter_count"))
            .lastSuccessAt(JdbcUtils.instant(rs, "last_success_at"))
            .lastFullSyncAt(JdbcUtils.instant(rs, "last_full_sync_at"))
            .lastCheckedAt(JdbcUtils.instant(rs, "last_checked_at"))
            .lastChapterDetectedAt(JdbcUtils.instant(rs, "last_chapter_detected_at"))
            .createdAt(JdbcUtils.instant(rs, "created_at"))
            .build();
    }

    private SyncPriority parsePriority(String seriesSourceId, String raw) {
        try {
            return SyncPriority.fromDbValue(raw);
        } catch (IllegalArgumentException ex) {
            // Leave the tier unset so a single bad row does not fail whole queries
            log.warn("Series source {} has unreadable sync priority '{}': {}", seriesSourceId, raw, ex.getMessage());
            return null;
        }
    }

    private LogicalChapter mapLogicalChapter(ResultSet rs, int rowNum) throws SQLException {
        return LogicalChapter.builder()
            .id(rs.getString("id"))
            .seriesId(rs.getString("series_id"))
            .number(mapNumber(rs))
            .chapterTitle(rs.getString("chapter_title"))
            .volumeNumber(JdbcUtils.nullableInt(rs, "volume_number"))
            .publishedAt(JdbcUtils.instant(rs, "published_at"))
            .firstSeenAt(JdbcUtils.instant(rs, "first_seen_at"))
            .deletedAt(JdbcUtils.instant(rs, "deleted_at"))
            .build();
    }

    private ChapterNumber mapNumber(ResultSet rs) throws SQLException {
        return new ChapterNumber(
            ChapterBand.valueOf(rs.getString("chapter_band")),
            rs.getLong("chapter_int"),
            rs.getInt("chapter_frac"));
    }

    private ChapterSource mapChapterSource(ResultSet rs, int rowNum) throws SQLException {
        return ChapterSource.builder()
            .id(rs.getString("id"))
            .chapterId(rs.getString("chapter_id"))
            .seriesSourceId(rs.getString("series_source_id"))
            .sourceChapterId(rs.getString("source_chapter_id"))
            .sourceChapterUrl(rs.getString("source_chapter_url"))
            .chapterTitle(rs.getString("chapter_title"))
            .available(rs.getBoolean("is_available"))
            .detectedAt(JdbcUtils.instant(rs, "detected_at"))
            .sourcePublishedAt(JdbcUtils.instant(rs, "source_published_at"))
            .lastCheckedAt(JdbcUtils.instant(rs, "last_checked_at"))
            .deletedAt(JdbcUtils.instant(rs, "deleted_at"))
            .build();
    }

    private ReviewItem mapReviewItem(ResultSet rs, int rowNum) throws SQLException {
        String resolution = rs.getString("resolution");
        return ReviewItem.builder()
            .id(rs.getString("id"))
            .seriesId(rs.getString("series_id"))
            .candidateSeriesId(rs.getString("candidate_series_id"))
            .seriesSourceId(rs.getString("series_source_id"))
            .reason(ReviewReason.valueOf(rs.getString("reason")))
            .confidence(rs.getDouble("confidence"))
            .status(ReviewStatus.valueOf(rs.getString("status")))
            .resolution(resolution == null ? null : ReviewResolution.valueOf(resolution))
            .createdAt(JdbcUtils.instant(rs, "created_at"))
            .resolvedAt(JdbcUtils.instant(rs, "resolved_at"))
            .build();
    }
}

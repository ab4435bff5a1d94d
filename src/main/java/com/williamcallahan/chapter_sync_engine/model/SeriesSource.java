package com.williamcallahan.chapter_sync_engine.model;

import com.williamcallahan.chapter_sync_engine.types.MetadataStatus;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncStatus;
import lombok.Builder;

import java.time.Instant;

/**
 * Link between a canonical series and one upstream representation of it.
 * {@code (sourceName, sourceId)} is unique, and so is {@code sourceUrlHash}.
 */
@Builder(toBuilder = true)
public record SeriesSource(
    String id,
    String seriesId,
    String sourceName,
    String sourceId,
    String sourceUrl,
    String sourceUrlHash,
    String sourceTitle,
    double trustScore,
    SyncPriority syncPriority,
    SyncStatus syncStatus,
    MetadataStatus metadataStatus,
    int metadataRetryCount,
    Instant metadataAttemptedAt,
    int consecutiveFailures,
    int chapterCount,
    Instant lastSuccessAt,
    Instant lastFullSyncAt,
    Instant lastCheckedAt,
    Instant lastChapterDetectedAt,
    Instant createdAt
) {}

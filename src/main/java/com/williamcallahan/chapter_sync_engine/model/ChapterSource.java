package com.williamcallahan.chapter_sync_engine.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Availability of one logical chapter on one series source, unique per {@code (seriesSourceId, chapterId)}.
 */
@Builder(toBuilder = true)
public record ChapterSource(
    String id,
    String chapterId,
    String seriesSourceId,
    String sourceChapterId,
    String sourceChapterUrl,
    String chapterTitle,
    boolean available,
    Instant detectedAt,
    Instant sourcePublishedAt,
    Instant lastCheckedAt,
    Instant deletedAt
) {}

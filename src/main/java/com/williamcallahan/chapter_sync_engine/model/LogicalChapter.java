package com.williamcallahan.chapter_sync_engine.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Canonical chapter identity, unique per {@code (seriesId, number)}. Tombstoned, never hard-deleted.
 */
@Builder(toBuilder = true)
public record LogicalChapter(
    String id,
    String seriesId,
    ChapterNumber number,
    String chapterTitle,
    Integer volumeNumber,
    Instant publishedAt,
    Instant firstSeenAt,
    Instant deletedAt
) {

    public boolean isDeleted() {
        return deletedAt != null;
    }
}

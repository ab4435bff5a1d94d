package com.williamcallahan.chapter_sync_engine.model;

import java.time.Instant;

/**
 * Upstream chapter after number normalization and url cleanup.
 */
public record NormalizedChapter(
    ChapterNumber number,
    String title,
    Integer volume,
    Instant publishedAt,
    String sourceChapterId,
    String url
) {}

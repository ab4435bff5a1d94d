package com.williamcallahan.chapter_sync_engine.model;

import java.time.Instant;

/**
 * One chapter entry as returned by an upstream source, before normalization.
 */
public record RawChapter(
    String number,
    String title,
    String volume,
    Instant publishedAt,
    String sourceChapterId,
    String url
) {}

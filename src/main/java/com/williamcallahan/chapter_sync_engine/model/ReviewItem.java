package com.williamcallahan.chapter_sync_engine.model;

import com.williamcallahan.chapter_sync_engine.types.ReviewReason;
import com.williamcallahan.chapter_sync_engine.types.ReviewResolution;
import com.williamcallahan.chapter_sync_engine.types.ReviewStatus;
import lombok.Builder;

import java.time.Instant;

@Builder(toBuilder = true)
public record ReviewItem(
    String id,
    String seriesId,
    String candidateSeriesId,
    String seriesSourceId,
    ReviewReason reason,
    double confidence,
    ReviewStatus status,
    ReviewResolution resolution,
    Instant createdAt,
    Instant resolvedAt
) {}

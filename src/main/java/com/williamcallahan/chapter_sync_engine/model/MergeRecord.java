package com.williamcallahan.chapter_sync_engine.model;

import java.time.Instant;

/**
 * Audit row written in the same transaction that re-parents the secondary series.
 */
public record MergeRecord(String primarySeriesId, String secondarySeriesId, String reason, Instant mergedAt) {}

package com.williamcallahan.chapter_sync_engine.model;

import java.time.Instant;

/**
 * Scheduler view of a series source. The tier is kept raw so a malformed value can be
 * reported for that row alone.
 */
public record SyncCandidate(
    String seriesSourceId,
    String sourceName,
    String rawPriority,
    Instant lastSuccessAt,
    Instant lastFullSyncAt
) {}

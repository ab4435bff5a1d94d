package com.williamcallahan.chapter_sync_engine.service.ingestion;

import com.williamcallahan.chapter_sync_engine.concurrency.FenceGuard;
import com.williamcallahan.chapter_sync_engine.types.SyncType;

import java.util.Objects;

/**
 * @param fence checked right before every chapter transaction commits
 */
public record SyncRequest(String seriesSourceId, SyncType syncType, FenceGuard fence) {

    public SyncRequest {
        if (seriesSourceId == null || seriesSourceId.isBlank()) {
            throw new IllegalArgumentException("seriesSourceId is required");
        }
        Objects.requireNonNull(syncType, "syncType");
        fence = fence == null ? FenceGuard.unfenced() : fence;
    }

    public static SyncRequest unfenced(String seriesSourceId, SyncType syncType) {
        return new SyncRequest(seriesSourceId, syncType, FenceGuard.unfenced());
    }
}

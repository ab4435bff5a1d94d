package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds job requests with deterministic idempotency keys for every queue.
 */
public final class JobPayloads {

    public static final String SERIES_SOURCE_ID = "seriesSourceId";
    public static final String SYNC_TYPE = "syncType";
    public static final String SOURCE_NAME = "sourceName";
    public static final String SOURCE_ID = "sourceId";
    public static final String SOURCE_URL = "sourceUrl";

    private JobPayloads() {
    }

    public static JobRequest syncSource(String seriesSourceId, String sourceName, SyncType syncType, SyncPriority priority) {
        return new JobRequest(
            QueueName.SYNC_SOURCE,
            syncKey(syncType, seriesSourceId),
            sourceName,
            Map.of(SERIES_SOURCE_ID, seriesSourceId, SYNC_TYPE, syncType.name()),
            priorityFor(priority));
    }

    public static String syncKey(SyncType syncType, String seriesSourceId) {
        return "sync:" + syncType.keySegment() + ":" + seriesSourceId;
    }

    public static JobRequest canonicalize(String sourceName, String sourceId, String sourceUrl) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(SOURCE_NAME, sourceName);
        payload.put(SOURCE_ID, sourceId);
        if (sourceUrl != null) {
            payload.put(SOURCE_URL, sourceUrl);
        }
        return new JobRequest(QueueName.CANONICALIZE, "canonicalize:" + sourceName + ":" + sourceId, sourceName,
            payload, JobRequest.DEFAULT_PRIORITY);
    }

    public static JobRequest enrichMetadata(String seriesSourceId, String sourceName) {
        return new JobRequest(QueueName.ENRICH_METADATA, "enrich:" + seriesSourceId, sourceName,
            Map.of(SERIES_SOURCE_ID, seriesSourceId), 7);
    }

    public static int priorityFor(SyncPriority priority) {
        return switch (priority) {
            case HOT -> 1;
            case WARM -> 5;
            case COLD -> 9;
        };
    }

    /**
     * Reads a required payload value.
     *
     * @throws IllegalArgumentException when the value is missing
     */
    public static String require(Job job, String key) {
        String value = job.payloadValue(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job " + job.id() + " is missing payload field '" + key + "'");
        }
        return value;
    }
}

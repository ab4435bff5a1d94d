package com.williamcallahan.chapter_sync_engine.types;

import java.util.Locale;

/**
 * Named job queues. Each queue has its own concurrency cap and job type defaults.
 */
public enum QueueName {
    SYNC_SOURCE("sync-source"),
    CANONICALIZE("canonicalize"),
    ENRICH_METADATA("enrich-metadata");

    private final String queueId;

    QueueName(String queueId) {
        this.queueId = queueId;
    }

    public String queueId() {
        return queueId;
    }

    public static QueueName fromQueueId(String value) {
        for (QueueName name : values()) {
            if (name.queueId.equals(value)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unknown queue '" + value + "'");
    }

    @Override
    public String toString() {
        return queueId.toLowerCase(Locale.ROOT);
    }
}

package com.williamcallahan.chapter_sync_engine.concurrency;

import com.williamcallahan.chapter_sync_engine.types.ResourceKind;

import java.util.List;

/**
 * A lockable resource and its 63-bit advisory lock key.
 *
 * @param value non-negative key passed to the database lock functions
 */
public record ResourceKey(ResourceKind kind, List<String> ids, long value) {

    public ResourceKey {
        ids = List.copyOf(ids);
        if (value < 0) {
            throw new IllegalArgumentException("Lock key must be non-negative");
        }
    }

    public String describe() {
        return kind.name().toLowerCase() + ":" + String.join(":", ids);
    }
}

package com.williamcallahan.chapter_sync_engine.types;

import java.util.Locale;

/**
 * Kind of sync requested for a source. Only {@link #FULL} syncs may tombstone chapters,
 * because an incremental fetch can legitimately omit older entries.
 */
public enum SyncType {
    FULL,
    INCREMENTAL;

    public String keySegment() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean allowsTombstoning() {
        return switch (this) {
            case FULL -> true;
            case INCREMENTAL -> false;
        };
    }
}

package com.williamcallahan.chapter_sync_engine.types;

import java.util.Locale;

/**
 * How authoritative a series' metadata is. Higher {@link #weight()} wins a merge.
 */
public enum MetadataSourceRank {
    INFERRED,
    CANONICAL_CONFIRMED,
    USER_OVERRIDE;

    public int weight() {
        return switch (this) {
            case USER_OVERRIDE -> 3;
            case CANONICAL_CONFIRMED -> 2;
            case INFERRED -> 1;
        };
    }

    public static MetadataSourceRank fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return INFERRED;
        }
        return MetadataSourceRank.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

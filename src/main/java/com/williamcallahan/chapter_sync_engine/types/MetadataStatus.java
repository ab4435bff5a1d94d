/**
 * Enrichment state of a series source's metadata
 *
 * Features:
 * - Stored lower-case (pending, enriched, unavailable, failed)
 * - Transition helpers keep retry accounting in one place
 */

package com.williamcallahan.chapter_sync_engine.types;

import java.util.Locale;

public enum MetadataStatus {
    PENDING,
    ENRICHED,
    UNAVAILABLE,
    FAILED;

    public static MetadataStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Metadata status is blank");
        }
        return MetadataStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Status after a failed enrichment attempt.
     *
     * @param retryCount retry count after incrementing for this failure
     * @param maxRetries ceiling after which the metadata is considered unavailable
     */
    public MetadataStatus afterFailure(int retryCount, int maxRetries) {
        return switch (this) {
            case ENRICHED -> ENRICHED;
            case PENDING, FAILED, UNAVAILABLE -> retryCount >= maxRetries ? UNAVAILABLE : FAILED;
        };
    }

    /**
     * Whether the healing scheduler should try this entry again.
     */
    public boolean isHealable() {
        return switch (this) {
            case FAILED, UNAVAILABLE -> true;
            case PENDING, ENRICHED -> false;
        };
    }
}

/**
 * Refresh tier of a series source
 *
 * Features:
 * - HOT sources refresh every 30 minutes, WARM every 6 hours, COLD every 48 hours by default
 * - Stored upper-case in the series_sources.sync_priority column
 * - Parsing rejects unknown values so a malformed row surfaces as an error instead of a silent default
 */

package com.williamcallahan.chapter_sync_engine.types;

import java.util.Locale;

public enum SyncPriority {
    HOT,
    WARM,
    COLD;

    /**
     * Parses a stored tier value.
     *
     * @param value raw column value
     * @return the matching tier
     * @throws IllegalArgumentException when the value is blank or not a known tier
     */
    public static SyncPriority fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Sync priority is blank");
        }
        try {
            return SyncPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown sync priority '" + value + "'", ex);
        }
    }

    public String dbValue() {
        return name();
    }
}

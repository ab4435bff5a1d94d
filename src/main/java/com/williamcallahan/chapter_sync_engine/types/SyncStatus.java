/**
 * Coarse, user-visible sync health of a series source
 *
 * Features:
 * - Single definition used by ingestion, scheduling and the health surface
 * - Never carries upstream error text, only the state
 * - DISABLED is operator-owned and is never picked up by the scheduler
 */

package com.williamcallahan.chapter_sync_engine.types;

import java.util.Locale;

public enum SyncStatus {
    PENDING,
    ACTIVE,
    DEGRADED,
    BROKEN,
    DISABLED;

    public static SyncStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return SyncStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the scheduler may enqueue work for a source in this state.
     */
    public boolean isSchedulable() {
        return switch (this) {
            case PENDING, ACTIVE, DEGRADED, BROKEN -> true;
            case DISABLED -> false;
        };
    }

    /**
     * Status after a failed sync, given the number of consecutive failures including this one.
     */
    public SyncStatus afterFailure(int consecutiveFailures, int brokenThreshold) {
        return switch (this) {
            case DISABLED -> DISABLED;
            case PENDING, ACTIVE, DEGRADED, BROKEN -> consecutiveFailures >= brokenThreshold ? BROKEN : DEGRADED;
        };
    }

    public SyncStatus afterSuccess() {
        return switch (this) {
            case DISABLED -> DISABLED;
            case PENDING, ACTIVE, DEGRADED, BROKEN -> ACTIVE;
        };
    }
}

package com.williamcallahan.chapter_sync_engine.types;

import java.util.Locale;
import java.util.Optional;

/**
 * Publication status of a series, ordered cancelled &lt; hiatus &lt; ongoing &lt; completed.
 */
public enum SeriesStatus {
    CANCELLED,
    HIATUS,
    ONGOING,
    COMPLETED;

    public static Optional<SeriesStatus> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("FINISHED".equals(normalized)) {
            return Optional.of(COMPLETED);
        }
        if ("PUBLISHING".equals(normalized) || "RELEASING".equals(normalized)) {
            return Optional.of(ONGOING);
        }
        for (SeriesStatus status : values()) {
            if (status.name().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * A completed series never regresses; every other status may move anywhere.
     */
    public boolean canTransitionTo(SeriesStatus next) {
        if (next == null || next == this) {
            return false;
        }
        return switch (this) {
            case COMPLETED -> false;
            case CANCELLED, HIATUS, ONGOING -> true;
        };
    }
}

package com.williamcallahan.chapter_sync_engine.util;

/**
 * Publication-year drift between two records of what may be the same work.
 */
public final class YearDrift {

    public enum Compatibility {
        /** Drift of at most one year, or a year is missing. */
        COMPATIBLE,
        /** Two to three years apart. */
        NEEDS_REVIEW,
        /** More than three years apart; never matched automatically. */
        INCOMPATIBLE
    }

    public record Check(int drift, Compatibility compatibility) {

        public boolean blocksAutomaticMatch() {
            return compatibility != Compatibility.COMPATIBLE;
        }
    }

    private YearDrift() {
    }

    public static Check check(Integer yearA, Integer yearB) {
        if (yearA == null || yearB == null || yearA <= 0 || yearB <= 0) {
            return new Check(0, Compatibility.COMPATIBLE);
        }
        int drift = Math.abs(yearA - yearB);
        if (drift <= 1) {
            return new Check(drift, Compatibility.COMPATIBLE);
        }
        if (drift <= 3) {
            return new Check(drift, Compatibility.NEEDS_REVIEW);
        }
        return new Check(drift, Compatibility.INCOMPATIBLE);
    }
}

package com.williamcallahan.chapter_sync_engine.types;

/**
 * Outcome of matching a source entity against the canonical series set.
 */
public enum CanonicalizationAction {
    /** The source entity was already linked; nothing changed. */
    ALREADY_LINKED,
    /** Linked to an existing canonical series with high confidence. */
    LINKED,
    /** Created a new series, flagged for manual review. */
    CREATED_NEEDS_REVIEW,
    /** Created a new, unrelated series. */
    CREATED;

    public boolean createdSeries() {
        return switch (this) {
            case CREATED, CREATED_NEEDS_REVIEW -> true;
            case ALREADY_LINKED, LINKED -> false;
        };
    }
}

package com.williamcallahan.chapter_sync_engine.types;

/**
 * What happened when two canonical series were found to match.
 */
public enum ReconcileAction {
    /** Merged deterministically into the higher-ranked series. */
    MERGED,
    /** At least one side was flagged for review; a re-evaluation item was queued instead of merging. */
    REVIEW_QUEUED,
    /** Both ids already resolve to the same canonical series. */
    ALREADY_MERGED,
    /** Confidence too low to act on. */
    BELOW_THRESHOLD
}

package com.williamcallahan.chapter_sync_engine.service.canonical;

import com.williamcallahan.chapter_sync_engine.model.Series;

/**
 * Which of two series survives a merge, and the rule that decided it.
 */
public record MergeDecision(Series primary, Series secondary, Rule decidedBy) {

    public enum Rule {
        METADATA_RANK,
        FOLLOWER_COUNT,
        CREATED_AT,
        SERIES_ID
    }
}

package com.williamcallahan.chapter_sync_engine.types;

public enum ReviewReason {
    LOW_CONFIDENCE_MATCH,
    YEAR_DRIFT,
    MERGE_REEVALUATION
}

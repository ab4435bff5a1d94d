package com.williamcallahan.chapter_sync_engine.types;

public enum ReviewStatus {
    OPEN,
    RESOLVED
}

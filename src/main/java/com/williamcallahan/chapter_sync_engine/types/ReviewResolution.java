package com.williamcallahan.chapter_sync_engine.types;

public enum ReviewResolution {
    MERGE,
    KEEP_SEPARATE
}

package com.williamcallahan.chapter_sync_engine.types;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}

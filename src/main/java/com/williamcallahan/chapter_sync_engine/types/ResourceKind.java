package com.williamcallahan.chapter_sync_engine.types;

/**
 * Namespaces for advisory lock keys. The kind is part of the hashed key, so identical ids under
 * different kinds never share a lock.
 */
public enum ResourceKind {
    /** Chapter writes for one series source. */
    SERIES_SOURCE,
    /** A single logical chapter identity within a series. */
    CHAPTER,
    /** Canonicalization decisions for one normalized title. */
    SERIES_TITLE,
    /** Canonicalization decisions for one upstream entity. */
    SOURCE_IDENTITY,
    /** A merge between two canonical series. */
    SERIES_MERGE
}

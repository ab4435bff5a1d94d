package com.williamcallahan.chapter_sync_engine.service.canonical;

/**
 * Outcome of merging two canonical series. {@code alreadyMerged} means nothing was written.
 */
public record MergeResult(
    String primarySeriesId,
    String secondarySeriesId,
    int sourcesMoved,
    int chaptersMoved,
    int chaptersCollapsed,
    int aliasesRedirected,
    boolean alreadyMerged
) {

    static MergeResult alreadyMerged(String canonicalId, String otherId) {
        return new MergeResult(canonicalId, otherId, 0, 0, 0, 0, true);
    }
}

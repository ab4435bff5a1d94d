package com.williamcallahan.chapter_sync_engine.service.ingestion;

import com.williamcallahan.chapter_sync_engine.types.SyncType;

import java.util.List;

/**
 * Summary of one sync run.
 *
 * @param invalidItems      upstream entries skipped because nothing identified them
 * @param structuralWarning more than the allowed share of chapters vanished; no tombstones were applied
 * @param reordered         the upstream list was not monotonic and was sorted before diffing
 * @param warnings          human readable notes, e.g. chapters arriving far below the stored maximum
 */
public record SyncResult(
    String seriesSourceId,
    SyncType syncType,
    boolean skipped,
    int fetched,
    int added,
    int updated,
    int tombstoned,
    int unchanged,
    int invalidItems,
    int chunksCommitted,
    boolean structuralWarning,
    boolean reordered,
    List<String> warnings
) {

    public SyncResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    static SyncResult skipped(String seriesSourceId, SyncType syncType, String reason) {
        return new SyncResult(seriesSourceId, syncType, true, 0, 0, 0, 0, 0, 0, 0, false, false, List.of(reason));
    }
}

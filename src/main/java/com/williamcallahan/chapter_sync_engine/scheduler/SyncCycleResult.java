package com.williamcallahan.chapter_sync_engine.scheduler;

import java.util.List;

/**
 * Summary of one scheduler run.
 *
 * @param scanned    rows read from the store
 * @param enqueued   new jobs added
 * @param duplicates rows whose job was already outstanding
 * @param locked     rows skipped because another worker holds their lock
 * @param notDue     rows fresh enough for their tier
 */
public record SyncCycleResult(
    int scanned,
    int enqueued,
    int duplicates,
    int locked,
    int notDue,
    int errors,
    boolean halted,
    List<String> errorSamples
) {

    static SyncCycleResult skipped() {
        return new SyncCycleResult(0, 0, 0, 0, 0, 0, false, List.of());
    }
}

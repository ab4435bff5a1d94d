package com.williamcallahan.chapter_sync_engine.concurrency;

import com.williamcallahan.chapter_sync_engine.exception.StaleFenceException;

/**
 * Checked immediately before a write transaction commits. Implementations throw
 * {@link StaleFenceException} when the caller's lease is no longer current, which rolls back the transaction.
 */
@FunctionalInterface
public interface FenceGuard {

    void assertCurrent();

    /**
     * Guard for writes issued outside a leased job (administrative calls, tests).
     */
    static FenceGuard unfenced() {
        return () -> { };
    }
}

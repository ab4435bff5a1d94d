package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.concurrency.FenceGuard;

/**
 * What a handler knows about the lease it runs under.
 *
 * @param fence checked inside every write transaction before it commits
 */
public record JobContext(Job job, String workerId, FenceGuard fence) {

    public int attempt() {
        return job.attempts();
    }
}

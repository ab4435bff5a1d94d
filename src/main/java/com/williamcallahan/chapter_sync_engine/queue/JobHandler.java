package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.QueueName;

/**
 * Executes the jobs of one queue.
 * <p>
 * Handlers may throw anything; the worker pool classifies the failure at the job boundary.
 * A {@link com.williamcallahan.chapter_sync_engine.exception.LockUnavailableException} marks the job
 * as already in progress elsewhere and completes it as SKIPPED.
 */
public interface JobHandler {

    QueueName queue();

    /**
     * @return SUCCEEDED, or SKIPPED when there was nothing to do
     */
    AttemptOutcome handle(JobContext context) throws Exception;
}

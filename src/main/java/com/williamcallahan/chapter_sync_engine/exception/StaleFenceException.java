package com.williamcallahan.chapter_sync_engine.exception;

/**
 * Raised inside a write transaction when the job's lease has moved to another worker.
 * Throwing it rolls the transaction back.
 */
public class StaleFenceException extends RuntimeException {

    public StaleFenceException(String jobId, long fenceToken) {
        super("Fence token " + fenceToken + " is no longer current for job " + jobId);
    }
}

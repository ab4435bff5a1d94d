package com.williamcallahan.chapter_sync_engine.exception;

import java.time.Duration;

public class JobTimeoutException extends RuntimeException {

    public JobTimeoutException(String jobId, Duration timeout) {
        super("Job " + jobId + " exceeded its " + timeout.toSeconds() + "s execution limit");
    }
}

package com.williamcallahan.chapter_sync_engine.scheduler;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.queue.WorkerPool;
import com.williamcallahan.chapter_sync_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the worker pool: claims jobs on the poll interval, heartbeats and enforces timeouts
 * on the heartbeat interval.
 */
@Slf4j
@Component
public class WorkerPoolScheduler {

    private final WorkerPool workerPool;
    private final boolean workersEnabled;

    public WorkerPoolScheduler(WorkerPool workerPool, SyncEngineProperties properties) {
        this.workerPool = workerPool;
        this.workersEnabled = properties.getQueue().isWorkersEnabled();
    }

    @Scheduled(fixedDelayString = "${app.queue.poll-interval:PT1S}", initialDelayString = "PT5S")
    public void poll() {
        if (!workersEnabled || !workerPool.isAccepting()) {
            return;
        }
        try {
            workerPool.pollOnce();
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Worker poll failed");
        }
    }

    @Scheduled(fixedDelayString = "${app.queue.heartbeat-interval:PT15S}", initialDelayString = "PT15S")
    public void heartbeat() {
        if (!workersEnabled) {
            return;
        }
        workerPool.heartbeatActiveJobs();
        try {
            workerPool.enforceTimeouts();
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Timeout enforcement failed");
        }
    }
}

package com.williamcallahan.chapter_sync_engine.scheduler;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.queue.JobQueue;
import com.williamcallahan.chapter_sync_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Queue housekeeping.
 * Returns jobs of stalled workers to the queue once their lease has expired; the next claim issues a
 * new fence token, so the stalled worker can no longer commit. Finished jobs older than the retention
 * window are deleted with their attempt history.
 */
@Slf4j
@Component
public class LeaseReclaimScheduler {

    private final JobQueue jobQueue;
    private final Duration finishedRetention;
    private final Clock clock;

    public LeaseReclaimScheduler(JobQueue jobQueue, SyncEngineProperties properties, Clock clock) {
        this.jobQueue = jobQueue;
        this.finishedRetention = properties.getQueue().getFinishedRetention();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.queue.reclaim-interval:PT30S}", initialDelayString = "PT30S")
    public void reclaimExpiredLeases() {
        try {
            int reclaimed = jobQueue.reclaimExpiredLeases();
            if (reclaimed > 0) {
                log.warn("Reclaimed {} job(s) with expired leases", reclaimed);
            }
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Lease reclaim failed");
        }
    }

    @Scheduled(fixedDelayString = "${app.queue.purge-interval:PT10M}", initialDelayString = "PT1M")
    public void purgeFinishedJobs() {
        Instant cutoff = clock.instant().minus(finishedRetention);
        try {
            int purged = jobQueue.purgeFinished(cutoff);
            if (purged > 0) {
                log.info("Purged {} finished job(s) older than {}", purged, finishedRetention);
            }
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Finished job purge failed");
        }
    }
}

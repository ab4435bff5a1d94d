/**
 * Produces sync jobs for series sources that are due for a refresh
 *
 * Features:
 * - Selects sources whose last success is older than their tier interval, stalest first
 * - Caps each run at the configured batch size, reading extra rows to cover skipped ones
 * - Skips sources whose advisory lock is held instead of queueing behind a slow worker
 * - Chooses a FULL sync when the last full sync is missing or older than the full-sync interval
 * - A malformed row is logged and skipped; the run only halts past the configured error ceiling
 */

package com.williamcallahan.chapter_sync_engine.scheduler;

import com.williamcallahan.chapter_sync_engine.concurrency.ResourceLockProvider;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceLocks;
import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.model.SyncCandidate;
import com.williamcallahan.chapter_sync_engine.monitoring.MetricsService;
import com.williamcallahan.chapter_sync_engine.queue.JobHandle;
import com.williamcallahan.chapter_sync_engine.queue.JobPayloads;
import com.williamcallahan.chapter_sync_engine.queue.JobQueue;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.types.ResourceKind;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncType;
import com.williamcallahan.chapter_sync_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
public class SyncScheduler {

    private final ChapterSyncStore store;
    private final JobQueue jobQueue;
    private final ResourceLockProvider lockProvider;
    private final MetricsService metricsService;
    private final SyncEngineProperties.Scheduler settings;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public SyncScheduler(ChapterSyncStore store,
                         JobQueue jobQueue,
                         ResourceLockProvider lockProvider,
                         MetricsService metricsService,
                         SyncEngineProperties properties,
                         Clock clock) {
        this.store = store;
        this.jobQueue = jobQueue;
        this.lockProvider = lockProvider;
        this.metricsService = metricsService;
        this.settings = properties.getScheduler();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.scheduler.cycle-interval:PT1M}", initialDelayString = "PT10S")
    public void scheduledSyncCycle() {
        if (!settings.isEnabled()) {
            return;
        }
        try {
            runSyncCycle();
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Sync cycle failed");
        }
    }

    /**
     * Enqueues sync jobs for due sources. Overlapping calls return immediately.
     */
    public SyncCycleResult runSyncCycle() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Sync cycle already running, skipping");
            return SyncCycleResult.skipped();
        }
        try {
            return cycle();
        } finally {
            running.set(false);
        }
    }

    private SyncCycleResult cycle() {
        Instant now = clock.instant();
        int batchCap = Math.max(1, settings.getBatchCap());
        int scanLimit = batchCap * Math.max(1, settings.getOverscanFactor());
        List<SyncCandidate> candidates = store.findSyncCandidates(now.minus(settings.shortestInterval()), scanLimit);

        ErrorAccumulator errors = new ErrorAccumulator(settings.getHaltAfterErrors());
        int selected = 0;
        int enqueued = 0;
        int duplicates = 0;
        int locked = 0;
        int notDue = 0;
        boolean halted = false;

        for (SyncCandidate candidate : candidates) {
            if (selected >= batchCap) {
                break;
            }
            try {
                SyncPriority tier = SyncPriority.fromDbValue(candidate.rawPriority());
                if (candidate.lastSuccessAt() != null
                        && candidate.lastSuccessAt().plus(settings.intervalFor(tier)).isAfter(now)) {
                    notDue++;
                    continue;
                }
                if (lockProvider.isHeld(ResourceLocks.resourceLock(ResourceKind.SERIES_SOURCE, candidate.seriesSourceId()))) {
                    log.debug("Source {} is being synced elsewhere, not queueing", candidate.seriesSourceId());
                    locked++;
                    continue;
                }
                JobHandle handle = jobQueue.enqueue(JobPayloads.syncSource(
                    candidate.seriesSourceId(), candidate.sourceName(), syncTypeFor(candidate, now), tier));
                selected++;
                if (handle.enqueued()) {
                    enqueued++;
                } else {
                    duplicates++;
                }
            } catch (RuntimeException e) {
                errors.record(candidate.seriesSourceId(), e);
                metricsService.incrementSchedulerRowError();
                LoggingUtils.warn(log, e, "Skipping series source {} in sync cycle", candidate.seriesSourceId());
                if (errors.shouldHalt()) {
                    log.error("Sync cycle halted after {} row errors", errors.count());
                    halted = true;
                    break;
                }
            }
        }

        SyncCycleResult result = new SyncCycleResult(candidates.size(), enqueued, duplicates, locked, notDue,
            errors.count(), halted, errors.samples());
        if (enqueued > 0 || errors.count() > 0) {
            log.info("Sync cycle: scanned {}, enqueued {}, already queued {}, locked {}, not due {}, errors {}",
                result.scanned(), enqueued, duplicates, locked, notDue, errors.count());
        }
        return result;
    }

    private SyncType syncTypeFor(SyncCandidate candidate, Instant now) {
        Instant lastFull = candidate.lastFullSyncAt();
        return lastFull == null || !lastFull.plus(settings.getFullSyncInterval()).isAfter(now)
            ? SyncType.FULL
            : SyncType.INCREMENTAL;
    }
}

/**
 * Collects the outward health surface of the sync pipeline
 *
 * Features:
 * - Queue depth and job counts per queue
 * - Circuit breaker state per upstream source
 * - Unresolved dead-letter count
 * - Stale source counts per refresh tier
 */

package com.williamcallahan.chapter_sync_engine.monitoring;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.queue.JobQueue;
import com.williamcallahan.chapter_sync_engine.queue.WorkerPool;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.service.SourceCircuitBreakerService;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

@Service
public class SyncHealthService {

    private final JobQueue jobQueue;
    private final ChapterSyncStore store;
    private final SourceCircuitBreakerService circuitBreaker;
    private final WorkerPool workerPool;
    private final SyncEngineProperties.Scheduler schedulerSettings;
    private final Clock clock;

    public SyncHealthService(JobQueue jobQueue,
                             ChapterSyncStore store,
                             SourceCircuitBreakerService circuitBreaker,
                             WorkerPool workerPool,
                             SyncEngineProperties properties,
                             Clock clock) {
        this.jobQueue = jobQueue;
        this.store = store;
        this.circuitBreaker = circuitBreaker;
        this.workerPool = workerPool;
        this.schedulerSettings = properties.getScheduler();
        this.clock = clock;
    }

    public SyncHealthSnapshot snapshot() {
        Instant now = clock.instant();
        Map<SyncPriority, Duration> intervals = new EnumMap<>(SyncPriority.class);
        for (SyncPriority priority : SyncPriority.values()) {
            intervals.put(priority, schedulerSettings.intervalFor(priority));
        }
        Map<SyncPriority, Long> stale = new EnumMap<>(SyncPriority.class);
        for (SyncPriority priority : SyncPriority.values()) {
            stale.put(priority, 0L);
        }
        stale.putAll(store.countStaleByTier(now, intervals));

        return new SyncHealthSnapshot(
            jobQueue.stats(),
            circuitBreaker.states(),
            jobQueue.deadLetterCount(),
            stale,
            workerPool.activeCount(),
            now);
    }
}

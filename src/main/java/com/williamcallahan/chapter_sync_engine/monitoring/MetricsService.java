/**
 * Service for tracking sync pipeline metrics
 * Provides counters, gauges, and timers for monitoring
 */

package com.williamcallahan.chapter_sync_engine.monitoring;

import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter circuitBreakerTrips;
    private final Counter tombstonesApplied;
    private final Counter structuralWarnings;
    private final Counter chaptersAdded;
    private final Counter schedulerRowErrors;
    private final Counter seriesMerged;

    // Gauges
    private final AtomicInteger activeJobs = new AtomicInteger(0);

    // Timers
    private final Timer syncTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.circuitBreakerTrips = Counter.builder("sync.circuit_breaker.trips")
            .description("Number of per-source circuit breaker trips")
            .register(meterRegistry);

        this.tombstonesApplied = Counter.builder("sync.chapters.tombstoned")
            .description("Chapter availability rows tombstoned")
            .register(meterRegistry);

        this.structuralWarnings = Counter.builder("sync.structural_warnings")
            .description("Syncs where destructive changes were suppressed as a suspected upstream error")
            .register(meterRegistry);

        this.chaptersAdded = Counter.builder("sync.chapters.added")
            .description("New chapter availability rows")
            .register(meterRegistry);

        this.schedulerRowErrors = Counter.builder("sync.scheduler.row_errors")
            .description("Scheduler candidates skipped because of an error")
            .register(meterRegistry);

        this.seriesMerged = Counter.builder("sync.series.merged")
            .description("Duplicate series merged into a canonical series")
            .register(meterRegistry);

        Gauge.builder("sync.jobs.active", activeJobs, AtomicInteger::get)
            .description("Jobs currently running in this worker pool")
            .register(meterRegistry);

        this.syncTimer = Timer.builder("sync.source.duration")
            .description("Duration of one source sync")
            .register(meterRegistry);
    }

    public void recordJobOutcome(QueueName queue, AttemptOutcome outcome) {
        Counter.builder("sync.jobs.outcomes")
            .description("Finished job attempts by queue and outcome")
            .tag("queue", queue.queueId())
            .tag("outcome", outcome.name().toLowerCase())
            .register(meterRegistry)
            .increment();
    }

    public void recordJobFailure(QueueName queue, ErrorCategory category, boolean deadLettered) {
        Counter.builder("sync.jobs.failures")
            .description("Failed job attempts by queue, category and disposition")
            .tag("queue", queue.queueId())
            .tag("category", category.name().toLowerCase())
            .tag("disposition", deadLettered ? "dead_lettered" : "retried")
            .register(meterRegistry)
            .increment();
    }

    public void incrementCircuitBreakerTrip() {
        circuitBreakerTrips.increment();
    }

    public void incrementTombstones(int count) {
        tombstonesApplied.increment(count);
    }

    public void incrementStructuralWarning() {
        structuralWarnings.increment();
    }

    public void incrementChaptersAdded(int count) {
        chaptersAdded.increment(count);
    }

    public void incrementSchedulerRowError() {
        schedulerRowErrors.increment();
    }

    public void incrementSeriesMerged() {
        seriesMerged.increment();
    }

    public void incrementActiveJobs() {
        activeJobs.incrementAndGet();
    }

    public void decrementActiveJobs() {
        activeJobs.decrementAndGet();
    }

    public Timer.Sample startSyncTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopSyncTimer(Timer.Sample sample) {
        sample.stop(syncTimer);
    }
}

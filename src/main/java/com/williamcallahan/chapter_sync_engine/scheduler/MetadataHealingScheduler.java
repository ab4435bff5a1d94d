/**
 * Retries metadata enrichment that previously failed
 *
 * Features:
 * - Marks sources stuck in PENDING for too long as FAILED so they become healable
 * - Re-enqueues enrichment for FAILED and UNAVAILABLE sources below the retry ceiling
 *   whose last attempt is older than the minimum age
 */

package com.williamcallahan.chapter_sync_engine.scheduler;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.queue.JobPayloads;
import com.williamcallahan.chapter_sync_engine.queue.JobQueue;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Component
public class MetadataHealingScheduler {

    public record HealingResult(int markedFailed, int enqueued) {}

    private final ChapterSyncStore store;
    private final JobQueue jobQueue;
    private final SyncEngineProperties.Metadata settings;
    private final boolean enabled;
    private final Clock clock;

    public MetadataHealingScheduler(ChapterSyncStore store, JobQueue jobQueue, SyncEngineProperties properties, Clock clock) {
        this.store = store;
        this.jobQueue = jobQueue;
        this.settings = properties.getMetadata();
        this.enabled = properties.getScheduler().isEnabled();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.metadata.healing-interval:PT30M}", initialDelayString = "PT2M")
    public void scheduledHealing() {
        if (!enabled) {
            return;
        }
        try {
            heal();
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Metadata healing failed");
        }
    }

    public HealingResult heal() {
        Instant now = clock.instant();
        int markedFailed = store.markStuckPendingFailed(now.minus(settings.getStuckPendingAfter()));
        if (markedFailed > 0) {
            log.warn("Marked {} source(s) stuck in pending metadata as failed", markedFailed);
        }

        List<SeriesSource> healable = store.findHealableSources(settings.getMaxRetries(),
            now.minus(settings.getHealingMinAge()), settings.getHealingBatchSize());
        int enqueued = 0;
        for (SeriesSource source : healable) {
            if (jobQueue.enqueue(JobPayloads.enrichMetadata(source.id(), source.sourceName())).enqueued()) {
                enqueued++;
            }
        }
        if (enqueued > 0) {
            log.info("Re-enqueued metadata enrichment for {} of {} healable source(s)", enqueued, healable.size());
        }
        return new HealingResult(markedFailed, enqueued);
    }
}

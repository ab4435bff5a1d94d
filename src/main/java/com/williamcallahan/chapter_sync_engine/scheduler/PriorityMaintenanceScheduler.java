/**
 * Keeps refresh tiers in line with how active each source is
 *
 * Features:
 * - Demotes HOT sources without a new chapter for a day to WARM, and idle WARM sources to COLD
 * - Promotes sources of series above the follower threshold to HOT
 * - Promotion runs after demotion so a popular series stays HOT
 */

package com.williamcallahan.chapter_sync_engine.scheduler;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Component
public class PriorityMaintenanceScheduler {

    public record MaintenanceResult(int demotedToWarm, int demotedToCold, int promotedToHot) {}

    private final ChapterSyncStore store;
    private final SyncEngineProperties.Scheduler settings;
    private final Clock clock;

    public PriorityMaintenanceScheduler(ChapterSyncStore store, SyncEngineProperties properties, Clock clock) {
        this.store = store;
        this.settings = properties.getScheduler();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.scheduler.maintenance-interval:PT15M}", initialDelayString = "PT1M")
    public void scheduledMaintenance() {
        if (!settings.isEnabled()) {
            return;
        }
        try {
            runMaintenance();
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Priority maintenance failed");
        }
    }

    public MaintenanceResult runMaintenance() {
        Instant now = clock.instant();
        int toWarm = store.demoteIdleSources(SyncPriority.HOT, SyncPriority.WARM, now.minus(settings.getHotDemoteAfter()));
        int toCold = store.demoteIdleSources(SyncPriority.WARM, SyncPriority.COLD, now.minus(settings.getWarmDemoteAfter()));
        int toHot = store.promoteSourcesWithFollowers(settings.getHotFollowerThreshold());
        if (toWarm + toCold + toHot > 0) {
            log.info("Priority maintenance: {} HOT->WARM, {} WARM->COLD, {} promoted to HOT", toWarm, toCold, toHot);
        }
        return new MaintenanceResult(toWarm, toCold, toHot);
    }
}

/**
 * Actuator health indicator for the sync pipeline
 *
 * Reports UP with queue, breaker, dead-letter and staleness details while the store and queue
 * answer; DOWN when the snapshot itself cannot be taken
 */

package com.williamcallahan.chapter_sync_engine.monitoring;

import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Component("syncPipelineHealthIndicator")
public class SyncPipelineHealthIndicator implements HealthIndicator {

    private final SyncHealthService healthService;

    public SyncPipelineHealthIndicator(SyncHealthService healthService) {
        this.healthService = healthService;
    }

    @Override
    public Health health() {
        SyncHealthSnapshot snapshot;
        try {
            snapshot = healthService.snapshot();
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Sync pipeline health snapshot failed");
            return Health.down()
                .withDetail("sync_status", "unavailable")
                .withDetail("error", e.getClass().getSimpleName())
                .build();
        }

        Map<String, Long> depth = new LinkedHashMap<>();
        for (QueueName queue : QueueName.values()) {
            depth.put(queue.queueId(), snapshot.queueDepth(queue));
        }
        Map<String, Long> stale = new LinkedHashMap<>();
        for (SyncPriority priority : SyncPriority.values()) {
            stale.put(priority.name().toLowerCase(Locale.ROOT), snapshot.staleByTier().getOrDefault(priority, 0L));
        }
        Map<String, String> breakers = new LinkedHashMap<>();
        snapshot.circuitBreakers().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> breakers.put(entry.getKey(), entry.getValue().name()));

        return Health.up()
            .withDetail("queue_depth", depth)
            .withDetail("circuit_breakers", breakers)
            .withDetail("open_circuits", snapshot.openCircuits())
            .withDetail("dead_letters", snapshot.deadLetterCount())
            .withDetail("stale_sources", stale)
            .withDetail("active_jobs", snapshot.activeJobs())
            .withDetail("taken_at", snapshot.takenAt().toString())
            .build();
    }
}

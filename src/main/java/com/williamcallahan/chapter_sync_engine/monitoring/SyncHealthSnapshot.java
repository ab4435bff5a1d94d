package com.williamcallahan.chapter_sync_engine.monitoring;

import com.williamcallahan.chapter_sync_engine.queue.JobQueue;
import com.williamcallahan.chapter_sync_engine.types.CircuitState;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Point-in-time view of the pipeline for the operational dashboard.
 *
 * @param staleByTier sources per tier whose last success is older than the tier interval
 */
public record SyncHealthSnapshot(
    Map<QueueName, JobQueue.QueueStats> queues,
    Map<String, CircuitState> circuitBreakers,
    long deadLetterCount,
    Map<SyncPriority, Long> staleByTier,
    int activeJobs,
    Instant takenAt
) {

    public SyncHealthSnapshot {
        queues = Map.copyOf(queues);
        circuitBreakers = Map.copyOf(circuitBreakers);
        staleByTier = Map.copyOf(staleByTier);
    }

    public long queueDepth(QueueName queue) {
        JobQueue.QueueStats stats = queues.get(queue);
        return stats == null ? 0 : stats.waiting();
    }

    public Set<String> openCircuits() {
        Set<String> open = new TreeSet<>();
        circuitBreakers.forEach((source, state) -> {
            if (state != CircuitState.CLOSED) {
                open.add(source);
            }
        });
        return open;
    }
}

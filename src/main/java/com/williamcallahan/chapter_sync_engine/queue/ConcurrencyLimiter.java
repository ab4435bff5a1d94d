package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.types.QueueName;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Running-job counters for the global, per-queue and per-source caps of one worker pool.
 * A job that would exceed any cap is left waiting in the queue.
 */
public class ConcurrencyLimiter {

    private final int globalLimit;
    private final Map<QueueName, Integer> queueLimits = new EnumMap<>(QueueName.class);
    private final int perSourceLimit;

    private int running;
    private final Map<QueueName, Integer> runningByQueue = new EnumMap<>(QueueName.class);
    private final Map<String, Integer> runningBySource = new HashMap<>();

    public ConcurrencyLimiter(SyncEngineProperties.Queue settings) {
        this.globalLimit = settings.getGlobalConcurrency();
        this.perSourceLimit = settings.getPerSourceConcurrency();
        for (QueueName queue : QueueName.values()) {
            queueLimits.put(queue, settings.concurrencyFor(queue));
        }
    }

    /**
     * Whether a job of this queue could start, ignoring the per-source cap.
     */
    public synchronized boolean hasCapacity(QueueName queue) {
        return running < globalLimit && runningByQueue.getOrDefault(queue, 0) < queueLimits.get(queue);
    }

    /**
     * Sources at their cap; their jobs are excluded from the next claim.
     */
    public synchronized Set<String> saturatedSources() {
        return runningBySource.entrySet().stream()
            .filter(entry -> entry.getValue() >= perSourceLimit)
            .map(Map.Entry::getKey)
            .collect(Collectors.toSet());
    }

    public synchronized boolean tryAcquire(QueueName queue, String sourceName) {
        if (!hasCapacity(queue)) {
            return false;
        }
        if (sourceName != null && runningBySource.getOrDefault(sourceName, 0) >= perSourceLimit) {
            return false;
        }
        running++;
        runningByQueue.merge(queue, 1, Integer::sum);
        if (sourceName != null) {
            runningBySource.merge(sourceName, 1, Integer::sum);
        }
        return true;
    }

    public synchronized void release(QueueName queue, String sourceName) {
        running = Math.max(0, running - 1);
        runningByQueue.computeIfPresent(queue, (key, count) -> count <= 1 ? null : count - 1);
        if (sourceName != null) {
            runningBySource.computeIfPresent(sourceName, (key, count) -> count <= 1 ? null : count - 1);
        }
    }

    public synchronized int running() {
        return running;
    }

    public synchronized int running(QueueName queue) {
        return runningByQueue.getOrDefault(queue, 0);
    }

    public synchronized int running(String sourceName) {
        return runningBySource.getOrDefault(sourceName, 0);
    }
}

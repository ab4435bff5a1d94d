/**
 * Main application configuration properties
 * Centralizes all app.* configuration for scheduling, ingestion, canonicalization and the job queue
 *
 * Features:
 * - Tier refresh intervals, batch cap and scheduler error ceiling
 * - Ingestion chunk size, tombstone threshold and trust score deltas
 * - Per job type retry/backoff/timeout settings with built-in defaults
 * - Global, per-queue and per-source concurrency caps
 */

package com.williamcallahan.chapter_sync_engine.config;

import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "app")
public class SyncEngineProperties {

    @NestedConfigurationProperty
    private Scheduler scheduler = new Scheduler();

    @NestedConfigurationProperty
    private Ingestion ingestion = new Ingestion();

    @NestedConfigurationProperty
    private Canonicalization canonicalization = new Canonicalization();

    @NestedConfigurationProperty
    private Metadata metadata = new Metadata();

    @NestedConfigurationProperty
    private Queue queue = new Queue();

    @NestedConfigurationProperty
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @NestedConfigurationProperty
    private RateLimit rateLimit = new RateLimit();

    @NestedConfigurationProperty
    private Shutdown shutdown = new Shutdown();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private Duration cycleInterval = Duration.ofMinutes(1);
        private Duration maintenanceInterval = Duration.ofMinutes(15);
        private int batchCap = 500;
        // Rows fetched per run, as a multiple of the batch cap, to leave room for locked or malformed rows
        private int overscanFactor = 4;
        // 0 never halts a run early
        private int haltAfterErrors = 0;
        private Duration hotInterval = Duration.ofMinutes(30);
        private Duration warmInterval = Duration.ofHours(6);
        private Duration coldInterval = Duration.ofHours(48);
        private Duration fullSyncInterval = Duration.ofHours(24);
        private int hotFollowerThreshold = 100;
        private Duration hotDemoteAfter = Duration.ofDays(1);
        private Duration warmDemoteAfter = Duration.ofDays(7);

        public Duration intervalFor(SyncPriority priority) {
            return switch (priority) {
                case HOT -> hotInterval;
                case WARM -> warmInterval;
                case COLD -> coldInterval;
            };
        }

        public Duration shortestInterval() {
            Duration shortest = hotInterval;
            if (warmInterval.compareTo(shortest) < 0) {
                shortest = warmInterval;
            }
            if (coldInterval.compareTo(shortest) < 0) {
                shortest = coldInterval;
            }
            return shortest;
        }
    }

    @Data
    public static class Ingestion {
        private int maxChaptersPerSync = 500;
        private double tombstoneThreshold = 0.5;
        private int outOfOrderTolerance = 10;
        private double trustSuccessDelta = 0.02;
        private double trustFailureDelta = 0.05;
        private double trustMin = 0.5;
        private double trustMax = 1.0;
        private int brokenAfterFailures = 5;
        private Duration lockTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Canonicalization {
        private double linkThreshold = 0.85;
        private double reviewThreshold = 0.5;
        private double languagePenalty = 0.2;
        private int candidateLimit = 50;
        private Duration lockTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Metadata {
        private int maxRetries = 3;
        private Duration healingInterval = Duration.ofMinutes(30);
        private Duration healingMinAge = Duration.ofHours(6);
        private Duration stuckPendingAfter = Duration.ofHours(24);
        private int healingBatchSize = 100;
    }

    @Data
    public static class Queue {
        private boolean workersEnabled = true;
        private String workerId;
        private int globalConcurrency = 16;
        private Map<String, Integer> perQueueConcurrency = new HashMap<>(Map.of(
            QueueName.SYNC_SOURCE.queueId(), 8,
            QueueName.CANONICALIZE.queueId(), 4,
            QueueName.ENRICH_METADATA.queueId(), 4
        ));
        private int perSourceConcurrency = 2;
        private Duration leaseDuration = Duration.ofSeconds(60);
        private Duration pollInterval = Duration.ofSeconds(1);
        // Well inside the lease so one missed beat does not lose the job
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private Duration reclaimInterval = Duration.ofSeconds(30);
        private Duration maxJobAge = Duration.ofHours(24);
        // Finished jobs and their attempt history are deleted after this long
        private Duration finishedRetention = Duration.ofHours(24);
        private Duration purgeInterval = Duration.ofMinutes(10);
        private double jitterFactor = 0.2;
        private Map<String, JobType> jobs = new HashMap<>();

        public int concurrencyFor(QueueName queue) {
            return perQueueConcurrency.getOrDefault(queue.queueId(), globalConcurrency);
        }

        /**
         * Settings for a queue's job type, falling back to built-in defaults.
         */
        public JobType jobType(QueueName queue) {
            JobType configured = jobs.get(queue.queueId());
            return configured != null ? configured : JobType.defaultsFor(queue);
        }
    }

    @Data
    public static class JobType {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofMinutes(5);
        private Duration timeout = Duration.ofSeconds(60);

        public static JobType defaultsFor(QueueName queue) {
            JobType type = new JobType();
            switch (queue) {
                case SYNC_SOURCE -> {
                    type.setMaxAttempts(5);
                    type.setBaseDelay(Duration.ofSeconds(30));
                    type.setMaxDelay(Duration.ofMinutes(10));
                    type.setTimeout(Duration.ofMinutes(2));
                }
                case CANONICALIZE -> {
                    type.setMaxAttempts(3);
                    type.setBaseDelay(Duration.ofSeconds(5));
                    type.setMaxDelay(Duration.ofMinutes(1));
                    type.setTimeout(Duration.ofMinutes(1));
                }
                case ENRICH_METADATA -> {
                    type.setMaxAttempts(3);
                    type.setBaseDelay(Duration.ofSeconds(10));
                    type.setMaxDelay(Duration.ofMinutes(5));
                    type.setTimeout(Duration.ofMinutes(1));
                }
            }
            return type;
        }
    }

    @Data
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration openDuration = Duration.ofSeconds(60);
    }

    @Data
    public static class RateLimit {
        private int limitForPeriod = 10;
        private Duration refreshPeriod = Duration.ofSeconds(1);
        private Duration timeout = Duration.ofSeconds(60);
        private Map<String, Integer> perSourceLimitForPeriod = new HashMap<>();
    }

    @Data
    public static class Shutdown {
        private Duration timeout = Duration.ofSeconds(30);
    }
}

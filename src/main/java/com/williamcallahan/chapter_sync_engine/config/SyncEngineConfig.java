/**
 * Process-scoped collaborators shared by the queue, workers and services
 *
 * Features:
 * - Binds the app.* properties tree
 * - One Clock, one worker identity and one set of concurrency counters per process
 */

package com.williamcallahan.chapter_sync_engine.config;

import com.williamcallahan.chapter_sync_engine.queue.ConcurrencyLimiter;
import com.williamcallahan.chapter_sync_engine.queue.JobBackoffPolicy;
import com.williamcallahan.chapter_sync_engine.queue.WorkerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SyncEngineProperties.class)
public class SyncEngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(SyncEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkerIdentity workerIdentity(SyncEngineProperties properties) {
        WorkerIdentity identity = WorkerIdentity.resolve(properties.getQueue().getWorkerId());
        logger.info("Worker identity: {}", identity.workerId());
        return identity;
    }

    @Bean
    public JobBackoffPolicy jobBackoffPolicy(SyncEngineProperties properties) {
        return new JobBackoffPolicy(properties.getQueue().getJitterFactor());
    }

    @Bean
    public ConcurrencyLimiter concurrencyLimiter(SyncEngineProperties properties) {
        return new ConcurrencyLimiter(properties.getQueue());
    }
}

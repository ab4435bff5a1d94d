/**
 * Thread pool for job execution
 *
 * Features:
 * - syncWorkerExecutor runs claimed jobs; sized to the global concurrency cap so the
 *   worker pool, not the executor queue, decides what waits
 * - Rejections surface to the worker pool, which hands the job's lease back
 * - Custom thread naming for easier debugging
 */

package com.williamcallahan.chapter_sync_engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    private final SyncEngineProperties properties;

    public AsyncConfig(SyncEngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Executor for claimed jobs
     *
     * @return AsyncTaskExecutor bounded by the global concurrency cap
     */
    @Bean("syncWorkerExecutor")
    public AsyncTaskExecutor syncWorkerExecutor() {
        int concurrency = Math.max(1, properties.getQueue().getGlobalConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(concurrency);
        executor.setThreadNamePrefix("sync-worker-");
        // The worker pool drains jobs itself before the context closes
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }
}

/**
 * Drains the worker pool when the application context closes
 *
 * Features:
 * - Stops claiming new jobs as soon as shutdown begins
 * - Waits up to app.shutdown.timeout for running jobs to finish
 * - Cancels stragglers and hands their leases back; their uncommitted writes roll back
 */

package com.williamcallahan.chapter_sync_engine.config;

import com.williamcallahan.chapter_sync_engine.queue.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GracefulShutdownConfig implements ApplicationListener<ContextClosedEvent> {

    private static final Logger logger = LoggerFactory.getLogger(GracefulShutdownConfig.class);

    private final WorkerPool workerPool;
    private final ApplicationContext applicationContext;
    private final Duration timeout;

    public GracefulShutdownConfig(WorkerPool workerPool, ApplicationContext applicationContext,
                                  SyncEngineProperties properties) {
        this.workerPool = workerPool;
        this.applicationContext = applicationContext;
        this.timeout = properties.getShutdown().getTimeout();
    }

    @Override
    public void onApplicationEvent(@NonNull ContextClosedEvent event) {
        // Only process if this is our application context
        if (event.getApplicationContext() != applicationContext) {
            return;
        }
        logger.info("Application shutdown initiated, draining worker {}", workerPool.workerId());
        boolean drained = workerPool.shutdown(timeout);
        if (!drained) {
            logger.warn("Worker pool did not drain within {}; remaining jobs were cancelled and released", timeout);
        }
    }
}

package com.williamcallahan.chapter_sync_engine.config;

import com.williamcallahan.chapter_sync_engine.concurrency.InMemoryResourceLockProvider;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceLockProvider;
import com.williamcallahan.chapter_sync_engine.queue.InMemoryJobQueue;
import com.williamcallahan.chapter_sync_engine.queue.JobBackoffPolicy;
import com.williamcallahan.chapter_sync_engine.queue.JobQueue;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.repository.InMemoryChapterSyncStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuration used in absence of a database URL
 *
 * Features:
 * - Activates only when no database URL is configured in properties
 * - Disables Spring's datasource auto-configuration so nothing tries to connect at startup
 * - Wires the in-memory store, job queue and lock table; state lives only as long as the process
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
@EnableAutoConfiguration(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class
})
public class NoDatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(NoDatabaseConfig.class);

    @Bean
    public ChapterSyncStore chapterSyncStore() {
        logger.warn("No datasource configured; using the in-memory store, queue and locks");
        return new InMemoryChapterSyncStore();
    }

    @Bean
    public JobQueue jobQueue(SyncEngineProperties properties, JobBackoffPolicy backoffPolicy, Clock clock) {
        return new InMemoryJobQueue(properties, backoffPolicy, clock);
    }

    @Bean
    public ResourceLockProvider resourceLockProvider() {
        return new InMemoryResourceLockProvider();
    }
}

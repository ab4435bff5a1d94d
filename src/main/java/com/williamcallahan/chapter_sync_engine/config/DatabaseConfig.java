/**
 * Storage wiring when a datasource URL is configured
 *
 * Features:
 * - JDBC store with retried transactions
 * - Durable JDBC job queue with fenced leases
 * - Postgres advisory locks for per-resource mutual exclusion
 */

package com.williamcallahan.chapter_sync_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.chapter_sync_engine.concurrency.PostgresAdvisoryLockProvider;
import com.williamcallahan.chapter_sync_engine.concurrency.ResourceLockProvider;
import com.williamcallahan.chapter_sync_engine.queue.JdbcJobQueue;
import com.williamcallahan.chapter_sync_engine.queue.JobBackoffPolicy;
import com.williamcallahan.chapter_sync_engine.queue.JobQueue;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.repository.JdbcChapterSyncStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;

@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class DatabaseConfig {

    @Bean
    public ChapterSyncStore chapterSyncStore(JdbcTemplate jdbcTemplate,
                                             PlatformTransactionManager transactionManager,
                                             @Qualifier("storeRetryTemplate") RetryTemplate storeRetryTemplate) {
        return new JdbcChapterSyncStore(jdbcTemplate, transactionManager, storeRetryTemplate);
    }

    @Bean
    public JobQueue jobQueue(JdbcTemplate jdbcTemplate,
                             PlatformTransactionManager transactionManager,
                             ObjectMapper objectMapper,
                             SyncEngineProperties properties,
                             JobBackoffPolicy backoffPolicy,
                             Clock clock) {
        return new JdbcJobQueue(jdbcTemplate, transactionManager, objectMapper, properties, backoffPolicy, clock);
    }

    @Bean
    public ResourceLockProvider resourceLockProvider(DataSource dataSource, JdbcTemplate jdbcTemplate) {
        return new PostgresAdvisoryLockProvider(dataSource, jdbcTemplate);
    }
}

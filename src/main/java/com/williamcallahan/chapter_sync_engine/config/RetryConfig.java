/**
 * Configuration for retrying store transactions
 *
 * Features:
 * - Retries a whole transaction on serialization conflicts, deadlocks, lock and query timeouts
 * - Exponential backoff with jitter to keep competing workers from colliding again
 * - Non-transient failures (constraint violations, bad SQL) are never retried here
 */

package com.williamcallahan.chapter_sync_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

@Configuration
@EnableRetry
public class RetryConfig {

    @Value("${app.retry.store.max-attempts:3}")
    private int storeMaxAttempts;

    @Value("${app.retry.store.initial-backoff-ms:50}")
    private long storeInitialBackoff;

    @Value("${app.retry.store.backoff-multiplier:2.0}")
    private double storeBackoffMultiplier;

    @Value("${app.retry.store.max-backoff-ms:2000}")
    private long storeMaxBackoff;

    @Value("${app.retry.store.jitter-factor:0.2}")
    private double storeJitterFactor;

    /**
     * Exponential backoff with symmetric jitter
     */
    static class ExponentialBackOffWithJitterPolicy implements BackOffPolicy {
        private static final Logger logger = LoggerFactory.getLogger(ExponentialBackOffWithJitterPolicy.class);
        private final long initialInterval;
        private final double multiplier;
        private final long maxInterval;
        private final double jitterFactor;

        ExponentialBackOffWithJitterPolicy(long initialInterval, double multiplier, long maxInterval, double jitterFactor) {
            this.initialInterval = initialInterval;
            this.multiplier = multiplier;
            this.maxInterval = maxInterval;
            this.jitterFactor = jitterFactor;
        }

        private static class BackOffContextImpl implements BackOffContext {
            long currentInterval;
        }

        @Override
        public BackOffContext start(RetryContext context) {
            BackOffContextImpl ctx = new BackOffContextImpl();
            ctx.currentInterval = initialInterval;
            return ctx;
        }

        @Override
        public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
            BackOffContextImpl ctx = (BackOffContextImpl) backOffContext;
            long sleepTime = nextSleep(ctx.currentInterval);
            if (logger.isDebugEnabled()) {
                logger.debug("Retrying store transaction in {}ms", sleepTime);
            }
            try {
                Thread.sleep(sleepTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackOffInterruptedException("Interrupted while backing off a store transaction", e);
            }
            ctx.currentInterval = Math.min((long) (ctx.currentInterval * multiplier), maxInterval);
        }

        long nextSleep(long interval) {
            long jitter = (long) (interval * jitterFactor * (2 * ThreadLocalRandom.current().nextDouble() - 1));
            return Math.max(1, Math.min(maxInterval, interval + jitter));
        }
    }

    /**
     * Retry template wrapped around every outermost store transaction
     *
     * @return RetryTemplate for transient data-access failures
     */
    @Bean("storeRetryTemplate")
    public RetryTemplate storeRetryTemplate() {
        Map<Class<? extends Throwable>, Boolean> retryable = new HashMap<>();
        retryable.put(TransientDataAccessException.class, true);
        retryable.put(RecoverableDataAccessException.class, true);
        retryable.put(CannotCreateTransactionException.class, true);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new SimpleRetryPolicy(storeMaxAttempts, retryable, true));
        retryTemplate.setBackOffPolicy(new ExponentialBackOffWithJitterPolicy(
            storeInitialBackoff, storeBackoffMultiplier, storeMaxBackoff, storeJitterFactor));
        return retryTemplate;
    }
}

package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry delay for failed jobs: {@code min(maxDelay, baseDelay * 2^(attempt - 1) + jitter)}.
 * Jitter is a random share (up to the jitter factor) of the exponential delay.
 */
public class JobBackoffPolicy {

    // 2^30 already dwarfs any sane max delay
    private static final int MAX_EXPONENT = 30;

    private final double jitterFactor;
    private final DoubleSupplier random;

    public JobBackoffPolicy(double jitterFactor) {
        this(jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    public JobBackoffPolicy(double jitterFactor, DoubleSupplier random) {
        if (jitterFactor < 0) {
            throw new IllegalArgumentException("Jitter factor must not be negative");
        }
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * @param attempt attempts made so far, at least 1
     * @param retryAfter upstream-requested minimum delay, or null
     */
    public Duration delayFor(SyncEngineProperties.JobType jobType, int attempt, Duration retryAfter) {
        long baseMillis = jobType.getBaseDelay().toMillis();
        long maxMillis = jobType.getMaxDelay().toMillis();
        int exponent = Math.min(Math.max(attempt - 1, 0), MAX_EXPONENT);
        double exponential = baseMillis * Math.pow(2, exponent);
        double jitter = exponential * jitterFactor * random.getAsDouble();
        long delay = (long) Math.min(maxMillis, exponential + jitter);
        if (retryAfter != null && retryAfter.toMillis() > delay) {
            delay = retryAfter.toMillis();
        }
        return Duration.ofMillis(delay);
    }
}

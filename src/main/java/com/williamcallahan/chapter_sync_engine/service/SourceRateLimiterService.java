package com.williamcallahan.chapter_sync_engine.service;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * One Resilience4j rate limiter per upstream source, created lazily from the {@code app.rate-limit}
 * settings. Limiters live in the shared registry so they show up in the actuator endpoints.
 */
@Slf4j
@Service
public class SourceRateLimiterService {

    private static final String NAME_PREFIX = "source-";

    private final RateLimiterRegistry registry;
    private final SyncEngineProperties.RateLimit settings;

    public SourceRateLimiterService(RateLimiterRegistry registry, SyncEngineProperties properties) {
        this.registry = registry;
        this.settings = properties.getRateLimit();
    }

    /**
     * Waits up to the configured timeout for a permit.
     *
     * @return false when no permit became available in time
     */
    public boolean acquirePermission(String sourceName) {
        boolean permitted = limiterFor(sourceName).acquirePermission();
        if (!permitted) {
            log.debug("No rate-limit permit for '{}' within {}", sourceName, settings.getTimeout());
        }
        return permitted;
    }

    RateLimiter limiterFor(String sourceName) {
        String key = sourceName.trim().toLowerCase(Locale.ROOT);
        int limit = settings.getPerSourceLimitForPeriod().getOrDefault(key, settings.getLimitForPeriod());
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitForPeriod(limit)
            .limitRefreshPeriod(settings.getRefreshPeriod())
            .timeoutDuration(settings.getTimeout())
            .build();
        return registry.rateLimiter(NAME_PREFIX + key, config);
    }
}

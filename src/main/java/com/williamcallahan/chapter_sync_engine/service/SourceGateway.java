/**
 * Single entry point for upstream calls
 *
 * Features:
 * - Looks up the registered SourceClient for a source name
 * - Refuses the call while the source's circuit is open
 * - Waits for a per-source rate-limit permit before calling
 * - Reports the outcome back to the circuit breaker
 */

package com.williamcallahan.chapter_sync_engine.service;

import com.williamcallahan.chapter_sync_engine.client.SourceClient;
import com.williamcallahan.chapter_sync_engine.client.SourceClientRegistry;
import com.williamcallahan.chapter_sync_engine.exception.SourceClientException;
import com.williamcallahan.chapter_sync_engine.exception.SourceUnavailableException;
import com.williamcallahan.chapter_sync_engine.model.ChapterList;
import com.williamcallahan.chapter_sync_engine.model.SeriesCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SourceGateway {

    @FunctionalInterface
    private interface SourceCall<T> {
        T call(SourceClient client) throws SourceClientException;
    }

    private final SourceClientRegistry clientRegistry;
    private final SourceCircuitBreakerService circuitBreaker;
    private final SourceRateLimiterService rateLimiter;
    private final ErrorClassifier errorClassifier;

    public SourceGateway(SourceClientRegistry clientRegistry,
                         SourceCircuitBreakerService circuitBreaker,
                         SourceRateLimiterService rateLimiter,
                         ErrorClassifier errorClassifier) {
        this.clientRegistry = clientRegistry;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.errorClassifier = errorClassifier;
    }

    public ChapterList fetchChapters(String sourceName, String sourceId) throws SourceClientException {
        return execute(sourceName, client -> client.fetchChapters(sourceId));
    }

    public SeriesCandidate fetchSeries(String sourceName, String sourceId) throws SourceClientException {
        return execute(sourceName, client -> client.fetchSeries(sourceId));
    }

    private <T> T execute(String sourceName, SourceCall<T> call) throws SourceClientException {
        SourceClient client = clientRegistry.find(sourceName)
            .orElseThrow(() -> new IllegalStateException("No source client registered for '" + sourceName + "'"));

        if (!circuitBreaker.tryAcquirePermission(sourceName)) {
            throw new SourceUnavailableException("Circuit open for " + sourceName);
        }
        if (!rateLimiter.acquirePermission(sourceName)) {
            circuitBreaker.releasePermission(sourceName);
            throw new SourceUnavailableException("Rate limit permit unavailable for " + sourceName);
        }

        try {
            T result = call.call(client);
            circuitBreaker.recordSuccess(sourceName);
            return result;
        } catch (SourceClientException | RuntimeException e) {
            if (errorClassifier.classify(e).countsAgainstSource()) {
                circuitBreaker.recordFailure(sourceName);
            } else {
                circuitBreaker.releasePermission(sourceName);
            }
            log.debug("Call to '{}' failed: {}", sourceName, e.getClass().getSimpleName());
            throw e;
        }
    }
}

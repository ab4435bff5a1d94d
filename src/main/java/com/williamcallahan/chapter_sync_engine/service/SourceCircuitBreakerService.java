/**
 * Per-source circuit breaker guarding upstream calls
 * Tracks consecutive failures per source and stops calling a source that keeps failing
 *
 * Features:
 * - CLOSED until the failure threshold is reached, then OPEN for the cooldown window
 * - After the cooldown a single trial call is let through (HALF_OPEN)
 * - A successful trial closes the circuit, a failed one reopens it for another window
 * - blockedSources() feeds the worker pool so jobs for a blocked source stay waiting
 */

package com.williamcallahan.chapter_sync_engine.service;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.monitoring.MetricsService;
import com.williamcallahan.chapter_sync_engine.types.CircuitState;
import com.williamcallahan.chapter_sync_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

@Slf4j
@Service
public class SourceCircuitBreakerService {

    private final ConcurrentMap<String, SourceCircuit> circuits = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration openDuration;
    private final MetricsService metricsService;
    private final Clock clock;

    public SourceCircuitBreakerService(SyncEngineProperties properties, MetricsService metricsService, Clock clock) {
        this.failureThreshold = properties.getCircuitBreaker().getFailureThreshold();
        this.openDuration = properties.getCircuitBreaker().getOpenDuration();
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Check whether a call to the source may proceed. Moves an expired OPEN circuit to HALF_OPEN and
     * hands out its single trial permit.
     *
     * @return true if the call may go ahead
     */
    public boolean tryAcquirePermission(String sourceName) {
        return circuit(sourceName).tryAcquire(clock.instant());
    }

    public void recordSuccess(String sourceName) {
        circuit(sourceName).recordSuccess();
    }

    public void recordFailure(String sourceName) {
        circuit(sourceName).recordFailure(clock.instant());
    }

    /**
     * Give back a trial permit without an outcome, e.g. when the call was never made.
     */
    public void releasePermission(String sourceName) {
        circuit(sourceName).releaseTrial();
    }

    public CircuitState state(String sourceName) {
        return circuit(sourceName).state(clock.instant());
    }

    /**
     * Sources that would reject a call right now.
     */
    public Set<String> blockedSources() {
        Instant now = clock.instant();
        return circuits.entrySet().stream()
            .filter(entry -> entry.getValue().isBlocking(now))
            .map(Map.Entry::getKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    public Map<String, CircuitState> states() {
        Instant now = clock.instant();
        Map<String, CircuitState> states = new TreeMap<>();
        circuits.forEach((source, circuit) -> states.put(source, circuit.state(now)));
        return states;
    }

    /**
     * Manually reset a source's circuit (for admin/testing purposes)
     */
    public void reset(String sourceName) {
        circuits.remove(key(sourceName));
        log.info("Circuit breaker for '{}' manually reset to CLOSED state", sourceName);
    }

    private SourceCircuit circuit(String sourceName) {
        String key = key(sourceName);
        return circuits.computeIfAbsent(key, SourceCircuit::new);
    }

    private static String key(String sourceName) {
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("Source name is required for the circuit breaker");
        }
        return sourceName.trim().toLowerCase(Locale.ROOT);
    }

    private final class SourceCircuit {
        private final String sourceName;
        private CircuitState state = CircuitState.CLOSED;
        private int consecutiveFailures;
        private Instant openedAt;
        private boolean trialInFlight;

        private SourceCircuit(String sourceName) {
            this.sourceName = sourceName;
        }

        synchronized boolean tryAcquire(Instant now) {
            return switch (state) {
                case CLOSED -> true;
                case OPEN -> {
                    if (cooldownElapsed(now)) {
                        state = CircuitState.HALF_OPEN;
                        trialInFlight = true;
                        log.info("Circuit breaker for '{}' HALF_OPEN, allowing one trial call", sourceName);
                        yield true;
                    }
                    yield false;
                }
                case HALF_OPEN -> {
                    if (trialInFlight) {
                        yield false;
                    }
                    trialInFlight = true;
                    yield true;
                }
            };
        }

        synchronized void recordSuccess() {
            if (state != CircuitState.CLOSED) {
                log.info("Circuit breaker for '{}' CLOSED after successful trial call", sourceName);
            }
            state = CircuitState.CLOSED;
            consecutiveFailures = 0;
            openedAt = null;
            trialInFlight = false;
        }

        synchronized void recordFailure(Instant now) {
            consecutiveFailures++;
            switch (state) {
                case CLOSED -> {
                    if (consecutiveFailures >= failureThreshold) {
                        open(now);
                    }
                }
                case HALF_OPEN -> open(now);
                case OPEN -> log.debug("Failure recorded for '{}' while circuit already OPEN", sourceName);
            }
        }

        synchronized void releaseTrial() {
            trialInFlight = false;
        }

        synchronized CircuitState state(Instant now) {
            if (state == CircuitState.OPEN && cooldownElapsed(now)) {
                return CircuitState.HALF_OPEN;
            }
            return state;
        }

        synchronized boolean isBlocking(Instant now) {
            return switch (state) {
                case CLOSED -> false;
                case OPEN -> !cooldownElapsed(now);
                case HALF_OPEN -> trialInFlight;
            };
        }

        private boolean cooldownElapsed(Instant now) {
            return openedAt == null || !now.isBefore(openedAt.plus(openDuration));
        }

        private void open(Instant now) {
            state = CircuitState.OPEN;
            openedAt = now;
            trialInFlight = false;
            metricsService.incrementCircuitBreakerTrip();
            LoggingUtils.error(log, null,
                "Circuit breaker OPENED for '{}' after {} consecutive failures - blocking calls for {}",
                sourceName, consecutiveFailures, openDuration);
        }
    }
}

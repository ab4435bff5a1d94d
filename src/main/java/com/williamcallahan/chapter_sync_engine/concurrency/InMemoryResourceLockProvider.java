package com.williamcallahan.chapter_sync_engine.concurrency;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local lock table used when no database is configured and in tests.
 */
@Slf4j
public class InMemoryResourceLockProvider implements ResourceLockProvider {

    private static final long POLL_INTERVAL_MS = 10;

    private final ConcurrentMap<Long, Long> owners = new ConcurrentHashMap<>();
    private final AtomicLong handleSequence = new AtomicLong();

    @Override
    public Optional<LockHandle> tryAcquire(ResourceKey key, Duration timeout) {
        long handleId = handleSequence.incrementAndGet();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (owners.putIfAbsent(key.value(), handleId) == null) {
                log.debug("Acquired in-memory lock {} ({})", key.describe(), key.value());
                return Optional.of(new Handle(key, handleId));
            }
            if (System.nanoTime() >= deadline) {
                return Optional.empty();
            }
            try {
                TimeUnit.MILLISECONDS.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    @Override
    public boolean isHeld(ResourceKey key) {
        return owners.containsKey(key.value());
    }

    private final class Handle implements LockHandle {
        private final ResourceKey key;
        private final long handleId;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Handle(ResourceKey key, long handleId) {
            this.key = key;
            this.handleId = handleId;
        }

        @Override
        public ResourceKey key() {
            return key;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                owners.remove(key.value(), handleId);
            }
        }
    }
}

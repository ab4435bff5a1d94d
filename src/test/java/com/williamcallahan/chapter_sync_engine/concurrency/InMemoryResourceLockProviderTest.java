package com.williamcallahan.chapter_sync_engine.concurrency;

import com.williamcallahan.chapter_sync_engine.types.ResourceKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryResourceLockProviderTest {

    private final InMemoryResourceLockProvider provider = new InMemoryResourceLockProvider();
    private final ResourceKey key = ResourceLocks.resourceLock(ResourceKind.SERIES_SOURCE, "source-1");

    @Test
    void tryAcquire_secondCallerTimesOutWhileHeld() {
        Optional<LockHandle> first = provider.tryAcquire(key, Duration.ZERO);
        Optional<LockHandle> second = provider.tryAcquire(key, Duration.ofMillis(30));

        assertTrue(first.isPresent());
        assertFalse(second.isPresent());
        assertTrue(provider.isHeld(key));
    }

    @Test
    void close_releasesAndIsIdempotent() {
        LockHandle handle = provider.tryAcquire(key, Duration.ZERO).orElseThrow();
        handle.close();
        LockHandle next = provider.tryAcquire(key, Duration.ZERO).orElseThrow();

        // A second close of the stale handle must not release the new owner's lock
        handle.close();

        assertTrue(provider.isHeld(key));
        next.close();
        assertFalse(provider.isHeld(key));
    }

    @Test
    void tryAcquire_waitsForRelease() throws Exception {
        LockHandle handle = provider.tryAcquire(key, Duration.ZERO).orElseThrow();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            var waiter = executor.submit(() -> provider.tryAcquire(key, Duration.ofSeconds(2)));
            TimeUnit.MILLISECONDS.sleep(50);
            handle.close();

            Optional<LockHandle> acquired = waiter.get(3, TimeUnit.SECONDS);
            assertTrue(acquired.isPresent());
            acquired.get().close();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void tryAcquire_admitsOneOfManyContenders() throws Exception {
        int contenders = 8;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(contenders);
        AtomicInteger winners = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        try {
            for (int i = 0; i < contenders; i++) {
                executor.execute(() -> {
                    try {
                        start.await();
                        provider.tryAcquire(key, Duration.ZERO).ifPresent(handle -> winners.incrementAndGet());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(1, winners.get());
        } finally {
            executor.shutdownNow();
        }
    }
}

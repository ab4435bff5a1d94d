package com.williamcallahan.chapter_sync_engine.concurrency;

import java.time.Duration;
import java.util.Optional;

/**
 * Acquires advisory locks keyed by {@link ResourceKey}. Acquisition never blocks longer than the
 * given timeout; an empty result means another worker already owns the resource.
 */
public interface ResourceLockProvider {

    Optional<LockHandle> tryAcquire(ResourceKey key, Duration timeout);

    /**
     * Whether any worker currently holds the lock. Advisory only; the answer may be stale by the time it is used.
     */
    boolean isHeld(ResourceKey key);
}

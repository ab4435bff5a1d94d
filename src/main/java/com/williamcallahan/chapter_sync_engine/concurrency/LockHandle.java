package com.williamcallahan.chapter_sync_engine.concurrency;

/**
 * A held resource lock. Closing releases it; closing twice is harmless.
 */
public interface LockHandle extends AutoCloseable {

    ResourceKey key();

    @Override
    void close();
}

package com.williamcallahan.chapter_sync_engine.queue;

/**
 * Returned by enqueue.
 *
 * @param jobId    id of the new job, or of the outstanding job already holding the key
 * @param enqueued false when the key was already outstanding and nothing was added
 */
public record JobHandle(String jobId, String idempotencyKey, boolean enqueued) {}

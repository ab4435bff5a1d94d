/**
 * Single home of the advisory lock key scheme
 *
 * Features:
 * - Key is the first 8 bytes of SHA-256 over "KIND:id1:id2..." with the sign bit cleared
 * - Deterministic across processes and restarts, so every worker derives the same key
 * - Kinds namespace the ids, so a series id and a source id never collide by accident
 */

package com.williamcallahan.chapter_sync_engine.concurrency;

import com.williamcallahan.chapter_sync_engine.types.ResourceKind;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class ResourceLocks {

    private ResourceLocks() {
    }

    /**
     * Derives the lock key for a resource.
     *
     * @param kind resource namespace
     * @param ids  identifiers, in a stable order chosen by the caller
     * @return key with a value in [0, 2^63)
     */
    public static ResourceKey resourceLock(ResourceKind kind, String... ids) {
        Objects.requireNonNull(kind, "kind");
        if (ids == null || ids.length == 0) {
            throw new IllegalArgumentException("At least one id is required for a resource lock");
        }
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Resource lock ids must not be blank");
            }
        }
        List<String> idList = Arrays.asList(ids);
        String material = kind.name() + ":" + String.join(":", idList);
        return new ResourceKey(kind, idList, hash63(material));
    }

    /**
     * Lock for an unordered pair, so (a, b) and (b, a) share one key.
     */
    public static ResourceKey pairLock(ResourceKind kind, String first, String second) {
        return first.compareTo(second) <= 0
            ? resourceLock(kind, first, second)
            : resourceLock(kind, second, first);
    }

    static long hash63(String material) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong() & Long.MAX_VALUE;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.williamcallahan.chapter_sync_engine.util;

import com.github.f4b6a3.uuid.UuidCreator;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Row id generation. Ids are time-ordered UUIDv7 strings so primary key indexes stay append-mostly.
 */
public final class IdGenerator {

    private static final Pattern UUID_PATTERN =
        Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private IdGenerator() {
    }

    public static String newId() {
        return UuidCreator.getTimeOrderedEpoch().toString();
    }

    public static UUID newUuid() {
        return UuidCreator.getTimeOrderedEpoch();
    }

    public static boolean isUuid(String value) {
        return value != null && UUID_PATTERN.matcher(value).matches();
    }
}

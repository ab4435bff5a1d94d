package com.williamcallahan.chapter_sync_engine.util;

import org.slf4j.Logger;

import java.util.Arrays;

/**
 * Uniform exception logging. The throwable goes last so SLF4J prints its stack trace,
 * and a null throwable logs the message alone.
 */
public final class LoggingUtils {

    private LoggingUtils() {
    }

    public static void warn(Logger logger, Throwable throwable, String template, Object... args) {
        if (!logger.isWarnEnabled()) {
            return;
        }
        logger.warn(template, withThrowable(args, throwable));
    }

    public static void error(Logger logger, Throwable throwable, String template, Object... args) {
        if (!logger.isErrorEnabled()) {
            return;
        }
        logger.error(template, withThrowable(args, throwable));
    }

    /**
     * Short single-line description of a throwable, safe to persist in coarse error fields.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        String message = throwable.getMessage();
        String type = throwable.getClass().getSimpleName();
        if (message == null || message.isBlank()) {
            return type;
        }
        String singleLine = message.replaceAll("\\s+", " ").trim();
        return type + ": " + (singleLine.length() > 240 ? singleLine.substring(0, 240) + "…" : singleLine);
    }

    private static Object[] withThrowable(Object[] args, Throwable throwable) {
        if (throwable == null) {
            return args;
        }
        Object[] extended = Arrays.copyOf(args, args.length + 1);
        extended[args.length] = throwable;
        return extended;
    }
}

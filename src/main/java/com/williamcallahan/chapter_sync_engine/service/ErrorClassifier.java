/**
 * Maps failures onto the four error categories used at the job boundary
 *
 * Features:
 * - Unwraps wrapper exceptions (ExecutionException, CompletionException, UndeclaredThrowableException)
 * - Upstream network, rate limit and lock contention failures are TRANSIENT
 * - Malformed upstream payloads are DATA
 * - Invariant violations and unexpected programming errors are FATAL
 * - Produces safe messages that never contain upstream response text
 */

package com.williamcallahan.chapter_sync_engine.service;

import com.williamcallahan.chapter_sync_engine.exception.InvariantViolationException;
import com.williamcallahan.chapter_sync_engine.exception.JobTimeoutException;
import com.williamcallahan.chapter_sync_engine.exception.LockUnavailableException;
import com.williamcallahan.chapter_sync_engine.exception.SourceNetworkException;
import com.williamcallahan.chapter_sync_engine.exception.SourceParseException;
import com.williamcallahan.chapter_sync_engine.exception.SourceRateLimitedException;
import com.williamcallahan.chapter_sync_engine.exception.SourceUnavailableException;
import com.williamcallahan.chapter_sync_engine.queue.JobFailure;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.io.IOException;
import java.lang.reflect.UndeclaredThrowableException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

@Component
public class ErrorClassifier {

    private static final int MAX_UNWRAP_DEPTH = 8;

    public ErrorCategory classify(Throwable throwable) {
        Throwable error = unwrap(throwable);
        if (error instanceof SourceNetworkException
                || error instanceof SourceRateLimitedException
                || error instanceof SourceUnavailableException
                || error instanceof RequestNotPermitted
                || error instanceof LockUnavailableException
                || error instanceof JobTimeoutException
                || error instanceof TimeoutException
                || error instanceof IOException) {
            return ErrorCategory.TRANSIENT;
        }
        if (error instanceof SourceParseException) {
            return ErrorCategory.DATA;
        }
        // Concurrent writers racing on a unique key converge on retry
        if (error instanceof DuplicateKeyException
                || error instanceof TransientDataAccessException
                || error instanceof RecoverableDataAccessException
                || error instanceof QueryTimeoutException
                || error instanceof CannotCreateTransactionException) {
            return ErrorCategory.TRANSIENT;
        }
        if (error instanceof InvariantViolationException || error instanceof NonTransientDataAccessException) {
            return ErrorCategory.FATAL;
        }
        if (error instanceof IllegalArgumentException) {
            return ErrorCategory.DATA;
        }
        if (error instanceof RuntimeException || error instanceof Error) {
            return ErrorCategory.FATAL;
        }
        return ErrorCategory.TRANSIENT;
    }

    /**
     * Classification and safe message for a failure, ready to cross the job boundary.
     */
    public JobFailure toJobFailure(Throwable throwable) {
        Throwable error = unwrap(throwable);
        ErrorCategory category = classify(error);
        return new JobFailure(category, safeMessage(category, error), retryAfter(error), null);
    }

    /**
     * Category and exception type only; raw upstream text stays in the logs.
     */
    public String safeMessage(ErrorCategory category, Throwable throwable) {
        Throwable error = unwrap(throwable);
        return category.name().toLowerCase() + ": " + (error == null ? "unknown" : error.getClass().getSimpleName());
    }

    public Duration retryAfter(Throwable throwable) {
        Throwable error = unwrap(throwable);
        if (error instanceof SourceRateLimitedException rateLimited) {
            return rateLimited.getRetryAfter();
        }
        return null;
    }

    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && current.getCause() != null && depth < MAX_UNWRAP_DEPTH
                && (current instanceof ExecutionException
                    || current instanceof CompletionException
                    || current instanceof UndeclaredThrowableException)) {
            current = current.getCause();
            depth++;
        }
        return current;
    }
}

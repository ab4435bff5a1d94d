package com.williamcallahan.chapter_sync_engine.service;

import com.williamcallahan.chapter_sync_engine.exception.InvariantViolationException;
import com.williamcallahan.chapter_sync_engine.exception.LockUnavailableException;
import com.williamcallahan.chapter_sync_engine.exception.SourceNetworkException;
import com.williamcallahan.chapter_sync_engine.exception.SourceParseException;
import com.williamcallahan.chapter_sync_engine.exception.SourceRateLimitedException;
import com.williamcallahan.chapter_sync_engine.exception.SourceUnavailableException;
import com.williamcallahan.chapter_sync_engine.queue.JobFailure;
import com.williamcallahan.chapter_sync_engine.types.ErrorCategory;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void upstreamAndContentionFailuresAreTransient() {
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify(new SourceNetworkException("mangadex", "reset")));
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify(new SourceRateLimitedException("mangadex", null)));
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify(new SourceUnavailableException("circuit open")));
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify(new LockUnavailableException("series_source:1", 7L)));
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify(new IOException("socket")));
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify(new DuplicateKeyException("race")));
        assertEquals(ErrorCategory.TRANSIENT, classifier.classify(new QueryTimeoutException("slow")));
    }

    @Test
    void malformedPayloadsAreData() {
        assertEquals(ErrorCategory.DATA, classifier.classify(new SourceParseException("mangadex", "bad json")));
        assertEquals(ErrorCategory.DATA, classifier.classify(new IllegalArgumentException("missing field")));
    }

    @Test
    void invariantAndProgrammingErrorsAreFatal() {
        assertEquals(ErrorCategory.FATAL, classifier.classify(new InvariantViolationException("alias chain")));
        assertEquals(ErrorCategory.FATAL, classifier.classify(new DataIntegrityViolationException("check constraint")));
        assertEquals(ErrorCategory.FATAL, classifier.classify(new NullPointerException()));
    }

    @Test
    void wrappersAreUnwrapped() {
        ExecutionException wrapped = new ExecutionException(
            new CompletionException(new SourceParseException("mangadex", "bad json")));

        assertEquals(ErrorCategory.DATA, classifier.classify(wrapped));
    }

    @Test
    void toJobFailure_carriesRetryAfterAndNoUpstreamText() {
        JobFailure failure = classifier.toJobFailure(
            new SourceRateLimitedException("mangadex", Duration.ofSeconds(45)));

        assertEquals(ErrorCategory.TRANSIENT, failure.category());
        assertEquals(Duration.ofSeconds(45), failure.retryAfter());
        assertEquals("transient: SourceRateLimitedException", failure.safeMessage());
    }

    @Test
    void toJobFailure_safeMessageOmitsExceptionMessage() {
        JobFailure failure = classifier.toJobFailure(new SourceParseException("mangadex", "<html>secret token</html>"));

        assertEquals("data: SourceParseException", failure.safeMessage());
        assertFalse(failure.safeMessage().contains("secret"));
        assertNull(failure.retryAfter());
    }
}

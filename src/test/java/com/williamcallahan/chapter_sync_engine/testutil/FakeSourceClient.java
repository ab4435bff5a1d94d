package com.williamcallahan.chapter_sync_engine.testutil;

import com.williamcallahan.chapter_sync_engine.client.SourceClient;
import com.williamcallahan.chapter_sync_engine.exception.SourceClientException;
import com.williamcallahan.chapter_sync_engine.exception.SourceParseException;
import com.williamcallahan.chapter_sync_engine.model.ChapterList;
import com.williamcallahan.chapter_sync_engine.model.RawChapter;
import com.williamcallahan.chapter_sync_engine.model.SeriesCandidate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Scripted upstream: chapter lists and series metadata per source id, with queued failures. */
public class FakeSourceClient implements SourceClient {

    private final String sourceName;
    private final Map<String, List<RawChapter>> chapters = new ConcurrentHashMap<>();
    private final Map<String, SeriesCandidate> series = new ConcurrentHashMap<>();
    private final Deque<SourceClientException> failures = new ArrayDeque<>();
    private final AtomicInteger chapterCalls = new AtomicInteger();
    private final AtomicInteger seriesCalls = new AtomicInteger();
    private volatile Runnable beforeFetch = () -> { };

    public FakeSourceClient(String sourceName) {
        this.sourceName = sourceName;
    }

    public FakeSourceClient withChapters(String sourceId, List<RawChapter> list) {
        chapters.put(sourceId, List.copyOf(list));
        return this;
    }

    public FakeSourceClient withSeries(SeriesCandidate candidate) {
        series.put(candidate.sourceId(), candidate);
        return this;
    }

    /** The next calls fail with the given exceptions, in order. */
    public synchronized FakeSourceClient failNext(SourceClientException... errors) {
        for (SourceClientException error : errors) {
            failures.addLast(error);
        }
        return this;
    }

    /** Runs before every fetch, e.g. to block on a latch. */
    public FakeSourceClient beforeFetch(Runnable hook) {
        this.beforeFetch = hook;
        return this;
    }

    public int chapterCalls() {
        return chapterCalls.get();
    }

    public int seriesCalls() {
        return seriesCalls.get();
    }

    @Override
    public String sourceName() {
        return sourceName;
    }

    @Override
    public ChapterList fetchChapters(String sourceId) throws SourceClientException {
        chapterCalls.incrementAndGet();
        beforeFetch.run();
        throwQueuedFailure();
        return new ChapterList(chapters.getOrDefault(sourceId, List.of()));
    }

    @Override
    public SeriesCandidate fetchSeries(String sourceId) throws SourceClientException {
        seriesCalls.incrementAndGet();
        beforeFetch.run();
        throwQueuedFailure();
        SeriesCandidate candidate = series.get(sourceId);
        if (candidate == null) {
            throw new SourceParseException(sourceName, "no series scripted for " + sourceId);
        }
        return candidate;
    }

    private void throwQueuedFailure() throws SourceClientException {
        SourceClientException failure;
        synchronized (this) {
            failure = failures.pollFirst();
        }
        if (failure != null) {
            throw failure;
        }
    }
}

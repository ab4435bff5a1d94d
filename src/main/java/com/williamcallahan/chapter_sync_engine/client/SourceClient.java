package com.williamcallahan.chapter_sync_engine.client;

import com.williamcallahan.chapter_sync_engine.exception.SourceClientException;
import com.williamcallahan.chapter_sync_engine.model.ChapterList;
import com.williamcallahan.chapter_sync_engine.model.SeriesCandidate;

/**
 * Adapter for one upstream provider. Implementations are registered as Spring beans and looked up
 * by {@link #sourceName()}; callers never assume the upstream is reachable.
 */
public interface SourceClient {

    /**
     * Stable, lower-case provider name matching {@code series_sources.source_name}.
     */
    String sourceName();

    /**
     * Fetches the chapter list for an upstream series.
     *
     * @param sourceId the provider's own identifier
     * @throws SourceClientException network, parse or rate-limit failures
     */
    ChapterList fetchChapters(String sourceId) throws SourceClientException;

    /**
     * Fetches series metadata used for canonicalization and enrichment.
     *
     * @param sourceId the provider's own identifier
     * @throws SourceClientException network, parse or rate-limit failures
     */
    SeriesCandidate fetchSeries(String sourceId) throws SourceClientException;
}

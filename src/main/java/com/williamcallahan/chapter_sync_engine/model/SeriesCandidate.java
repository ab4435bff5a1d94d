package com.williamcallahan.chapter_sync_engine.model;

import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A source entity observed upstream that has not been matched to a canonical series yet.
 *
 * @param externalIds cross-provider identifiers keyed by provider (for example {@code mangadex})
 */
@Builder(toBuilder = true)
public record SeriesCandidate(
    String sourceName,
    String sourceId,
    String sourceUrl,
    String title,
    Set<String> alternativeTitles,
    List<String> creators,
    String language,
    Integer publicationYear,
    String status,
    Map<String, String> externalIds,
    long followerCount
) {

    public SeriesCandidate {
        alternativeTitles = alternativeTitles == null ? Set.of() : Set.copyOf(alternativeTitles);
        creators = creators == null ? List.of() : List.copyOf(creators);
        externalIds = externalIds == null ? Map.of() : Map.copyOf(externalIds);
    }
}

/**
 * Canonical series snapshot
 *
 * Features:
 * - canonicalSeriesId non-null marks this row as an alias merged into another series
 * - Alias pointers are always one hop; they never point at another alias
 * - Immutable; use toBuilder() to derive updated copies
 */

package com.williamcallahan.chapter_sync_engine.model;

import com.williamcallahan.chapter_sync_engine.types.MetadataSourceRank;
import com.williamcallahan.chapter_sync_engine.types.SeriesStatus;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Set;

@Builder(toBuilder = true)
public record Series(
    String id,
    String title,
    Set<String> alternativeTitles,
    List<String> creators,
    String language,
    Integer publicationYear,
    SeriesStatus status,
    int metadataSchemaVersion,
    String canonicalSeriesId,
    boolean needsReview,
    MetadataSourceRank metadataSource,
    long followerCount,
    Instant createdAt,
    Instant updatedAt
) {

    public Series {
        alternativeTitles = alternativeTitles == null ? Set.of() : Set.copyOf(alternativeTitles);
        creators = creators == null ? List.of() : List.copyOf(creators);
        metadataSource = metadataSource == null ? MetadataSourceRank.INFERRED : metadataSource;
    }

    public boolean isAlias() {
        return canonicalSeriesId != null;
    }

    /**
     * Id of the canonical row this series resolves to.
     */
    public String resolvedId() {
        return canonicalSeriesId != null ? canonicalSeriesId : id;
    }
}

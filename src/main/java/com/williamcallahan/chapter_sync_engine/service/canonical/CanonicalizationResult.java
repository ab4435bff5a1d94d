package com.williamcallahan.chapter_sync_engine.service.canonical;

import com.williamcallahan.chapter_sync_engine.types.CanonicalizationAction;

/**
 * Decision for one source entity.
 *
 * @param seriesId       canonical series the source is linked to
 * @param seriesSourceId the source row, new or existing
 * @param matchedSeriesId best existing match when the decision was review or a link; null otherwise
 * @param reviewItemId   review item raised for a low-confidence or year-drift match, if any
 */
public record CanonicalizationResult(
    CanonicalizationAction action,
    String seriesId,
    String seriesSourceId,
    double confidence,
    String matchedSeriesId,
    String reviewItemId
) {

    public boolean sourceCreated() {
        return action != CanonicalizationAction.ALREADY_LINKED;
    }
}

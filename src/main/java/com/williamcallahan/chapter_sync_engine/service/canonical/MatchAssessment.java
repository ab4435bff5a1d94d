package com.williamcallahan.chapter_sync_engine.service.canonical;

import com.williamcallahan.chapter_sync_engine.model.Series;
import com.williamcallahan.chapter_sync_engine.util.YearDrift;

/**
 * Score of one existing series against an incoming candidate.
 *
 * @param confidence      combined score in [0, 1]
 * @param exactTitleMatch a normalized title of the candidate equals one of the series' titles
 * @param yearDrift       publication year compatibility
 */
public record MatchAssessment(
    Series series,
    double confidence,
    double titleSimilarity,
    double creatorSimilarity,
    boolean exactTitleMatch,
    boolean languageCompatible,
    YearDrift.Check yearDrift
) {

    /**
     * Year drift above one year never links automatically.
     */
    public boolean blocksAutomaticLink() {
        return yearDrift.blocksAutomaticMatch();
    }

    /**
     * Drift of more than three years means a different work; no review is raised for it.
     */
    public boolean isIncompatible() {
        return yearDrift.compatibility() == YearDrift.Compatibility.INCOMPATIBLE;
    }
}

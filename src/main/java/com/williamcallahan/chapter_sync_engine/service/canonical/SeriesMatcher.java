/**
 * Scores existing canonical series against a newly observed source entity
 *
 * Features:
 * - Exact normalized title match (primary or alternative) scores at least 0.9
 * - Fuzzy score blends title similarity (70%) with creator overlap (30%) when both sides list creators
 * - Different language families subtract a configurable penalty
 * - Publication year drift is reported alongside the score and blocks automatic links above one year
 * - Ranking is deterministic: confidence descending, then series id
 */

package com.williamcallahan.chapter_sync_engine.service.canonical;

import com.williamcallahan.chapter_sync_engine.config.SyncEngineProperties;
import com.williamcallahan.chapter_sync_engine.model.Series;
import com.williamcallahan.chapter_sync_engine.model.SeriesCandidate;
import com.williamcallahan.chapter_sync_engine.util.LanguageFamilies;
import com.williamcallahan.chapter_sync_engine.util.SimilarityUtils;
import com.williamcallahan.chapter_sync_engine.util.TextUtils;
import com.williamcallahan.chapter_sync_engine.util.YearDrift;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class SeriesMatcher {

    static final double EXACT_TITLE_CONFIDENCE = 0.9;
    static final double TITLE_WEIGHT = 0.7;
    static final double CREATOR_WEIGHT = 0.3;

    private static final Comparator<MatchAssessment> RANKING = Comparator
        .comparingDouble(MatchAssessment::confidence).reversed()
        .thenComparing(assessment -> assessment.series().id());

    private final double languagePenalty;

    public SeriesMatcher(SyncEngineProperties properties) {
        this.languagePenalty = properties.getCanonicalization().getLanguagePenalty();
    }

    /**
     * Scores every series and returns them best first.
     */
    public List<MatchAssessment> rank(SeriesCandidate candidate, Collection<Series> existing) {
        Set<String> candidateTitles = TextUtils.normalizeTitles(candidate.title(), candidate.alternativeTitles());
        return existing.stream()
            .map(series -> assess(candidateTitles, candidate.creators(), candidate.language(),
                candidate.publicationYear(), series))
            .sorted(RANKING)
            .collect(Collectors.toList());
    }

    public MatchAssessment assess(SeriesCandidate candidate, Series series) {
        return assess(TextUtils.normalizeTitles(candidate.title(), candidate.alternativeTitles()),
            candidate.creators(), candidate.language(), candidate.publicationYear(), series);
    }

    /**
     * Scores two canonical series against each other, used when reconciling duplicates.
     */
    public MatchAssessment assess(Series incoming, Series series) {
        return assess(TextUtils.normalizeTitles(incoming.title(), incoming.alternativeTitles()),
            incoming.creators(), incoming.language(), incoming.publicationYear(), series);
    }

    private MatchAssessment assess(Set<String> candidateTitles, List<String> creators, String language,
                                   Integer publicationYear, Series series) {
        Set<String> seriesTitles = TextUtils.normalizeTitles(series.title(), series.alternativeTitles());
        boolean exact = candidateTitles.stream().anyMatch(seriesTitles::contains);
        double titleSimilarity = exact ? 1.0 : SimilarityUtils.bestTitleSimilarity(candidateTitles, seriesTitles);
        double creatorSimilarity = SimilarityUtils.creatorSimilarity(creators, series.creators());

        double confidence = bothListCreators(creators, series.creators())
            ? TITLE_WEIGHT * titleSimilarity + CREATOR_WEIGHT * creatorSimilarity
            : titleSimilarity;
        if (exact) {
            confidence = Math.max(confidence, EXACT_TITLE_CONFIDENCE);
        }

        boolean languageCompatible = LanguageFamilies.areCompatible(language, series.language());
        if (!languageCompatible) {
            confidence -= languagePenalty;
        }

        YearDrift.Check drift = YearDrift.check(publicationYear, series.publicationYear());
        return new MatchAssessment(series, clamp(confidence), titleSimilarity, creatorSimilarity,
            exact, languageCompatible, drift);
    }

    private static boolean bothListCreators(List<String> a, List<String> b) {
        return a != null && !a.isEmpty() && b != null && !b.isEmpty();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}

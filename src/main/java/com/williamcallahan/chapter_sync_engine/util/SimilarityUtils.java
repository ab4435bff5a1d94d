package com.williamcallahan.chapter_sync_engine.util;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Similarity scores in [0, 1] over normalized titles and creator names.
 */
public final class SimilarityUtils {

    /** Creator similarity when either side has no creators listed. */
    public static final double UNKNOWN_CREATOR_SIMILARITY = 0.5;

    private SimilarityUtils() {
    }

    /**
     * Title similarity of two raw titles. Both are normalized first; the score is the better of the
     * token score (Jaccard weighted 0.7 plus length ratio weighted 0.3) and the character bigram
     * Dice coefficient, so word reordering and small spelling differences are both tolerated.
     */
    public static double titleSimilarity(String titleA, String titleB) {
        return normalizedTitleSimilarity(TextUtils.normalizeTitle(titleA), TextUtils.normalizeTitle(titleB));
    }

    /**
     * Same as {@link #titleSimilarity(String, String)} for titles that are already normalized.
     */
    public static double normalizedTitleSimilarity(String normalizedA, String normalizedB) {
        if (normalizedA == null || normalizedB == null || normalizedA.isEmpty() || normalizedB.isEmpty()) {
            return 0.0;
        }
        if (normalizedA.equals(normalizedB)) {
            return 1.0;
        }
        double tokenScore = tokenJaccard(normalizedA, normalizedB) * 0.7 + lengthRatio(normalizedA, normalizedB) * 0.3;
        return Math.max(tokenScore, bigramDice(normalizedA, normalizedB));
    }

    /**
     * Best pairwise similarity between two sets of normalized titles.
     */
    public static double bestTitleSimilarity(Collection<String> normalizedA, Collection<String> normalizedB) {
        double best = 0.0;
        for (String a : normalizedA) {
            for (String b : normalizedB) {
                best = Math.max(best, normalizedTitleSimilarity(a, b));
                if (best >= 1.0) {
                    return 1.0;
                }
            }
        }
        return best;
    }

    public static double tokenJaccard(String normalizedA, String normalizedB) {
        Set<String> tokensA = new HashSet<>(TextUtils.tokens(normalizedA));
        Set<String> tokensB = new HashSet<>(TextUtils.tokens(normalizedB));
        return jaccard(tokensA, tokensB, 0.0);
    }

    /**
     * Sørensen–Dice coefficient over character bigrams (spaces removed).
     */
    public static double bigramDice(String normalizedA, String normalizedB) {
        String a = normalizedA.replace(" ", "");
        String b = normalizedB.replace(" ", "");
        if (a.length() < 2 || b.length() < 2) {
            return a.equals(b) ? 1.0 : 0.0;
        }
        Map<String, Integer> bigramsA = bigrams(a);
        Map<String, Integer> bigramsB = bigrams(b);
        int overlap = 0;
        for (Map.Entry<String, Integer> entry : bigramsA.entrySet()) {
            overlap += Math.min(entry.getValue(), bigramsB.getOrDefault(entry.getKey(), 0));
        }
        return (2.0 * overlap) / ((a.length() - 1) + (b.length() - 1));
    }

    /**
     * Jaccard overlap of normalized creator names; {@value #UNKNOWN_CREATOR_SIMILARITY} when either list is empty.
     */
    public static double creatorSimilarity(List<String> creatorsA, List<String> creatorsB) {
        Set<String> a = normalizeCreators(creatorsA);
        Set<String> b = normalizeCreators(creatorsB);
        if (a.isEmpty() || b.isEmpty()) {
            return UNKNOWN_CREATOR_SIMILARITY;
        }
        return jaccard(a, b, UNKNOWN_CREATOR_SIMILARITY);
    }

    private static Set<String> normalizeCreators(List<String> creators) {
        if (creators == null) {
            return Set.of();
        }
        return creators.stream()
            .map(TextUtils::normalizeCreator)
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toSet());
    }

    private static double lengthRatio(String a, String b) {
        int max = Math.max(a.length(), b.length());
        int min = Math.min(a.length(), b.length());
        return max > 0 ? (double) min / max : 1.0;
    }

    private static double jaccard(Set<String> a, Set<String> b, double emptyValue) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return emptyValue;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }

    private static Map<String, Integer> bigrams(String text) {
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < text.length() - 1; i++) {
            counts.merge(text.substring(i, i + 2), 1, Integer::sum);
        }
        return counts;
    }
}

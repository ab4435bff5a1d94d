package com.williamcallahan.chapter_sync_engine.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test suite for SimilarityUtils
 */
class SimilarityUtilsTest {

    private static final double DELTA = 0.0001;

    @Test
    void titleSimilarity_identicalAfterNormalization() {
        assertEquals(1.0, SimilarityUtils.titleSimilarity("One Piece", "ONE PIECE!"), DELTA);
        assertEquals(1.0, SimilarityUtils.titleSimilarity("Pokémon", "Pokemon"), DELTA);
    }

    @Test
    void titleSimilarity_toleratesWordOrder() {
        assertEquals(1.0, SimilarityUtils.titleSimilarity("Piece One", "One Piece"), DELTA);
    }

    @Test
    void titleSimilarity_toleratesSmallSpellingDifference() {
        double score = SimilarityUtils.titleSimilarity("The Beginning After The End", "Beginning After the Ending");

        assertTrue(score > 0.8, "score was " + score);
    }

    @Test
    void titleSimilarity_unrelatedTitlesScoreLow() {
        double score = SimilarityUtils.titleSimilarity("Naruto", "Bleach");

        assertTrue(score < 0.5, "score was " + score);
    }

    @Test
    void titleSimilarity_emptyTitleScoresZero() {
        assertEquals(0.0, SimilarityUtils.titleSimilarity("", "One Piece"), DELTA);
        assertEquals(0.0, SimilarityUtils.titleSimilarity(null, null), DELTA);
    }

    @Test
    void bigramDice_classicExample() {
        assertEquals(0.25, SimilarityUtils.bigramDice("night", "nacht"), DELTA);
    }

    @Test
    void tokenJaccard_sharedToken() {
        assertEquals(1.0 / 3.0, SimilarityUtils.tokenJaccard("one piece", "one punch"), DELTA);
    }

    @Test
    void bestTitleSimilarity_usesBestPair() {
        double score = SimilarityUtils.bestTitleSimilarity(
            Set.of("solo leveling", "ore dake level up na ken"),
            Set.of("na honjaman level up", "solo leveling"));

        assertEquals(1.0, score, DELTA);
    }

    @Test
    void creatorSimilarity_unknownWhenEitherSideEmpty() {
        assertEquals(SimilarityUtils.UNKNOWN_CREATOR_SIMILARITY,
            SimilarityUtils.creatorSimilarity(List.of(), List.of("Oda Eiichiro")), DELTA);
        assertEquals(SimilarityUtils.UNKNOWN_CREATOR_SIMILARITY,
            SimilarityUtils.creatorSimilarity(null, List.of("Oda Eiichiro")), DELTA);
    }

    @Test
    void creatorSimilarity_matchesReorderedNames() {
        assertEquals(1.0, SimilarityUtils.creatorSimilarity(List.of("Oda Eiichiro"), List.of("Eiichiro Oda")), DELTA);
        assertEquals(0.0, SimilarityUtils.creatorSimilarity(List.of("Oda Eiichiro"), List.of("Kishimoto Masashi")), DELTA);
        assertEquals(1.0 / 3.0, SimilarityUtils.creatorSimilarity(
            List.of("Chugong", "Dubu"), List.of("Chugong", "Jang Sung-lak")), DELTA);
    }
}

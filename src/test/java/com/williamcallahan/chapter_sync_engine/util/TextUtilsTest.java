package com.williamcallahan.chapter_sync_engine.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test suite for TextUtils title and creator normalization
 */
class TextUtilsTest {

    @ParameterizedTest
    @CsvSource({
        "Pokémon, pokemon",
        "'Solo Leveling (Official)', solo leveling",
        "'The Beginning After the End', beginning after end",
        "'ONE PIECE!!', one piece",
        "'  Tower   of God  ', tower god",
        "'[Webtoon] Lookism', lookism",
        "The, the"
    })
    void normalizeTitle_variants(String raw, String expected) {
        assertEquals(expected, TextUtils.normalizeTitle(raw));
    }

    @Test
    void normalizeTitle_nullIsEmpty() {
        assertEquals("", TextUtils.normalizeTitle(null));
    }

    @Test
    void normalizeTitle_keepsBracketContentWhenNothingElse() {
        assertEquals("official", TextUtils.normalizeTitle("(Official)"));
    }

    @Test
    void normalizeTitle_keepsNonLatinScripts() {
        assertEquals("ワンピース", TextUtils.normalizeTitle("ワンピース"));
        assertEquals("나 혼자만 레벨업", TextUtils.normalizeTitle("나 혼자만 레벨업"));
    }

    @Test
    void normalizeTitles_dropsBlanksAndDuplicates() {
        Set<String> titles = TextUtils.normalizeTitles("One Piece", Arrays.asList("ワンピース", "one piece", " ", null));

        assertEquals(2, titles.size());
        assertTrue(titles.contains("one piece"));
        assertTrue(titles.contains("ワンピース"));
    }

    @Test
    void normalizeCreator_ignoresNameOrder() {
        assertEquals(TextUtils.normalizeCreator("Oda Eiichiro"), TextUtils.normalizeCreator("Eiichiro Oda"));
        assertEquals("eiichiro oda", TextUtils.normalizeCreator("ODA, Eiichiro"));
        assertEquals("", TextUtils.normalizeCreator(null));
    }

    @Test
    void tokens_splitsNormalizedText() {
        assertEquals(List.of("solo", "leveling"), TextUtils.tokens("solo leveling"));
        assertEquals(List.of(), TextUtils.tokens(""));
    }
}

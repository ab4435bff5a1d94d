package com.williamcallahan.chapter_sync_engine.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Test suite for UrlUtils normalization and hashing
 */
class UrlUtilsTest {

    @ParameterizedTest
    @CsvSource({
        "https://www.example.com/series/12, https://example.com/series/12/",
        "https://example.com/series/12?utm_source=feed&utm_medium=rss, https://example.com/series/12",
        "https://EXAMPLE.com/series/12#chapters, https://example.com/series/12",
        "https://example.com/series/12?fbclid=abc, https://www.example.com/series/12///"
    })
    void hashSourceUrl_equivalentUrlsShareHash(String first, String second) {
        assertEquals(UrlUtils.hashSourceUrl(first), UrlUtils.hashSourceUrl(second));
    }

    @Test
    void hashSourceUrl_differentPathsDiffer() {
        assertNotEquals(UrlUtils.hashSourceUrl("https://example.com/series/12"),
            UrlUtils.hashSourceUrl("https://example.com/series/13"));
    }

    @Test
    void hashSourceUrl_isLowerHexSha256() {
        String hash = UrlUtils.hashSourceUrl("https://example.com/series/12");

        assertEquals(64, hash.length());
        assertEquals(hash, hash.toLowerCase());
    }

    @Test
    void normalizeSourceUrl_keepsPathCaseAndRealParameters() {
        assertEquals("https://example.com/Series/12",
            UrlUtils.normalizeSourceUrl("https://WWW.Example.com/Series/12/?utm_source=x#top"));
        assertEquals("https://example.com/list?page=2",
            UrlUtils.normalizeSourceUrl("https://example.com/list?page=2&utm_medium=x"));
        assertEquals("http://example.com:8080/a",
            UrlUtils.normalizeSourceUrl("http://example.com:8080/a/"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void normalizeSourceUrl_blankInputReturnsNull(String url) {
        assertNull(UrlUtils.normalizeSourceUrl(url));
        assertNull(UrlUtils.hashSourceUrl(url));
    }

    @ParameterizedTest
    @ValueSource(strings = {"ftp://example.com/file", "/relative/path", "not a url", "mailto:someone@example.com"})
    void validateHttpUrl_rejectsNonHttp(String url) {
        assertNull(UrlUtils.validateHttpUrl(url));
    }

    @Test
    void validateHttpUrl_trimsValidUrl() {
        assertEquals("https://example.com/chapter/1", UrlUtils.validateHttpUrl("  https://example.com/chapter/1 "));
    }
}

package com.williamcallahan.chapter_sync_engine.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Utility class for title and creator normalization used by series matching.
 * Provides consistent text handling across canonicalization and enrichment.
 */
public final class TextUtils {

    private static final Logger logger = LoggerFactory.getLogger(TextUtils.class);

    // Words dropped from normalized titles unless the title consists only of them
    private static final Set<String> STOP_WORDS = new HashSet<>(Arrays.asList(
        "a", "an", "and", "the", "of", "to", "in", "on", "for", "with"
    ));

    private static final Pattern COMBINING_MARKS = Pattern.compile("(?<=\\p{IsLatin})\\p{M}+");
    private static final Pattern BRACKET_QUALIFIERS = Pattern.compile("\\([^)]*\\)|\\[[^\\]]*\\]|\\{[^}]*\\}|【[^】]*】");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * Normalizes a series title for matching.
     * Handles:
     * - Unicode compatibility forms and diacritics ("Pokémon" → "pokemon")
     * - Bracket qualifiers ("Solo Leveling (Official)" → "solo leveling")
     * - Punctuation and whitespace runs
     * - Stop words ("The Beginning After the End" → "beginning after end")
     *
     * @param title raw title, may be null
     * @return normalized title, empty string if nothing remains
     */
    public static String normalizeTitle(String title) {
        if (title == null || title.isBlank()) {
            return "";
        }
        String folded = foldToBaseLetters(title);
        String withoutQualifiers = BRACKET_QUALIFIERS.matcher(folded).replaceAll(" ");
        List<String> tokens = tokenize(withoutQualifiers);
        if (tokens.isEmpty()) {
            // Title was only a bracketed qualifier; keep its content rather than matching on nothing
            tokens = tokenize(folded);
        }
        List<String> significant = tokens.stream()
            .filter(token -> !STOP_WORDS.contains(token))
            .collect(Collectors.toList());
        String normalized = String.join(" ", significant.isEmpty() ? tokens : significant);
        if (logger.isTraceEnabled()) {
            logger.trace("Normalized title '{}' to '{}'", title, normalized);
        }
        return normalized;
    }

    /**
     * Normalizes every title of a series (primary plus alternatives), dropping blanks and duplicates.
     */
    public static Set<String> normalizeTitles(String primary, Collection<String> alternatives) {
        Set<String> normalized = new LinkedHashSet<>();
        String main = normalizeTitle(primary);
        if (!main.isEmpty()) {
            normalized.add(main);
        }
        if (alternatives != null) {
            for (String alternative : alternatives) {
                String value = normalizeTitle(alternative);
                if (!value.isEmpty()) {
                    normalized.add(value);
                }
            }
        }
        return normalized;
    }

    /**
     * Normalizes a creator name. Token order is sorted, so "Oda Eiichiro" and "Eiichiro Oda" compare equal.
     *
     * @param name raw creator name
     * @return normalized name, empty string if nothing remains
     */
    public static String normalizeCreator(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        List<String> tokens = new ArrayList<>(tokenize(foldToBaseLetters(name)));
        tokens.sort(null);
        return String.join(" ", tokens);
    }

    /**
     * Splits normalized text into tokens.
     */
    public static List<String> tokens(String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return List.of();
        }
        return Arrays.asList(normalized.trim().split(" "));
    }

    private static String foldToBaseLetters(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        // Only Latin diacritics are dropped; kana voicing marks change meaning
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        // Recompose so scripts that decompose structurally (Hangul) compare as whole syllables
        return Normalizer.normalize(stripped, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
    }

    private static List<String> tokenize(String text) {
        String spaced = NON_ALPHANUMERIC.matcher(text).replaceAll(" ").trim();
        if (spaced.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(spaced.split("\\s+"));
    }
}

package com.williamcallahan.chapter_sync_engine.util;

import com.williamcallahan.chapter_sync_engine.model.ChapterNumber;
import com.williamcallahan.chapter_sync_engine.types.ChapterBand;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.CRC32;

/**
 * Parses upstream chapter labels into {@link ChapterNumber} sort keys.
 * <p>
 * Recognized shapes include {@code "12"}, {@code "10.5"}, {@code "Ch. 7"}, {@code "Vol. 2 Chapter 14.1"},
 * {@code "Prologue"}, {@code "Extra 2"} and {@code "Side Story"}. Anything else falls back to a
 * deterministic UNNUMBERED key derived from the label text, so the same label always maps to the
 * same key and two different unparseable labels do not collide.
 */
public final class ChapterNumbers {

    private static final Pattern PREFIXED_NUMBER = Pattern.compile(
        "(?:^|[^a-z])(?:chapter|chap|ch|episode|ep|#)\\s*\\.?\\s*(\\d+(?:[.,]\\d+)?)");
    private static final Pattern ANY_NUMBER = Pattern.compile("(\\d+(?:[.,]\\d+)?)");
    private static final Pattern VOLUME_PREFIX = Pattern.compile("(?:volume|vol)\\s*\\.?\\s*\\d+");

    // Longer tokens first so "side story" is not read as a plain number label
    private static final List<ChapterBand> SPECIAL_BANDS = List.of(
        ChapterBand.SIDE_STORY,
        ChapterBand.PROLOGUE,
        ChapterBand.ONESHOT,
        ChapterBand.OMAKE,
        ChapterBand.BONUS,
        ChapterBand.EXTRA,
        ChapterBand.EPILOGUE,
        ChapterBand.AFTERWORD
    );

    private ChapterNumbers() {
    }

    /**
     * Parses a chapter label. Never throws; unparseable input yields an UNNUMBERED key.
     *
     * @param raw upstream label, may be null
     * @return sort key for the label
     */
    public static ChapterNumber parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ChapterNumber(ChapterBand.UNNUMBERED, 0, 0);
        }
        String text = Normalizer.normalize(raw, Normalizer.Form.NFKC).trim().toLowerCase(Locale.ROOT);

        // Only a special token ahead of an explicit chapter prefix names the band;
        // "Chapter 12: The Prologue of War" is chapter 12, "Side Story Ch. 3" is a side story
        Matcher prefixed = PREFIXED_NUMBER.matcher(text);
        boolean hasPrefix = prefixed.find();
        String bandText = hasPrefix ? text.substring(0, prefixed.start()) : text;
        Optional<ChapterBand> special = detectSpecialBand(bandText);
        Optional<BigDecimal> number = hasPrefix ? toDecimal(prefixed.group(1)) : findNumber(text);

        if (special.isPresent()) {
            return number
                .map(value -> toKey(special.get(), value))
                .orElseGet(() -> ChapterNumber.special(special.get(), 0));
        }
        if (number.isPresent()) {
            return toKey(ChapterBand.NUMBERED, number.get());
        }
        return fallback(text);
    }

    /**
     * Whether the label parsed into a real position rather than the fallback band.
     */
    public static boolean isParseable(String raw) {
        return parse(raw).band() != ChapterBand.UNNUMBERED;
    }

    static Optional<ChapterBand> detectSpecialBand(String text) {
        for (ChapterBand band : SPECIAL_BANDS) {
            for (String token : band.tokens()) {
                if (containsWord(text, token)) {
                    return Optional.of(band);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean containsWord(String text, String token) {
        int from = 0;
        while (true) {
            int idx = text.indexOf(token, from);
            if (idx < 0) {
                return false;
            }
            int end = idx + token.length();
            boolean startOk = idx == 0 || !Character.isLetter(text.charAt(idx - 1));
            boolean endOk = end == text.length() || !Character.isLetter(text.charAt(end));
            if (startOk && endOk) {
                return true;
            }
            from = idx + 1;
        }
    }

    private static Optional<BigDecimal> findNumber(String text) {
        Matcher prefixed = PREFIXED_NUMBER.matcher(text);
        if (prefixed.find()) {
            return toDecimal(prefixed.group(1));
        }
        String withoutVolume = VOLUME_PREFIX.matcher(text).replaceAll(" ");
        Matcher any = ANY_NUMBER.matcher(withoutVolume);
        if (any.find()) {
            return toDecimal(any.group(1));
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> toDecimal(String digits) {
        try {
            return Optional.of(new BigDecimal(digits.replace(',', '.')));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static ChapterNumber toKey(ChapterBand band, BigDecimal value) {
        BigDecimal scaled = value.setScale(3, RoundingMode.HALF_UP);
        long integerPart = scaled.setScale(0, RoundingMode.DOWN).longValue();
        int fraction = scaled.subtract(BigDecimal.valueOf(integerPart))
            .movePointRight(3)
            .intValue();
        return new ChapterNumber(band, integerPart, fraction);
    }

    private static ChapterNumber fallback(String text) {
        CRC32 crc = new CRC32();
        crc.update(text.getBytes(StandardCharsets.UTF_8));
        return new ChapterNumber(ChapterBand.UNNUMBERED, crc.getValue(), 0);
    }
}

/**
 * Decomposed, sortable chapter number
 *
 * Features:
 * - Stored as (band, integer part, fractional thousandths), never as a floating point value
 * - Natural ordering is band first, then integer part, then fraction
 * - Special chapters (prologue, extras, epilogue) carry their own band and an optional index
 */

package com.williamcallahan.chapter_sync_engine.model;

import com.williamcallahan.chapter_sync_engine.types.ChapterBand;

import java.util.Comparator;
import java.util.Objects;

public record ChapterNumber(ChapterBand band, long integerPart, int fractionalPart) implements Comparable<ChapterNumber> {

    public static final int FRACTION_SCALE = 1000;

    private static final Comparator<ChapterNumber> ORDER = Comparator
        .comparing(ChapterNumber::band)
        .thenComparingLong(ChapterNumber::integerPart)
        .thenComparingInt(ChapterNumber::fractionalPart);

    public ChapterNumber {
        Objects.requireNonNull(band, "band");
        if (fractionalPart < 0 || fractionalPart >= FRACTION_SCALE) {
            throw new IllegalArgumentException("Fractional part out of range: " + fractionalPart);
        }
    }

    public static ChapterNumber numbered(long integerPart, int fractionalPart) {
        return new ChapterNumber(ChapterBand.NUMBERED, integerPart, fractionalPart);
    }

    public static ChapterNumber special(ChapterBand band, long index) {
        return new ChapterNumber(band, index, 0);
    }

    public boolean isNumbered() {
        return band == ChapterBand.NUMBERED;
    }

    /**
     * Human readable form, e.g. {@code 12}, {@code 10.5}, {@code extra 2}.
     */
    public String display() {
        String numeric = fractionalPart == 0
            ? Long.toString(integerPart)
            : integerPart + "." + trimTrailingZeros(fractionalPart);
        return switch (band) {
            case NUMBERED -> numeric;
            case UNNUMBERED -> "unnumbered#" + integerPart;
            case PROLOGUE, ONESHOT, EXTRA, BONUS, SIDE_STORY, OMAKE, EPILOGUE, AFTERWORD ->
                integerPart == 0 && fractionalPart == 0 ? band.label() : band.label() + " " + numeric;
        };
    }

    /**
     * Numeric value used for distance heuristics only; never persisted or used for identity.
     */
    public double approximateValue() {
        return integerPart + (fractionalPart / (double) FRACTION_SCALE);
    }

    @Override
    public int compareTo(ChapterNumber other) {
        return ORDER.compare(this, other);
    }

    private static String trimTrailingZeros(int fraction) {
        String padded = String.format("%03d", fraction);
        int end = padded.length();
        while (end > 1 && padded.charAt(end - 1) == '0') {
            end--;
        }
        return padded.substring(0, end);
    }
}

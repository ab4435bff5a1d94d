/**
 * Pure helpers that turn an upstream chapter list into writes
 *
 * Features:
 * - Normalizes chapter numbers, falling back to the title when the number field is blank
 * - Drops entries with nothing to identify them and duplicate numbers (first entry wins)
 * - Accepts ascending or descending upstream order; anything else is flagged and sorted
 * - Diffs against stored availability rows by normalized number
 */

package com.williamcallahan.chapter_sync_engine.service.ingestion;

import com.williamcallahan.chapter_sync_engine.model.ChapterNumber;
import com.williamcallahan.chapter_sync_engine.model.NormalizedChapter;
import com.williamcallahan.chapter_sync_engine.model.RawChapter;
import com.williamcallahan.chapter_sync_engine.model.StoredChapter;
import com.williamcallahan.chapter_sync_engine.util.ChapterNumbers;
import com.williamcallahan.chapter_sync_engine.util.UrlUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ChapterDiffer {

    private static final Pattern DIGITS = Pattern.compile("(\\d{1,9})");

    /**
     * Upstream list after normalization.
     *
     * @param chapters   unique by number, ascending
     * @param invalid    entries dropped because neither number nor title was present
     * @param duplicates entries dropped because an earlier entry had the same number
     * @param reordered  the upstream order was neither ascending nor descending
     */
    public record NormalizedList(List<NormalizedChapter> chapters, int invalid, int duplicates, boolean reordered) {}

    private ChapterDiffer() {
    }

    public static NormalizedList normalize(List<RawChapter> rawChapters) {
        Map<ChapterNumber, NormalizedChapter> unique = new LinkedHashMap<>();
        List<ChapterNumber> upstreamOrder = new ArrayList<>();
        int invalid = 0;
        int duplicates = 0;
        for (RawChapter raw : rawChapters) {
            Optional<NormalizedChapter> chapter = normalize(raw);
            if (chapter.isEmpty()) {
                invalid++;
                continue;
            }
            if (unique.putIfAbsent(chapter.get().number(), chapter.get()) != null) {
                duplicates++;
                continue;
            }
            upstreamOrder.add(chapter.get().number());
        }
        List<NormalizedChapter> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparing(NormalizedChapter::number));
        return new NormalizedList(sorted, invalid, duplicates, !isMonotonic(upstreamOrder));
    }

    static Optional<NormalizedChapter> normalize(RawChapter raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String label = hasText(raw.number()) ? raw.number() : raw.title();
        if (!hasText(label)) {
            return Optional.empty();
        }
        return Optional.of(new NormalizedChapter(
            ChapterNumbers.parse(label),
            hasText(raw.title()) ? raw.title().trim() : null,
            parseVolume(raw.volume()),
            raw.publishedAt(),
            hasText(raw.sourceChapterId()) ? raw.sourceChapterId().trim() : null,
            UrlUtils.validateHttpUrl(raw.url())
        ));
    }

    public static ChapterDiff diff(List<NormalizedChapter> upstream, List<StoredChapter> stored) {
        Map<ChapterNumber, StoredChapter> storedByNumber = new HashMap<>();
        int storedAvailable = 0;
        for (StoredChapter row : stored) {
            storedByNumber.put(row.number(), row);
            if (row.isAvailable()) {
                storedAvailable++;
            }
        }

        List<NormalizedChapter> added = new ArrayList<>();
        List<NormalizedChapter> changed = new ArrayList<>();
        int unchanged = 0;
        int restored = 0;
        for (NormalizedChapter chapter : upstream) {
            StoredChapter existing = storedByNumber.remove(chapter.number());
            if (existing == null) {
                added.add(chapter);
            } else if (!existing.isAvailable()) {
                changed.add(chapter);
                restored++;
            } else if (differs(existing, chapter)) {
                changed.add(chapter);
            } else {
                unchanged++;
            }
        }

        List<StoredChapter> missing = storedByNumber.values().stream()
            .filter(StoredChapter::isAvailable)
            .sorted(Comparator.comparing(StoredChapter::number))
            .toList();
        return new ChapterDiff(added, changed, missing, unchanged, restored, storedAvailable);
    }

    /**
     * Added numbered chapters that sit more than {@code tolerance} below the highest stored chapter.
     */
    public static List<String> outOfOrderWarnings(List<NormalizedChapter> added, List<StoredChapter> stored, int tolerance) {
        Optional<ChapterNumber> storedMax = stored.stream()
            .filter(StoredChapter::isAvailable)
            .map(StoredChapter::number)
            .filter(ChapterNumber::isNumbered)
            .max(Comparator.naturalOrder());
        if (storedMax.isEmpty()) {
            return List.of();
        }
        double ceiling = storedMax.get().approximateValue();
        List<String> warnings = new ArrayList<>();
        for (NormalizedChapter chapter : added) {
            if (chapter.number().isNumbered() && chapter.number().approximateValue() < ceiling - tolerance) {
                warnings.add("chapter " + chapter.number().display() + " arrived below stored maximum "
                    + storedMax.get().display());
            }
        }
        return warnings;
    }

    private static boolean differs(StoredChapter existing, NormalizedChapter chapter) {
        return !Objects.equals(existing.source().chapterTitle(), chapter.title())
            || !Objects.equals(existing.source().sourceChapterUrl(), chapter.url())
            || !Objects.equals(existing.source().sourceChapterId(), chapter.sourceChapterId());
    }

    private static boolean isMonotonic(List<ChapterNumber> numbers) {
        boolean ascending = true;
        boolean descending = true;
        for (int i = 1; i < numbers.size(); i++) {
            int comparison = numbers.get(i - 1).compareTo(numbers.get(i));
            if (comparison > 0) {
                ascending = false;
            } else if (comparison < 0) {
                descending = false;
            }
        }
        return ascending || descending;
    }

    private static Integer parseVolume(String volume) {
        if (!hasText(volume)) {
            return null;
        }
        Matcher matcher = DIGITS.matcher(volume);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

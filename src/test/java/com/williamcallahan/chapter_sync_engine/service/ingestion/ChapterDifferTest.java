package com.williamcallahan.chapter_sync_engine.service.ingestion;

import com.williamcallahan.chapter_sync_engine.model.ChapterNumber;
import com.williamcallahan.chapter_sync_engine.model.ChapterSource;
import com.williamcallahan.chapter_sync_engine.model.NormalizedChapter;
import com.williamcallahan.chapter_sync_engine.model.RawChapter;
import com.williamcallahan.chapter_sync_engine.model.StoredChapter;
import com.williamcallahan.chapter_sync_engine.util.ChapterNumbers;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.T0;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.chapter;
import static com.williamcallahan.chapter_sync_engine.testutil.SyncTestData.chapters;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChapterDifferTest {

    @Test
    void normalize_dropsInvalidAndDuplicateEntries_firstEntryWins() {
        List<RawChapter> raw = List.of(
            new RawChapter("1", "First", null, null, "a", null),
            new RawChapter("Ch. 1", "Copy of first", null, null, "b", null),
            new RawChapter(" ", " ", null, null, "c", null),
            new RawChapter("2", "Second", null, null, "d", null));

        ChapterDiffer.NormalizedList normalized = ChapterDiffer.normalize(raw);

        assertEquals(2, normalized.chapters().size());
        assertEquals("First", normalized.chapters().get(0).title());
        assertEquals(1, normalized.invalid());
        assertEquals(1, normalized.duplicates());
        assertFalse(normalized.reordered());
    }

    @Test
    void normalize_fallsBackToTitleWhenNumberIsBlank() {
        ChapterDiffer.NormalizedList normalized = ChapterDiffer.normalize(
            List.of(new RawChapter(null, "Chapter 12.5: Interlude", "Vol. 3", null, null, "ftp://nope")));

        NormalizedChapter chapter = normalized.chapters().get(0);
        assertEquals(ChapterNumber.numbered(12, 500), chapter.number());
        assertEquals(3, chapter.volume());
        assertNull(chapter.url(), "non-http urls are dropped");
    }

    @Test
    void normalize_acceptsDescendingOrder_butFlagsShuffledLists() {
        List<RawChapter> descending = new ArrayList<>(chapters(1, 5));
        Collections.reverse(descending);
        ChapterDiffer.NormalizedList fromDescending = ChapterDiffer.normalize(descending);
        assertFalse(fromDescending.reordered());
        assertEquals("1", fromDescending.chapters().get(0).number().display());

        ChapterDiffer.NormalizedList shuffled = ChapterDiffer.normalize(
            List.of(chapter("3"), chapter("1"), chapter("2")));
        assertTrue(shuffled.reordered());
        assertEquals(List.of("1", "2", "3"),
            shuffled.chapters().stream().map(c -> c.number().display()).toList());
    }

    @Test
    void diff_classifiesAddedChangedUnchangedMissingAndRestored() {
        List<StoredChapter> stored = List.of(
            stored("1", "Chapter 1", true),
            stored("2", "Old title", true),
            stored("3", "Chapter 3", false),
            stored("4", "Chapter 4", true));
        List<NormalizedChapter> upstream = ChapterDiffer.normalize(
            List.of(chapter("1"), chapter("2"), chapter("3"), chapter("5"))).chapters();

        ChapterDiff diff = ChapterDiffer.diff(upstream, stored);

        assertEquals(List.of("5"), numbers(diff.added()));
        assertEquals(List.of("2", "3"), numbers(diff.changed()));
        assertEquals(1, diff.unchanged());
        assertEquals(1, diff.restored());
        assertEquals(List.of("4"), diff.missing().stream().map(row -> row.number().display()).toList());
        assertEquals(3, diff.storedAvailable());
        assertEquals(List.of("2", "3", "5"), numbers(diff.writes()));
        assertEquals(1.0 / 3, diff.missingFraction(), 1e-9);
        assertFalse(diff.exceedsMissingThreshold(0.5));
    }

    @Test
    void diff_emptyStore_neverExceedsThreshold() {
        ChapterDiff diff = ChapterDiffer.diff(List.of(), List.of());

        assertEquals(0.0, diff.missingFraction());
        assertFalse(diff.exceedsMissingThreshold(0.0));
    }

    @Test
    void outOfOrderWarnings_flagOnlyChaptersFarBelowTheStoredMaximum() {
        List<StoredChapter> stored = List.of(stored("30", "Chapter 30", true), stored("31", "Chapter 31", false));
        List<NormalizedChapter> added = ChapterDiffer.normalize(
            List.of(chapter("5.5"), chapter("25"), chapter("extra 1"))).chapters();

        List<String> warnings = ChapterDiffer.outOfOrderWarnings(added, stored, 10);

        assertEquals(List.of("chapter 5.5 arrived below stored maximum 30"), warnings);
    }

    private static StoredChapter stored(String number, String title, boolean available) {
        ChapterSource source = ChapterSource.builder()
            .id("cs-" + number)
            .chapterId("ch-" + number)
            .seriesSourceId("src")
            .sourceChapterId("c-" + number)
            .sourceChapterUrl("https://reader.example.com/chapter/" + number)
            .chapterTitle(title)
            .available(available)
            .detectedAt(T0)
            .deletedAt(available ? null : T0)
            .build();
        return new StoredChapter(source, ChapterNumbers.parse(number));
    }

    private static List<String> numbers(List<NormalizedChapter> chapters) {
        return chapters.stream().map(c -> c.number().display()).toList();
    }
}

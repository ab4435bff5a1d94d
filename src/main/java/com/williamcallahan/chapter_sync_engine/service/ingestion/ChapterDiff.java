package com.williamcallahan.chapter_sync_engine.service.ingestion;

import com.williamcallahan.chapter_sync_engine.model.NormalizedChapter;
import com.williamcallahan.chapter_sync_engine.model.StoredChapter;

import java.util.ArrayList;
import java.util.List;

/**
 * Difference between an upstream chapter list and the stored availability rows of one source.
 *
 * @param added           numbers the source never listed before
 * @param changed         listed before with a different title, url or upstream id, or currently tombstoned
 * @param missing         available rows whose number is no longer listed upstream
 * @param storedAvailable available rows before this sync
 */
public record ChapterDiff(
    List<NormalizedChapter> added,
    List<NormalizedChapter> changed,
    List<StoredChapter> missing,
    int unchanged,
    int restored,
    int storedAvailable
) {

    public ChapterDiff {
        added = List.copyOf(added);
        changed = List.copyOf(changed);
        missing = List.copyOf(missing);
    }

    /**
     * Chapters that need a write, in ascending number order.
     */
    public List<NormalizedChapter> writes() {
        List<NormalizedChapter> writes = new ArrayList<>(added.size() + changed.size());
        writes.addAll(added);
        writes.addAll(changed);
        writes.sort((a, b) -> a.number().compareTo(b.number()));
        return writes;
    }

    public double missingFraction() {
        return storedAvailable == 0 ? 0.0 : (double) missing.size() / storedAvailable;
    }

    /**
     * More than {@code threshold} of the stored chapters vanished at once.
     */
    public boolean exceedsMissingThreshold(double threshold) {
        return storedAvailable > 0 && missingFraction() > threshold;
    }
}

package com.williamcallahan.chapter_sync_engine.model;

/**
 * A chapter source row joined with the number of its logical chapter.
 */
public record StoredChapter(ChapterSource source, ChapterNumber number) {

    public boolean isAvailable() {
        return source.available() && source.deletedAt() == null;
    }
}

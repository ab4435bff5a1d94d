package com.williamcallahan.chapter_sync_engine.model;

import java.util.List;

public record ChapterList(List<RawChapter> chapters) {

    public ChapterList {
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }

    public static ChapterList empty() {
        return new ChapterList(List.of());
    }

    public int size() {
        return chapters.size();
    }

    public boolean isEmpty() {
        return chapters.isEmpty();
    }
}

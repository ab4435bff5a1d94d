/**
 * Sort band of a chapter number
 *
 * Features:
 * - Bands sort in declaration order, so a prologue precedes every numbered chapter
 *   and epilogues and afterwords follow every extra
 * - Each special band owns the tokens that select it
 * - UNNUMBERED holds entries whose number could not be parsed
 */

package com.williamcallahan.chapter_sync_engine.types;

import java.util.List;

public enum ChapterBand {
    UNNUMBERED(List.of()),
    PROLOGUE(List.of("prologue", "prolog")),
    ONESHOT(List.of("oneshot", "one-shot", "one shot")),
    NUMBERED(List.of()),
    EXTRA(List.of("extra", "extras")),
    BONUS(List.of("bonus")),
    SIDE_STORY(List.of("side story", "side-story", "sidestory")),
    OMAKE(List.of("omake")),
    EPILOGUE(List.of("epilogue")),
    AFTERWORD(List.of("afterword"));

    private final List<String> tokens;

    ChapterBand(List<String> tokens) {
        this.tokens = tokens;
    }

    public List<String> tokens() {
        return tokens;
    }

    public boolean isSpecial() {
        return !tokens.isEmpty();
    }

    public String label() {
        return tokens.isEmpty() ? name().toLowerCase() : tokens.get(0);
    }
}

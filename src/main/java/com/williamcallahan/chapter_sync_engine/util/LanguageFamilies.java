package com.williamcallahan.chapter_sync_engine.util;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Groups language codes and names into families so "ja", "jp" and "Japanese" compare equal.
 * Unknown or missing languages are compatible with everything.
 */
public final class LanguageFamilies {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, List<String>> FAMILIES = Map.of(
        "japanese", List.of("ja", "jp", "japanese"),
        "korean", List.of("ko", "kr", "korean"),
        "chinese", List.of("zh", "cn", "zh-cn", "zh-tw", "zh-hk", "chinese", "mandarin"),
        "english", List.of("en", "en-us", "en-gb", "english")
    );

    private LanguageFamilies() {
    }

    public static String familyOf(String language) {
        if (language == null || language.isBlank()) {
            return UNKNOWN;
        }
        String normalized = language.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Map.Entry<String, List<String>> family : FAMILIES.entrySet()) {
            if (family.getValue().contains(normalized)) {
                return family.getKey();
            }
        }
        return normalized;
    }

    public static boolean areCompatible(String languageA, String languageB) {
        String familyA = familyOf(languageA);
        String familyB = familyOf(languageB);
        if (UNKNOWN.equals(familyA) || UNKNOWN.equals(familyB)) {
            return true;
        }
        return familyA.equals(familyB);
    }
}

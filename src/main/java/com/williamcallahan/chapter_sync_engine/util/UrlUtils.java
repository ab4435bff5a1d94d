package com.williamcallahan.chapter_sync_engine.util;

import org.springframework.lang.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * URL normalization and hashing for source and chapter links.
 * <p>
 * Two URLs that differ only by a {@code www.} prefix, host case, trailing slashes,
 * tracking parameters or fragment normalize to the same string and hash.
 */
public final class UrlUtils {

    private static final Set<String> TRACKING_PARAMS = Set.of(
        "utm_source", "utm_medium", "utm_campaign", "utm_content", "utm_term",
        "ref", "fbclid", "gclid"
    );

    private UrlUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a URL is absolute http(s).
     *
     * @param url URL to validate
     * @return trimmed URL, or null if invalid
     */
    @Nullable
    public static String validateHttpUrl(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
                return null;
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                return null;
            }
            return uri.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Normalizes a URL for comparison and hashing.
     * <pre>
     * normalizeSourceUrl("https://WWW.Example.com/Series/12/?utm_source=x#top") → "https://example.com/Series/12"
     * </pre>
     * Path case is preserved. Unparseable input is trimmed and lower-cased.
     *
     * @param url URL to normalize (may be null)
     * @return normalized URL, or null if input was null/blank
     */
    @Nullable
    public static String normalizeSourceUrl(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return trimmed.toLowerCase(Locale.ROOT);
            }
            StringBuilder normalized = new StringBuilder();
            normalized.append(uri.getScheme().toLowerCase(Locale.ROOT)).append("://");
            String host = uri.getHost().toLowerCase(Locale.ROOT);
            normalized.append(host.startsWith("www.") ? host.substring(4) : host);
            if (uri.getPort() != -1) {
                normalized.append(':').append(uri.getPort());
            }

            String path = uri.getRawPath();
            if (path != null) {
                String stripped = stripTrailingSlashes(path);
                if (!stripped.isEmpty()) {
                    normalized.append(stripped);
                }
            }

            String query = cleanQuery(uri.getRawQuery());
            if (!query.isEmpty()) {
                normalized.append('?').append(query);
            }
            return normalized.toString();
        } catch (URISyntaxException e) {
            return trimmed.toLowerCase(Locale.ROOT);
        }
    }

    /**
     * SHA-256 hex digest of the normalized URL.
     *
     * @param url URL to hash
     * @return 64 character lower-case hex digest, or null when the URL is null/blank
     */
    @Nullable
    public static String hashSourceUrl(@Nullable String url) {
        String normalized = normalizeSourceUrl(url);
        if (normalized == null) {
            return null;
        }
        return sha256Hex(normalized);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }

    private static String cleanQuery(@Nullable String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            if (!TRACKING_PARAMS.contains(key.toLowerCase(Locale.ROOT))) {
                kept.add(pair);
            }
        }
        return String.join("&", kept);
    }
}

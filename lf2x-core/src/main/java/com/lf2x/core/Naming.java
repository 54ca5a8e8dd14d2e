package com.lf2x.core;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/** Names for generated artifacts (packages, directories, environment variables). */
public final class Naming {
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9_]");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_+");

    private Naming() {}

    /**
     * Lower-cases, maps anything outside {@code [a-z0-9_]} to underscores, collapses runs and trims them.
     * Returns {@code fallback} when nothing is left.
     */
    public static String slugify(String value, String fallback) {
        Objects.requireNonNull(fallback, "fallback");
        if (value == null) return fallback;
        String cleaned = value.strip().toLowerCase(Locale.ROOT).replace(' ', '_').replace('/', '_');
        cleaned = NON_SLUG.matcher(cleaned).replaceAll("_");
        cleaned = UNDERSCORE_RUN.matcher(cleaned).replaceAll("_");
        cleaned = trimUnderscores(cleaned);
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    private static String trimUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') start++;
        while (end > start && value.charAt(end - 1) == '_') end--;
        return value.substring(start, end);
    }
}

package com.mimecast.phishguard.analysis;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text normalizer used before keyword and pattern matching.
 *
 * <p>Replaces markup tags with a space, collapses whitespace runs, trims and lower-cases.
 * <br>Normalizing twice yields the same result as normalizing once.
 */
public final class MessageNormalizer {

    /**
     * Anything shaped like a tag.
     */
    static final Pattern TAG_PATTERN = Pattern.compile("<[^>]+>");

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private MessageNormalizer() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Normalizes text.
     *
     * @param text Text, may be null.
     * @return Normalized text, never null.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String cleaned = TAG_PATTERN.matcher(text).replaceAll(" ");
        cleaned = WHITESPACE_PATTERN.matcher(cleaned).replaceAll(" ").trim();
        return cleaned.toLowerCase(Locale.ROOT);
    }
}

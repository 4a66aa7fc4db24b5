package com.newsvault.backend.dedup;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes titles for the secondary duplicate match.
 */
public final class TitleNormalizer {

    static final int MIN_MATCHABLE_LENGTH = 3;

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TitleNormalizer() {
    }

    /**
     * NFKC, lower case, punctuation removed, whitespace collapsed.
     * Returns null when the result is too short to identify an article.
     */
    public static String normalize(String title) {
        if (title == null) return null;
        String normalized = Normalizer.normalize(title, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        normalized = NON_WORD.matcher(normalized).replaceAll("");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ").trim();
        return normalized.length() < MIN_MATCHABLE_LENGTH ? null : normalized;
    }
}

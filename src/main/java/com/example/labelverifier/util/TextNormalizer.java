package com.example.labelverifier.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Folds OCR output into a canonical form for comparison: lower case, whitespace
 * runs collapsed into a single space, no leading or trailing whitespace.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}

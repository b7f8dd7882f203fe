package com.hockeyfeed.backend.scraping.extract;

import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\u00A0]+");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    private TextNormalizer() {
    }

    /**
     * Collapse runs of spaces/tabs to one space and 3+ newlines to a blank line, then trim.
     * Returns null for null input.
     */
    public static String normalize(String text) {
        if (text == null) {
            return null;
        }
        String result = HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ");
        result = EXCESS_NEWLINES.matcher(result).replaceAll("\n\n");
        return result.trim();
    }
}

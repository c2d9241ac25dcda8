package com.placementrag.ingest;

import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Cntrl}]+");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{N}_\\s.,!?-]");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(text).replaceAll(" ");
        String cleaned = DISALLOWED.matcher(collapsed).replaceAll("");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
    }
}

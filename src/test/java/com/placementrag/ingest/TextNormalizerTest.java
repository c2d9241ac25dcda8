package com.placementrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    void shouldCollapseWhitespaceAndControlCharacters() {
        assertEquals("two pointers then binary search",
                TextNormalizer.normalize("  two\tpointers\n\nthen \u0007 binary   search \r\n"));
    }

    @Test
    void shouldDropSymbolsButKeepBasicPunctuation() {
        assertEquals("Use a hashmap, then sort! Done? yes - mostly.",
                TextNormalizer.normalize("Use a hash#map, then sort! Done? yes - mostly. $$$"));
    }

    @Test
    void shouldNotLeaveDoubleSpacesWhereSymbolsWereRemoved() {
        assertEquals("arrays strings", TextNormalizer.normalize("arrays @ strings"));
    }

    @Test
    void shouldKeepNonAsciiLetters() {
        assertEquals("Résumé naïve_approach 42", TextNormalizer.normalize("Résumé naïve_approach 42"));
    }

    @Test
    void shouldTurnNullAndBlankIntoEmptyString() {
        assertEquals("", TextNormalizer.normalize(null));
        assertEquals("", TextNormalizer.normalize(" \n\t "));
    }
}

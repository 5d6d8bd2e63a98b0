package com.ftsquery.text;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StopWordsTest {

    @Test
    void testStandardListSizeAndOrder() {
        assertEquals(154, StopWords.STANDARD.size());
        assertEquals("$", StopWords.STANDARD.get(0));
        assertEquals("your", StopWords.STANDARD.get(StopWords.STANDARD.size() - 1));
    }

    @Test
    void testStandardLookupIsCaseSensitive() {
        Set<String> words = StopWords.of(true, List.of());

        assertTrue(words.contains("the"));
        assertTrue(words.contains("A"));
        assertFalse(words.contains("a"));
        assertFalse(words.contains("The"));
    }

    @Test
    void testMergeKeepsInsertionOrder() {
        Set<String> words = StopWords.of(true, List.of("zebra", "the"));

        assertEquals(155, words.size());
        assertEquals("$", words.iterator().next());
        assertEquals("zebra", List.copyOf(words).get(154));
    }

    @Test
    void testMergeWithoutStandard() {
        Set<String> words = StopWords.of(false, null);

        assertTrue(words.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> words.add("x"));
    }
}

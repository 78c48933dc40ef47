package com.promptvault.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TagNormalizer.
 */
class TagNormalizerTest {

    @Test
    void testNormalizeDeduplicatesCaseInsensitively() {
        assertEquals(List.of("A", "b"), TagNormalizer.normalize(List.of("A", " a ", "b")));
    }

    @Test
    void testNormalizeKeepsFirstSpellingAndOrder() {
        List<String> normalized = TagNormalizer.normalize(List.of("writing", "AI", "Writing", "ai", "  code "));
        assertEquals(List.of("writing", "AI", "code"), normalized);
    }

    @Test
    void testNormalizeDropsBlankAndNullEntries() {
        List<String> normalized = TagNormalizer.normalize(Arrays.asList("", "   ", null, "x"));
        assertEquals(List.of("x"), normalized);
    }

    @Test
    void testNormalizeStripsUnicodeWhitespace() {
        assertEquals(List.of("ai"), TagNormalizer.normalize(Arrays.asList("ai", "ai\u3000", "\u3000")));
        assertTrue(TagNormalizer.containsTag(List.of("\u3000ml"), "ML\u3000"));
    }

    @Test
    void testNormalizeIsIdempotent() {
        List<String> raw = List.of(" Email ", "email", "SALES", "sales ", "", "Follow-up");
        List<String> once = TagNormalizer.normalize(raw);
        assertEquals(once, TagNormalizer.normalize(once));
    }

    @Test
    void testNormalizeNullGivesEmptyList() {
        assertTrue(TagNormalizer.normalize(null).isEmpty());
    }

    @Test
    void testEncodeDecodeRoundTrip() {
        List<String> tags = List.of("ai", "写作", "quote\"d");
        String encoded = TagNormalizer.encode(tags);

        assertTrue(encoded.startsWith("["));
        assertTrue(encoded.contains("\"ai\""));
        assertEquals(tags, TagNormalizer.decode(encoded));
    }

    @Test
    void testDecodeUnreadableValueGivesEmptyList() {
        assertTrue(TagNormalizer.decode("not json").isEmpty());
        assertTrue(TagNormalizer.decode("").isEmpty());
        assertTrue(TagNormalizer.decode(null).isEmpty());
    }

    @Test
    void testContainsTagMatchesWholeTagsOnly() {
        List<String> tags = List.of("ai-ml", "Writing");

        assertFalse(TagNormalizer.containsTag(tags, "ai"));
        assertTrue(TagNormalizer.containsTag(tags, "ai-ml"));
        assertTrue(TagNormalizer.containsTag(tags, " writing "));
        assertFalse(TagNormalizer.containsTag(tags, ""));
    }
}

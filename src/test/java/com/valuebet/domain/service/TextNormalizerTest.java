package com.valuebet.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TextNormalizer.
 */
class TextNormalizerTest {

    @Test
    void testNormalize() {
        assertEquals("oneills", TextNormalizer.normalize("  O'Neill's "));
        assertEquals("oneill", TextNormalizer.normalize("O’Neill"));

        // Hyphens are kept
        assertEquals("paris saint-germain", TextNormalizer.normalize("Paris Saint-Germain"));

        assertEquals("", TextNormalizer.normalize(null));
    }

    @Test
    void testFullyNormalize() {
        assertEquals("ajax and lazio", TextNormalizer.fullyNormalize("Ajax & Lazio!!!"));
        assertEquals("man utd - chelsea", TextNormalizer.fullyNormalize("Man Utd – Chelsea"));
        assertEquals("over 2.5 goals", TextNormalizer.fullyNormalize("  over   2.5 goals? "));

        // Only standalone ampersands become "and"
        assertEquals("bh", TextNormalizer.fullyNormalize("B&H"));
    }

    @Test
    void testCleanToken() {
        assertEquals("chelsea", TextNormalizer.cleanToken("(chelsea),"));
        assertEquals("2-1", TextNormalizer.cleanToken("2-1!"));
        assertEquals("", TextNormalizer.cleanToken("!!"));
    }

    @Test
    void testTokens() {
        assertArrayEquals(new String[] {"a", "b"}, TextNormalizer.tokens("  a   b "));
        assertEquals(0, TextNormalizer.tokens("   ").length);
        assertEquals(0, TextNormalizer.tokens(null).length);
    }
}

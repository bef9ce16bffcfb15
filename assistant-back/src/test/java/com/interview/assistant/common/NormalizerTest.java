package com.interview.assistant.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Normalizer Tests")
class NormalizerTest {

    private final Normalizer normalizer = new Normalizer();

    @Test
    @DisplayName("api key loses whitespace and one pair of surrounding quotes")
    void normalizesApiKey() {
        assertEquals("gsk_abc", normalizer.normalizeApiKey("  gsk_abc \n"));
        assertEquals("gsk_abc", normalizer.normalizeApiKey("\"gsk_abc\""));
        assertEquals("gsk_abc", normalizer.normalizeApiKey(" ' gsk_abc ' "));
        assertEquals("'gsk_abc\"", normalizer.normalizeApiKey("'gsk_abc\""));
        assertEquals("", normalizer.normalizeApiKey(null));
    }

    @Test
    @DisplayName("placeholder keys are recognised regardless of case")
    void detectsPlaceholders() {
        assertTrue(normalizer.isPlaceholderKey("REPLACE_WITH_REAL_KEY"));
        assertTrue(normalizer.isPlaceholderKey("your_groq_api_key_here"));
        assertFalse(normalizer.isPlaceholderKey("gsk_real"));
    }

    @Test
    @DisplayName("trimToEmpty keeps case")
    void trimKeepsCase() {
        assertEquals("Alice", normalizer.trimToEmpty("  Alice "));
        assertEquals("", normalizer.trimToEmpty(null));
    }
}

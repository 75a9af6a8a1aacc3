package com.agentic.customergraph.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SensitiveDataSanitizerTest {

    @Test
    @DisplayName("Redacts bearer tokens and secret assignments")
    void redactsCredentials() {
        String sanitized = SensitiveDataSanitizer.sanitize(
            "401 from server: Authorization Bearer sk-abc.def123 rejected, api_key=xyz789; password: hunter2");

        assertFalse(sanitized.contains("sk-abc.def123"));
        assertFalse(sanitized.contains("xyz789"));
        assertFalse(sanitized.contains("hunter2"));
        assertTrue(sanitized.contains("Bearer [REDACTED]"));
        assertTrue(sanitized.contains("api_key=[REDACTED]"));
    }

    @Test
    @DisplayName("Redacts e-mail addresses and card-like numbers")
    void redactsPersonalData() {
        String sanitized = SensitiveDataSanitizer.sanitize("customer tim@example.com paid with 4111 1111 1111 1111");

        assertEquals("customer [REDACTED] paid with [REDACTED]", sanitized);
    }

    @Test
    @DisplayName("Flattens line breaks and caps the length")
    void flattensAndCaps() {
        assertEquals("line one line two", SensitiveDataSanitizer.sanitize("line one\r\nline two"));

        String sanitized = SensitiveDataSanitizer.sanitize("x".repeat(SensitiveDataSanitizer.MAX_LENGTH + 50));
        assertEquals(SensitiveDataSanitizer.MAX_LENGTH + 3, sanitized.length());
        assertTrue(sanitized.endsWith("..."));
    }

    @Test
    @DisplayName("Leaves ordinary error text and extraction ids alone")
    void keepsOrdinaryText() {
        String message = "Snapshot extraction_1714557600_0a1b2c3d is invalid: edge edge_12ab has no evidence";

        assertEquals(message, SensitiveDataSanitizer.sanitize(message));
        assertEquals("null", SensitiveDataSanitizer.sanitize(null));
    }
}

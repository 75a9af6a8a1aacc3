package com.agentic.customergraph.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageKeysTest {

    @Test
    @DisplayName("Builds extraction and manifest keys")
    void keys() {
        assertEquals("customer-graphs/acme/extractions/extraction_0000000001_00000001/nodes.json",
            StorageKeys.extractionKey("acme", "extraction_0000000001_00000001", StorageKeys.NODES_FILE));
        assertEquals("customer-graphs/acme/manifest.json", StorageKeys.customerManifestKey("acme"));
    }

    @Test
    @DisplayName("Sanitizes unsafe key components")
    void sanitize() {
        assertEquals("tim_wolff", StorageKeys.sanitize("tim wolff"));
        assertEquals("etc_passwd", StorageKeys.sanitize("/etc/passwd"));
        assertEquals("unknown", StorageKeys.sanitize(".."));
        assertEquals("unknown", StorageKeys.sanitize("///"));
        assertEquals("unknown", StorageKeys.sanitize(null));
        assertEquals(StorageKeys.MAX_COMPONENT_LENGTH, StorageKeys.sanitize("a".repeat(80)).length());
    }

    @Test
    @DisplayName("Safe ids are used as key components unchanged")
    void safeComponent() {
        assertEquals("acme_1", StorageKeys.component("acme_1"));
        assertEquals("extraction_0000000001_00000001", StorageKeys.component("extraction_0000000001_00000001"));
    }

    @Test
    @DisplayName("Unsafe ids get a digest suffix so distinct ids never share a key")
    void unsafeComponent() {
        String spaced = StorageKeys.component("acme 1");

        assertTrue(spaced.startsWith("acme_1-"));
        assertEquals("acme_1".length() + 1 + StorageKeys.DIGEST_LENGTH, spaced.length());
        assertNotEquals(StorageKeys.component("acme_1"), spaced);
        assertNotEquals(StorageKeys.component("acme/1"), spaced);
        assertEquals(spaced, StorageKeys.component("acme 1"));

        String first = StorageKeys.component("a".repeat(60) + "1");
        String second = StorageKeys.component("a".repeat(60) + "2");
        assertNotEquals(first, second);
        assertEquals(StorageKeys.MAX_COMPONENT_LENGTH, first.length());
    }
}

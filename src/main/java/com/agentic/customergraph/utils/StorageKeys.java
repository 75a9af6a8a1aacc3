package com.agentic.customergraph.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Builds object-store keys for customer graphs.
 */
public final class StorageKeys {

    public static final String ROOT_PREFIX = "customer-graphs";
    public static final String EXTRACTIONS = "extractions";
    public static final String NODES_FILE = "nodes.json";
    public static final String EDGES_FILE = "edges.json";
    public static final String METADATA_FILE = "metadata.json";
    public static final String MANIFEST_FILE = "manifest.json";

    static final int MAX_COMPONENT_LENGTH = 50;
    static final int DIGEST_LENGTH = 8;
    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9\\-_.]");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private StorageKeys() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Makes a value safe for use as one key component: unsafe characters become
     * underscores, surrounding underscores are trimmed, the result is capped at
     * 50 characters and never empty.
     */
    @NotNull
    public static String sanitize(@Nullable String component) {
        if (component == null) {
            return "unknown";
        }
        String safe = UNSAFE.matcher(component).replaceAll("_");
        safe = EDGE_UNDERSCORES.matcher(safe).replaceAll("");
        if (safe.length() > MAX_COMPONENT_LENGTH) {
            safe = safe.substring(0, MAX_COMPONENT_LENGTH);
        }
        if (safe.isEmpty() || ".".equals(safe) || "..".equals(safe)) {
            return "unknown";
        }
        return safe;
    }

    /**
     * Key component for a customer or extraction id. Ids that are already safe
     * are used as they are; any other id is sanitized and suffixed with a short
     * SHA-256 digest of the raw value, so two distinct ids never share a key.
     */
    @NotNull
    public static String component(@NotNull String id) {
        String safe = sanitize(id);
        if (safe.equals(id)) {
            return safe;
        }
        int maxBase = MAX_COMPONENT_LENGTH - DIGEST_LENGTH - 1;
        String base = safe.length() > maxBase ? safe.substring(0, maxBase) : safe;
        return base + "-" + digest(id).substring(0, DIGEST_LENGTH);
    }

    /**
     * {@code customer-graphs/{customer}/extractions/{extraction}/{file}}
     */
    @NotNull
    public static String extractionKey(@NotNull String customerId, @NotNull String extractionId, @NotNull String file) {
        return ROOT_PREFIX + "/" + component(customerId) + "/" + EXTRACTIONS + "/" + component(extractionId) + "/" + file;
    }

    @NotNull
    public static String customerManifestKey(@NotNull String customerId) {
        return ROOT_PREFIX + "/" + component(customerId) + "/" + MANIFEST_FILE;
    }

    private static String digest(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

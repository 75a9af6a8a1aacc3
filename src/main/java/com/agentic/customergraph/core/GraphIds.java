package com.agentic.customergraph.core;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Content-derived identifiers for graph elements and extractions.
 *
 * <p>Vertex and edge ids hash the customer id together with the element's
 * identifying content, so the same entity extracted twice for one customer
 * gets the same id while two customers never share an id.</p>
 */
public final class GraphIds {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int HASH_LENGTH = 16;
    private static final int SUFFIX_LENGTH = 8;

    private GraphIds() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Normalises a label for identity comparison: trimmed, lower-cased, inner
     * whitespace collapsed to single spaces.
     */
    @NotNull
    public static String normalizeLabel(@NotNull String label) {
        return WHITESPACE.matcher(label.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    @NotNull
    public static String entityId(@NotNull String customerId, @NotNull EntityType type, @NotNull String label) {
        return "node_" + sha256(customerId + ":" + type.name() + ":" + normalizeLabel(label));
    }

    @NotNull
    public static String relationshipId(
            @NotNull String customerId,
            @NotNull String sourceId,
            @NotNull String targetId,
            @NotNull RelationshipType type) {
        return "edge_" + sha256(customerId + ":" + sourceId + ":" + targetId + ":" + type.name());
    }

    /**
     * Generates an extraction id of the form {@code extraction_{epochSeconds}_{suffix}}.
     * The zero-padded timestamp prefix keeps lexical order equal to creation order.
     */
    @NotNull
    public static String newExtractionId(@NotNull Instant timestamp) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, SUFFIX_LENGTH);
        return String.format("extraction_%010d_%s", timestamp.getEpochSecond(), suffix);
    }

    @NotNull
    static String sha256(@NotNull String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.agentic.customergraph.core;

/**
 * Edge types of a customer knowledge graph.
 *
 * <p>{@link #RELATES_TO} is the only generic type; every other type comes from a
 * deterministic domain rule and counts as a meaningful relationship.</p>
 */
public enum RelationshipType {
    SPECIALIZES_IN(false),
    DEMONSTRATES(false),
    INFLUENCES(false),
    RELATES_TO(true);

    public static final int COUNT = values().length;

    private final boolean generic;

    RelationshipType(boolean generic) {
        this.generic = generic;
    }

    public boolean isGeneric() {
        return generic;
    }
}

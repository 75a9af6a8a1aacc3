package com.agentic.customergraph.core;

/**
 * Node types of a customer knowledge graph.
 */
public enum EntityType {
    PERSON,
    SKILL,
    CONCEPT,
    BEHAVIORAL_PATTERN,
    PERSONALITY_TRAIT,
    NEED;

    /**
     * Number of distinct entity types, used to normalise type diversity.
     */
    public static final int COUNT = values().length;
}

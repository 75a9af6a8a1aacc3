package com.agentic.customergraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

/**
 * Upstream analysis that produced an entity or relationship.
 */
public enum AnalysisSource {
    FILE_ANALYSIS("file-analysis"),
    NEEDS_ANALYSIS("needs-analysis"),
    RULE_ENGINE("rule-engine"),
    SIMILARITY("similarity");

    private final String wireName;

    AnalysisSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @NotNull
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AnalysisSource fromWireName(@NotNull String value) {
        for (AnalysisSource source : values()) {
            if (source.wireName.equalsIgnoreCase(value) || source.name().equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown analysis source: " + value);
    }
}

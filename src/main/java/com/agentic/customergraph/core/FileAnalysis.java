package com.agentic.customergraph.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Output of the file-level classification step: content type, the named
 * subject and the descriptive phrases pulled from the document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileAnalysis(
    @JsonProperty("customer_name")
    @Nullable String customerName,

    @JsonProperty("content_type")
    @Nullable String contentType,

    /** Analyzer confidence, applied unmodified to entities derived from this analysis. */
    @Nullable Double confidence,

    @JsonProperty("key_insights")
    @Nullable KeyInsights keyInsights
) {

    public static FileAnalysis empty() {
        return new FileAnalysis(null, null, null, null);
    }

    public KeyInsights insights() {
        return keyInsights != null ? keyInsights : KeyInsights.EMPTY;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record KeyInsights(
        @JsonProperty("skills_and_competencies")
        @Nullable List<String> skillsAndCompetencies,

        @JsonProperty("main_themes")
        @Nullable List<String> mainThemes,

        @JsonProperty("goals_and_aspirations")
        @Nullable List<String> goalsAndAspirations
    ) {
        static final KeyInsights EMPTY = new KeyInsights(null, null, null);

        public List<String> skills() {
            return skillsAndCompetencies != null ? skillsAndCompetencies : List.of();
        }

        public List<String> themes() {
            return mainThemes != null ? mainThemes : List.of();
        }

        public List<String> goals() {
            return goalsAndAspirations != null ? goalsAndAspirations : List.of();
        }
    }
}

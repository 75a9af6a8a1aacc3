package com.agentic.customergraph.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the psychological needs scoring step.
 *
 * <p>{@code needsScores} maps a need name (certainty, variety, significance,
 * connection, growth, contribution) to its score. The score says how strongly
 * the need shows; {@code confidenceScore} says how certain the analysis is.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NeedsAnalysis(
    @JsonProperty("subject_name")
    @Nullable String subjectName,

    @JsonProperty("confidence_score")
    @Nullable Double confidenceScore,

    @JsonProperty("needs_scores")
    @Nullable Map<String, Double> needsScores,

    @JsonProperty("behavioral_patterns")
    @Nullable List<String> behavioralPatterns,

    @JsonProperty("personality_traits")
    @Nullable List<String> personalityTraits,

    @JsonProperty("life_themes")
    @Nullable List<String> lifeThemes
) {

    public static NeedsAnalysis empty() {
        return new NeedsAnalysis(null, null, null, null, null, null);
    }

    /**
     * Scores in insertion order, never null.
     */
    public Map<String, Double> scores() {
        return needsScores != null ? new LinkedHashMap<>(needsScores) : Map.of();
    }

    public List<String> patterns() {
        return behavioralPatterns != null ? behavioralPatterns : List.of();
    }

    public List<String> traits() {
        return personalityTraits != null ? personalityTraits : List.of();
    }

    public List<String> themes() {
        return lifeThemes != null ? lifeThemes : List.of();
    }
}

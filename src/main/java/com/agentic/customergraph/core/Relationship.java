package com.agentic.customergraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A directed, typed edge between two entities of the same extraction.
 *
 * <p>A relationship is only valid when it carries at least one evidence
 * snippet; {@link #hasEvidence()} is checked by the extractor and again by the
 * assembler before anything is persisted.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Relationship {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("source_id")
    @NotNull
    private final String sourceId;

    @JsonProperty("target_id")
    @NotNull
    private final String targetId;

    @JsonProperty("type")
    @NotNull
    private final RelationshipType type;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("evidence")
    @NotNull
    private final List<String> evidence;

    @JsonProperty("reasoning")
    @NotNull
    private final String reasoning;

    @JsonProperty("source")
    @NotNull
    private final AnalysisSource source;

    @JsonProperty("customer_id")
    @NotNull
    private final String customerId;

    @JsonProperty("extraction_id")
    @NotNull
    private final String extractionId;

    @JsonCreator
    public Relationship(
            @JsonProperty("id") @NotNull String id,
            @JsonProperty("source_id") @NotNull String sourceId,
            @JsonProperty("target_id") @NotNull String targetId,
            @JsonProperty("type") @NotNull RelationshipType type,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("evidence") @Nullable List<String> evidence,
            @JsonProperty("reasoning") @Nullable String reasoning,
            @JsonProperty("source") @NotNull AnalysisSource source,
            @JsonProperty("customer_id") @NotNull String customerId,
            @JsonProperty("extraction_id") @NotNull String extractionId) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.targetId = Objects.requireNonNull(targetId, "targetId must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        this.confidence = confidence;
        this.evidence = evidence != null
            ? Collections.unmodifiableList(new ArrayList<>(evidence))
            : Collections.emptyList();
        this.reasoning = reasoning != null ? reasoning : "";
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.customerId = Objects.requireNonNull(customerId, "customerId must not be null");
        this.extractionId = Objects.requireNonNull(extractionId, "extractionId must not be null");
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getSourceId() {
        return sourceId;
    }

    @NotNull
    public String getTargetId() {
        return targetId;
    }

    @NotNull
    public RelationshipType getType() {
        return type;
    }

    public double getConfidence() {
        return confidence;
    }

    @NotNull
    public List<String> getEvidence() {
        return evidence;
    }

    @NotNull
    public String getReasoning() {
        return reasoning;
    }

    @NotNull
    public AnalysisSource getSource() {
        return source;
    }

    @NotNull
    public String getCustomerId() {
        return customerId;
    }

    @NotNull
    public String getExtractionId() {
        return extractionId;
    }

    /**
     * True when at least one non-blank evidence snippet is attached.
     */
    @JsonIgnore
    public boolean hasEvidence() {
        return evidence.stream().anyMatch(snippet -> snippet != null && !snippet.isBlank());
    }

    /**
     * A meaningful relationship has a non-generic type and evidence.
     */
    @JsonIgnore
    public boolean isMeaningful() {
        return !type.isGeneric() && hasEvidence();
    }

    /**
     * Key of the (source, target, type) triple used for deduplication.
     */
    @JsonIgnore
    @NotNull
    public String dedupKey() {
        return sourceId + "|" + targetId + "|" + type.name();
    }

    /**
     * Merges a duplicate edge: keeps the higher confidence (and the reasoning
     * that came with it) and concatenates evidence, dropping repeats.
     */
    public Relationship mergeWith(@NotNull Relationship other) {
        Objects.requireNonNull(other, "other must not be null");
        if (!dedupKey().equals(other.dedupKey())) {
            throw new IllegalArgumentException(
                "Cannot merge relationships with different keys: " + dedupKey() + " vs " + other.dedupKey());
        }
        Set<String> mergedEvidence = new LinkedHashSet<>(this.evidence);
        mergedEvidence.addAll(other.evidence);

        boolean otherWins = other.confidence > this.confidence;
        return new Relationship(
            id, sourceId, targetId, type,
            Math.max(this.confidence, other.confidence),
            new ArrayList<>(mergedEvidence),
            otherWins ? other.reasoning : this.reasoning,
            otherWins ? other.source : this.source,
            customerId, extractionId);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Relationship that = (Relationship) obj;
        return Double.compare(confidence, that.confidence) == 0 &&
               id.equals(that.id) &&
               sourceId.equals(that.sourceId) &&
               targetId.equals(that.targetId) &&
               type == that.type &&
               evidence.equals(that.evidence) &&
               reasoning.equals(that.reasoning) &&
               source == that.source &&
               customerId.equals(that.customerId) &&
               extractionId.equals(that.extractionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceId, targetId, type, confidence, evidence, reasoning, source, customerId, extractionId);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "id='" + id + '\'' +
                ", sourceId='" + sourceId + '\'' +
                ", targetId='" + targetId + '\'' +
                ", type=" + type +
                ", confidence=" + confidence +
                ", evidence=" + evidence.size() +
                '}';
    }

    /**
     * Builder for Relationship instances; derives the id from customer,
     * endpoints and type when none is set.
     */
    public static class Builder {
        private String id;
        private String sourceId;
        private String targetId;
        private RelationshipType type;
        private double confidence;
        private List<String> evidence = new ArrayList<>();
        private String reasoning;
        private AnalysisSource source = AnalysisSource.RULE_ENGINE;
        private String customerId;
        private String extractionId;

        public Builder id(@Nullable String id) {
            this.id = id;
            return this;
        }

        public Builder sourceId(@NotNull String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder targetId(@NotNull String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder type(@NotNull RelationshipType type) {
            this.type = type;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder evidence(@Nullable List<String> evidence) {
            this.evidence = evidence != null ? new ArrayList<>(evidence) : new ArrayList<>();
            return this;
        }

        public Builder addEvidence(@Nullable String snippet) {
            if (snippet != null && !snippet.isBlank() && !evidence.contains(snippet)) {
                evidence.add(snippet);
            }
            return this;
        }

        public Builder reasoning(@Nullable String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder source(@NotNull AnalysisSource source) {
            this.source = source;
            return this;
        }

        public Builder customerId(@NotNull String customerId) {
            this.customerId = customerId;
            return this;
        }

        public Builder extractionId(@NotNull String extractionId) {
            this.extractionId = extractionId;
            return this;
        }

        public Relationship build() {
            Objects.requireNonNull(customerId, "customerId must not be null");
            Objects.requireNonNull(type, "type must not be null");
            String resolvedId = id != null ? id : GraphIds.relationshipId(customerId, sourceId, targetId, type);
            return new Relationship(resolvedId, sourceId, targetId, type, confidence, evidence, reasoning,
                source, customerId, extractionId);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}

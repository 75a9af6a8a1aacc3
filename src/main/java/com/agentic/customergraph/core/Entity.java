package com.agentic.customergraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A typed node of a customer knowledge graph.
 *
 * <p>Instances are immutable. The id is derived from customer, type and the
 * normalised label (see {@link GraphIds#entityId}), so two candidates that
 * describe the same thing collapse into one entity through {@link #mergeWith}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Entity {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("type")
    @NotNull
    private final EntityType type;

    @JsonProperty("label")
    @NotNull
    private final String label;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("sources")
    @NotNull
    private final List<AnalysisSource> sources;

    @JsonProperty("customer_id")
    @NotNull
    private final String customerId;

    @JsonProperty("extraction_id")
    @NotNull
    private final String extractionId;

    @JsonProperty("created_at")
    @NotNull
    private final Instant createdAt;

    @JsonProperty("evidence")
    @NotNull
    private final List<String> evidence;

    @JsonProperty("properties")
    @NotNull
    private final Map<String, Object> properties;

    @JsonCreator
    public Entity(
            @JsonProperty("id") @NotNull String id,
            @JsonProperty("type") @NotNull EntityType type,
            @JsonProperty("label") @NotNull String label,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("sources") @Nullable List<AnalysisSource> sources,
            @JsonProperty("customer_id") @NotNull String customerId,
            @JsonProperty("extraction_id") @NotNull String extractionId,
            @JsonProperty("created_at") @Nullable Instant createdAt,
            @JsonProperty("evidence") @Nullable List<String> evidence,
            @JsonProperty("properties") @Nullable Map<String, Object> properties) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.label = Objects.requireNonNull(label, "label must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        this.confidence = confidence;
        this.sources = sortedSources(sources);
        this.customerId = Objects.requireNonNull(customerId, "customerId must not be null");
        this.extractionId = Objects.requireNonNull(extractionId, "extractionId must not be null");
        this.createdAt = createdAt != null ? createdAt : Instant.EPOCH;
        this.evidence = evidence != null
            ? Collections.unmodifiableList(new ArrayList<>(evidence))
            : Collections.emptyList();
        this.properties = properties != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
            : Collections.emptyMap();
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public EntityType getType() {
        return type;
    }

    @NotNull
    public String getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    @NotNull
    public List<AnalysisSource> getSources() {
        return sources;
    }

    /**
     * Primary attribution: the first source in declaration order.
     */
    @JsonProperty("source")
    @NotNull
    public AnalysisSource getSource() {
        return sources.isEmpty() ? AnalysisSource.RULE_ENGINE : sources.get(0);
    }

    @JsonIgnore
    public boolean hasSource(@NotNull AnalysisSource source) {
        return sources.contains(source);
    }

    @NotNull
    public String getCustomerId() {
        return customerId;
    }

    @NotNull
    public String getExtractionId() {
        return extractionId;
    }

    @NotNull
    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Source text snippets this entity was extracted from.
     */
    @NotNull
    public List<String> getEvidence() {
        return evidence;
    }

    @NotNull
    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * Identity key used for deduplication: type plus normalised label.
     */
    @JsonIgnore
    @NotNull
    public String dedupKey() {
        return type.name() + ":" + GraphIds.normalizeLabel(label);
    }

    public Entity withConfidence(double newConfidence) {
        return toBuilder().confidence(newConfidence).build();
    }

    /**
     * Merges a duplicate candidate into this entity. The result keeps this
     * entity's id and label, the higher confidence, the union of sources and
     * evidence, and the earlier creation time.
     *
     * @param other candidate with the same {@link #dedupKey()}
     * @return merged entity
     * @throws IllegalArgumentException if the candidates describe different entities
     */
    public Entity mergeWith(@NotNull Entity other) {
        Objects.requireNonNull(other, "other must not be null");
        if (!dedupKey().equals(other.dedupKey())) {
            throw new IllegalArgumentException(
                "Cannot merge entities with different keys: " + dedupKey() + " vs " + other.dedupKey());
        }

        Set<AnalysisSource> mergedSources = EnumSet.noneOf(AnalysisSource.class);
        mergedSources.addAll(this.sources);
        mergedSources.addAll(other.sources);

        Set<String> mergedEvidence = new LinkedHashSet<>(this.evidence);
        mergedEvidence.addAll(other.evidence);

        Map<String, Object> mergedProperties = new LinkedHashMap<>(other.properties);
        mergedProperties.putAll(this.properties);

        return toBuilder()
            .confidence(Math.max(this.confidence, other.confidence))
            .sources(new ArrayList<>(mergedSources))
            .createdAt(this.createdAt.isBefore(other.createdAt) ? this.createdAt : other.createdAt)
            .evidence(new ArrayList<>(mergedEvidence))
            .properties(mergedProperties)
            .build();
    }

    private static List<AnalysisSource> sortedSources(@Nullable List<AnalysisSource> sources) {
        if (sources == null || sources.isEmpty()) {
            return Collections.emptyList();
        }
        Set<AnalysisSource> sorted = EnumSet.copyOf(sources);
        return List.copyOf(sorted);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Entity entity = (Entity) obj;
        return Double.compare(confidence, entity.confidence) == 0 &&
               id.equals(entity.id) &&
               type == entity.type &&
               label.equals(entity.label) &&
               sources.equals(entity.sources) &&
               customerId.equals(entity.customerId) &&
               extractionId.equals(entity.extractionId) &&
               createdAt.equals(entity.createdAt) &&
               evidence.equals(entity.evidence) &&
               properties.equals(entity.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, label, confidence, sources, customerId, extractionId, createdAt, evidence, properties);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", label='" + label + '\'' +
                ", confidence=" + confidence +
                ", sources=" + sources +
                ", customerId='" + customerId + '\'' +
                ", extractionId='" + extractionId + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .type(type)
            .label(label)
            .confidence(confidence)
            .sources(sources)
            .customerId(customerId)
            .extractionId(extractionId)
            .createdAt(createdAt)
            .evidence(evidence)
            .properties(properties);
    }

    /**
     * Builder for Entity instances. When no id is set, {@link #build()} derives
     * it from customer, type and label.
     */
    public static class Builder {
        private String id;
        private EntityType type;
        private String label;
        private double confidence;
        private List<AnalysisSource> sources = new ArrayList<>();
        private String customerId;
        private String extractionId;
        private Instant createdAt;
        private List<String> evidence = new ArrayList<>();
        private Map<String, Object> properties = new LinkedHashMap<>();

        public Builder id(@Nullable String id) {
            this.id = id;
            return this;
        }

        public Builder type(@NotNull EntityType type) {
            this.type = type;
            return this;
        }

        public Builder label(@NotNull String label) {
            this.label = label;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder sources(@Nullable List<AnalysisSource> sources) {
            this.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
            return this;
        }

        public Builder source(@NotNull AnalysisSource source) {
            Objects.requireNonNull(source, "source must not be null");
            if (!sources.contains(source)) {
                sources.add(source);
            }
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

        public Builder createdAt(@Nullable Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder evidence(@Nullable List<String> evidence) {
            this.evidence = evidence != null ? new ArrayList<>(evidence) : new ArrayList<>();
            return this;
        }

        public Builder addEvidence(@NotNull String snippet) {
            Objects.requireNonNull(snippet, "snippet must not be null");
            if (!evidence.contains(snippet)) {
                evidence.add(snippet);
            }
            return this;
        }

        public Builder properties(@Nullable Map<String, Object> properties) {
            this.properties = properties != null ? new LinkedHashMap<>(properties) : new LinkedHashMap<>();
            return this;
        }

        public Builder property(@NotNull String key, @NotNull Object value) {
            properties.put(key, value);
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(customerId, "customerId must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(label, "label must not be null");
            String resolvedId = id != null ? id : GraphIds.entityId(customerId, type, label);
            return new Entity(resolvedId, type, label, confidence, sources, customerId, extractionId,
                createdAt, evidence, properties);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}

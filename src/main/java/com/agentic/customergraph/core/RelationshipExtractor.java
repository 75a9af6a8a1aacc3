package com.agentic.customergraph.core;

import com.agentic.customergraph.exception.MissingPrimarySubjectException;
import com.agentic.customergraph.similarity.SimilarityScorer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Infers typed, evidence-backed edges between the entities of one extraction.
 *
 * <ul>
 *   <li>PERSON to SKILL/CONCEPT of file-analysis origin: SPECIALIZES_IN</li>
 *   <li>PERSON to NEED: DEMONSTRATES</li>
 *   <li>NEED to BEHAVIORAL_PATTERN: INFLUENCES, only where {@link NeedBehaviorRules} maps them</li>
 *   <li>SKILL to CONCEPT and BEHAVIORAL_PATTERN to PERSONALITY_TRAIT: RELATES_TO, when the
 *       {@link SimilarityScorer} score exceeds the configured threshold</li>
 * </ul>
 *
 * <p>Evidence is drawn from the snippets attached to the endpoint entities.
 * Candidates without evidence are dropped and counted, never thrown.</p>
 */
public final class RelationshipExtractor {

    private static final Logger logger = LoggerFactory.getLogger(RelationshipExtractor.class);

    private final ExtractionSettings settings;
    private final SimilarityScorer similarityScorer;

    public RelationshipExtractor(@NotNull ExtractionSettings settings, @NotNull SimilarityScorer similarityScorer) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.similarityScorer = Objects.requireNonNull(similarityScorer, "similarityScorer must not be null");
    }

    @NotNull
    public RelationshipExtraction extract(@NotNull List<Entity> entities) {
        Entity person = entities.stream()
            .filter(entity -> entity.getType() == EntityType.PERSON)
            .findFirst()
            .orElseThrow(() -> new MissingPrimarySubjectException(
                entities.isEmpty() ? null : entities.get(0).getCustomerId(),
                entities.isEmpty() ? null : entities.get(0).getExtractionId()));

        Accumulator edges = new Accumulator(person.getCustomerId(), person.getExtractionId());

        for (Entity target : entities) {
            switch (target.getType()) {
                case SKILL, CONCEPT -> {
                    if (target.hasSource(AnalysisSource.FILE_ANALYSIS)) {
                        edges.offer(specializesIn(person, target));
                    }
                }
                case NEED -> edges.offer(demonstrates(person, target));
                default -> {
                    // linked by the rule and similarity passes below
                }
            }
        }

        List<Entity> needs = ofType(entities, EntityType.NEED);
        List<Entity> patterns = ofType(entities, EntityType.BEHAVIORAL_PATTERN);
        for (Entity need : needs) {
            for (Entity pattern : patterns) {
                if (NeedBehaviorRules.drives(need.getLabel(), pattern.getLabel())) {
                    edges.offer(influences(need, pattern));
                }
            }
        }

        relateSimilar(edges, ofType(entities, EntityType.SKILL), ofType(entities, EntityType.CONCEPT));
        relateSimilar(edges, patterns, ofType(entities, EntityType.PERSONALITY_TRAIT));

        RelationshipExtraction result = edges.result();
        logger.debug("Inferred {} relationships for extraction {} ({} without evidence, {} scorer failures)",
            result.relationships().size(), person.getExtractionId(), result.evidenceMissing(), result.scorerFailures());
        return result;
    }

    private Relationship.Builder edge(Entity source, Entity target, RelationshipType type) {
        return Relationship.builder()
            .sourceId(source.getId())
            .targetId(target.getId())
            .type(type)
            .customerId(source.getCustomerId())
            .extractionId(source.getExtractionId());
    }

    private Relationship specializesIn(Entity person, Entity target) {
        return edge(person, target, RelationshipType.SPECIALIZES_IN)
            .confidence(Math.min(person.getConfidence(), target.getConfidence()))
            .evidence(target.getEvidence())
            .reasoning("Primary customer " + person.getLabel() + " shows expertise in " + target.getLabel())
            .source(AnalysisSource.FILE_ANALYSIS)
            .build();
    }

    private Relationship demonstrates(Entity person, Entity need) {
        Object score = need.getProperties().get("score");
        String scoreText = score instanceof Number
            ? String.format(Locale.ROOT, "%.2f", ((Number) score).doubleValue())
            : "n/a";
        return edge(person, need, RelationshipType.DEMONSTRATES)
            .confidence(need.getConfidence())
            .evidence(need.getEvidence())
            .reasoning(person.getLabel() + " shows strong " + need.getLabel() + " need (score: " + scoreText + ")")
            .source(AnalysisSource.NEEDS_ANALYSIS)
            .build();
    }

    private Relationship influences(Entity need, Entity pattern) {
        Relationship.Builder builder = edge(need, pattern, RelationshipType.INFLUENCES)
            .confidence(Math.min(need.getConfidence(), pattern.getConfidence()))
            .reasoning(need.getLabel() + " need drives " + pattern.getLabel() + " behavior")
            .source(AnalysisSource.RULE_ENGINE);
        need.getEvidence().forEach(builder::addEvidence);
        pattern.getEvidence().forEach(builder::addEvidence);
        return builder.build();
    }

    private void relateSimilar(Accumulator edges, List<Entity> left, List<Entity> right) {
        for (Entity a : left) {
            for (Entity b : right) {
                double score;
                try {
                    score = similarityScorer.scoreSimilarity(a, b);
                } catch (RuntimeException e) {
                    logger.warn("Similarity scoring failed for '{}' vs '{}': {}", a.getLabel(), b.getLabel(),
                        e.getMessage());
                    edges.scorerFailures++;
                    continue;
                }
                if (Double.isNaN(score) || score <= settings.similarityThreshold()) {
                    continue;
                }
                double confidence = Math.min(1.0, score);
                Relationship.Builder builder = edge(a, b, RelationshipType.RELATES_TO)
                    .confidence(confidence)
                    .reasoning(String.format(Locale.ROOT, "%s and %s are related (similarity %.2f)",
                        a.getLabel(), b.getLabel(), confidence))
                    .source(AnalysisSource.SIMILARITY);
                a.getEvidence().forEach(builder::addEvidence);
                b.getEvidence().forEach(builder::addEvidence);
                edges.offer(builder.build());
            }
        }
    }

    private static List<Entity> ofType(List<Entity> entities, EntityType type) {
        List<Entity> result = new ArrayList<>();
        for (Entity entity : entities) {
            if (entity.getType() == type) {
                result.add(entity);
            }
        }
        return result;
    }

    /**
     * Deduplicating edge collector that counts evidence rejections.
     */
    private static final class Accumulator {
        private final String customerId;
        private final String extractionId;
        private final Map<String, Relationship> byKey = new LinkedHashMap<>();
        private int evidenceMissing;
        private int scorerFailures;

        Accumulator(String customerId, String extractionId) {
            this.customerId = customerId;
            this.extractionId = extractionId;
        }

        void offer(Relationship candidate) {
            if (!candidate.hasEvidence()) {
                evidenceMissing++;
                logger.debug("Dropping {} edge {} -> {} of extraction {} for customer {}: no evidence",
                    candidate.getType(), candidate.getSourceId(), candidate.getTargetId(), extractionId, customerId);
                return;
            }
            byKey.merge(candidate.dedupKey(), candidate, Relationship::mergeWith);
        }

        RelationshipExtraction result() {
            return new RelationshipExtraction(new ArrayList<>(byKey.values()), evidenceMissing, scorerFailures);
        }
    }
}

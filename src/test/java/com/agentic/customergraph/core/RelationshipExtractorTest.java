package com.agentic.customergraph.core;

import com.agentic.customergraph.exception.MissingPrimarySubjectException;
import com.agentic.customergraph.similarity.LexicalSimilarityScorer;
import com.agentic.customergraph.similarity.NoOpSimilarityScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelationshipExtractorTest {

    private static final String CUSTOMER = "customer-1";
    private static final String EXTRACTION = "extraction_0001700000_abcd1234";

    private final RelationshipExtractor extractor =
        new RelationshipExtractor(ExtractionSettings.defaults(), new NoOpSimilarityScorer());

    private static Entity entity(EntityType type, String label, AnalysisSource source, String... evidence) {
        return Entity.builder()
            .type(type)
            .label(label)
            .confidence(0.8)
            .source(source)
            .customerId(CUSTOMER)
            .extractionId(EXTRACTION)
            .evidence(List.of(evidence))
            .build();
    }

    private static Entity person() {
        return entity(EntityType.PERSON, "Tim Wolff", AnalysisSource.NEEDS_ANALYSIS, "subject_name: Tim Wolff");
    }

    @Nested
    @DisplayName("Rule-based edges")
    class RuleTests {

        @Test
        @DisplayName("PERSON demonstrates each NEED with the need snippet as evidence")
        void demonstratesNeeds() {
            Entity certainty = entity(EntityType.NEED, "certainty", AnalysisSource.NEEDS_ANALYSIS,
                "needs_scores.certainty: 0.80");
            Entity growth = entity(EntityType.NEED, "growth", AnalysisSource.NEEDS_ANALYSIS,
                "needs_scores.growth: 0.60");

            RelationshipExtraction result = extractor.extract(List.of(person(), certainty, growth));

            assertEquals(2, result.relationships().size());
            for (Relationship edge : result.relationships()) {
                assertEquals(RelationshipType.DEMONSTRATES, edge.getType());
                assertEquals(person().getId(), edge.getSourceId());
                assertFalse(edge.getEvidence().isEmpty());
            }
            assertEquals(List.of("needs_scores.certainty: 0.80"), result.relationships().get(0).getEvidence());
            assertEquals(0, result.evidenceMissing());
        }

        @Test
        @DisplayName("Only file-analysis skills and concepts get SPECIALIZES_IN")
        void specializesInFromFileAnalysisOnly() {
            Entity skill = entity(EntityType.SKILL, "Financial planning", AnalysisSource.FILE_ANALYSIS,
                "skills_and_competencies: Financial planning");
            Entity lifeTheme = entity(EntityType.CONCEPT, "Family", AnalysisSource.NEEDS_ANALYSIS,
                "life_themes: Family");

            RelationshipExtraction result = extractor.extract(List.of(person(), skill, lifeTheme));

            assertEquals(1, result.relationships().size());
            Relationship edge = result.relationships().get(0);
            assertEquals(RelationshipType.SPECIALIZES_IN, edge.getType());
            assertEquals(skill.getId(), edge.getTargetId());
            assertEquals(AnalysisSource.FILE_ANALYSIS, edge.getSource());
        }

        @Test
        @DisplayName("NEED influences a pattern only where the lookup table maps them")
        void influencesFollowsLookupTable() {
            Entity certainty = entity(EntityType.NEED, "certainty", AnalysisSource.NEEDS_ANALYSIS,
                "needs_scores.certainty: 0.80");
            Entity planner = entity(EntityType.BEHAVIORAL_PATTERN, "Strategic planner",
                AnalysisSource.NEEDS_ANALYSIS, "behavioral_patterns: Strategic planner");
            Entity explorer = entity(EntityType.BEHAVIORAL_PATTERN, "Adventurous explorer",
                AnalysisSource.NEEDS_ANALYSIS, "behavioral_patterns: Adventurous explorer");

            RelationshipExtraction result = extractor.extract(List.of(person(), certainty, planner, explorer));

            List<Relationship> influences = result.relationships().stream()
                .filter(edge -> edge.getType() == RelationshipType.INFLUENCES)
                .toList();
            assertEquals(1, influences.size());
            assertEquals(planner.getId(), influences.get(0).getTargetId());
            assertEquals(AnalysisSource.RULE_ENGINE, influences.get(0).getSource());
            assertEquals(2, influences.get(0).getEvidence().size(), "cites both endpoint snippets");
        }
    }

    @Nested
    @DisplayName("Evidence")
    class EvidenceTests {

        @Test
        @DisplayName("Candidates without evidence are dropped and counted")
        void dropsEdgesWithoutEvidence() {
            Entity bareSkill = entity(EntityType.SKILL, "Negotiation", AnalysisSource.FILE_ANALYSIS);

            RelationshipExtraction result = extractor.extract(List.of(person(), bareSkill));

            assertTrue(result.relationships().isEmpty());
            assertEquals(1, result.evidenceMissing());
        }

        @Test
        @DisplayName("Every emitted relationship carries at least one snippet")
        void everyEdgeHasEvidence() {
            RelationshipExtractor lexical =
                new RelationshipExtractor(ExtractionSettings.defaults(), new LexicalSimilarityScorer());
            List<Entity> entities = List.of(
                person(),
                entity(EntityType.SKILL, "Financial planning", AnalysisSource.FILE_ANALYSIS, "skill"),
                entity(EntityType.CONCEPT, "Retirement planning", AnalysisSource.FILE_ANALYSIS, "theme"),
                entity(EntityType.BEHAVIORAL_PATTERN, "Cautious planner", AnalysisSource.NEEDS_ANALYSIS, "pattern"),
                entity(EntityType.PERSONALITY_TRAIT, "Analytical", AnalysisSource.NEEDS_ANALYSIS, "trait"));

            RelationshipExtraction result = lexical.extract(entities);

            assertTrue(result.relationships().stream().anyMatch(e -> e.getType() == RelationshipType.RELATES_TO));
            result.relationships().forEach(edge -> assertFalse(edge.getEvidence().isEmpty(), edge.toString()));
        }
    }

    @Nested
    @DisplayName("Similarity")
    class SimilarityTests {

        @Test
        @DisplayName("Scorer failures skip the pair and are counted")
        void scorerFailureIsCounted() {
            RelationshipExtractor failing = new RelationshipExtractor(ExtractionSettings.defaults(),
                (a, b) -> {
                    throw new IllegalStateException("model unavailable");
                });
            List<Entity> entities = List.of(
                person(),
                entity(EntityType.SKILL, "Investing", AnalysisSource.FILE_ANALYSIS, "skill"),
                entity(EntityType.CONCEPT, "Wealth", AnalysisSource.FILE_ANALYSIS, "theme"));

            RelationshipExtraction result = failing.extract(entities);

            assertEquals(1, result.scorerFailures());
            assertEquals(2, result.relationships().size(), "rule edges are still produced");
        }

        @Test
        @DisplayName("A score equal to the threshold does not relate the pair")
        void thresholdIsExclusive() {
            RelationshipExtractor atThreshold = new RelationshipExtractor(ExtractionSettings.defaults(),
                (a, b) -> 0.5);
            List<Entity> entities = List.of(
                person(),
                entity(EntityType.BEHAVIORAL_PATTERN, "Planner", AnalysisSource.NEEDS_ANALYSIS, "pattern"),
                entity(EntityType.PERSONALITY_TRAIT, "Calm", AnalysisSource.NEEDS_ANALYSIS, "trait"));

            assertTrue(atThreshold.extract(entities).relationships().isEmpty());
        }
    }

    @Nested
    @DisplayName("Deduplication")
    class DeduplicationTests {

        private Entity need(double confidence, double score, String... evidence) {
            return Entity.builder()
                .type(EntityType.NEED)
                .label("certainty")
                .confidence(confidence)
                .source(AnalysisSource.NEEDS_ANALYSIS)
                .customerId(CUSTOMER)
                .extractionId(EXTRACTION)
                .evidence(List.of(evidence))
                .property("score", score)
                .build();
        }

        @Test
        @DisplayName("Edges with the same source, target and type merge into one")
        void mergesDuplicateEdges() {
            Entity weaker = need(0.6, 0.4, "needs_scores.certainty: 0.40", "interview: wants guarantees");
            Entity stronger = need(0.9, 0.8, "interview: wants guarantees", "needs_scores.certainty: 0.80");

            List<Relationship> relationships = extractor.extract(List.of(person(), weaker, stronger)).relationships();

            assertEquals(1, relationships.size());
            Relationship merged = relationships.get(0);
            assertEquals(RelationshipType.DEMONSTRATES, merged.getType());
            assertEquals(0.9, merged.getConfidence());
            assertEquals(List.of("needs_scores.certainty: 0.40", "interview: wants guarantees",
                "needs_scores.certainty: 0.80"), merged.getEvidence());
            assertEquals("Tim Wolff shows strong certainty need (score: 0.80)", merged.getReasoning());
        }

        @Test
        @DisplayName("A later, weaker duplicate keeps the stronger edge's reasoning")
        void keepsStrongerReasoning() {
            Entity stronger = need(0.9, 0.8, "needs_scores.certainty: 0.80");
            Entity weaker = need(0.6, 0.4, "needs_scores.certainty: 0.40");

            Relationship merged = extractor.extract(List.of(person(), stronger, weaker)).relationships().get(0);

            assertEquals(0.9, merged.getConfidence());
            assertEquals(List.of("needs_scores.certainty: 0.80", "needs_scores.certainty: 0.40"),
                merged.getEvidence());
            assertEquals("Tim Wolff shows strong certainty need (score: 0.80)", merged.getReasoning());
        }

        @Test
        @DisplayName("Edges with different keys cannot be merged")
        void rejectsDifferentKeys() {
            Entity person = person();
            Entity need = need(0.7, 0.5, "needs_scores.certainty: 0.50");
            Relationship demonstrates = extractor.extract(List.of(person, need)).relationships().get(0);
            Relationship reversed = Relationship.builder()
                .sourceId(need.getId())
                .targetId(person.getId())
                .type(RelationshipType.DEMONSTRATES)
                .confidence(0.7)
                .addEvidence("needs_scores.certainty: 0.50")
                .source(AnalysisSource.NEEDS_ANALYSIS)
                .customerId(CUSTOMER)
                .extractionId(EXTRACTION)
                .build();

            assertThrows(IllegalArgumentException.class, () -> demonstrates.mergeWith(reversed));
        }
    }

    @Test
    @DisplayName("Entity lists without a PERSON are rejected")
    void requiresPerson() {
        Entity need = entity(EntityType.NEED, "growth", AnalysisSource.NEEDS_ANALYSIS, "needs_scores.growth: 0.60");

        assertThrows(MissingPrimarySubjectException.class, () -> extractor.extract(List.of(need)));
    }
}

package com.agentic.customergraph.core;

import com.agentic.customergraph.exception.MissingPrimarySubjectException;
import com.agentic.customergraph.exception.PipelineStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityExtractorTest {

    private static final String CUSTOMER = "customer-1";
    private static final String EXTRACTION = "extraction_0001700000_abcd1234";

    private EntityExtractor extractor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        extractor = new EntityExtractor(ExtractionSettings.defaults(), clock);
    }

    private static Map<String, Double> scores(Object... pairs) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (Double) pairs[i + 1]);
        }
        return map;
    }

    @Nested
    @DisplayName("Primary subject")
    class PrimarySubjectTests {

        @Test
        @DisplayName("Tim Wolff with two needs yields one PERSON and two NEED entities")
        void timWolffScenario() {
            NeedsAnalysis needs = new NeedsAnalysis("Tim Wolff", null,
                scores("certainty", 0.8, "growth", 0.6), null, null, null);

            List<Entity> entities = extractor.extract(CUSTOMER, EXTRACTION, FileAnalysis.empty(), needs);

            assertEquals(3, entities.size());
            assertEquals(EntityType.PERSON, entities.get(0).getType());
            assertEquals("Tim Wolff", entities.get(0).getLabel());
            assertEquals(EntityType.NEED, entities.get(1).getType());
            assertEquals("certainty", entities.get(1).getLabel());
            assertEquals(EntityType.NEED, entities.get(2).getType());
            assertEquals("growth", entities.get(2).getLabel());
            entities.forEach(entity -> assertFalse(entity.getEvidence().isEmpty(),
                "every entity carries its source snippet"));
        }

        @Test
        @DisplayName("Emits exactly one PERSON when both analyses name the subject")
        void onePersonFromBothAnalyses() {
            FileAnalysis file = new FileAnalysis("Tim  Wolff", "interview", 0.9, null);
            NeedsAnalysis needs = new NeedsAnalysis("tim wolff", 0.6, null, null, null, null);

            List<Entity> entities = extractor.extract(CUSTOMER, EXTRACTION, file, needs);

            long persons = entities.stream().filter(e -> e.getType() == EntityType.PERSON).count();
            assertEquals(1, persons);
            Entity person = entities.get(0);
            assertEquals(0.9, person.getConfidence(), 1e-9);
            assertTrue(person.hasSource(AnalysisSource.FILE_ANALYSIS));
            assertTrue(person.hasSource(AnalysisSource.NEEDS_ANALYSIS));
        }

        @Test
        @DisplayName("File analysis name wins over a different needs-analysis name")
        void fileNameWins() {
            FileAnalysis file = new FileAnalysis("Anna Berg", null, null, null);
            NeedsAnalysis needs = new NeedsAnalysis("Someone Else", null, null, null, null, null);

            List<Entity> entities = extractor.extract(CUSTOMER, EXTRACTION, file, needs);

            assertEquals(1, entities.size());
            assertEquals("Anna Berg", entities.get(0).getLabel());
            assertEquals(0.8, entities.get(0).getConfidence(), 1e-9, "default file confidence applies");
        }

        @Test
        @DisplayName("Empty analyses raise MissingPrimarySubject at entity extraction")
        void emptyAnalysesFail() {
            MissingPrimarySubjectException error = assertThrows(MissingPrimarySubjectException.class,
                () -> extractor.extract(CUSTOMER, EXTRACTION, FileAnalysis.empty(), NeedsAnalysis.empty()));

            assertEquals(CUSTOMER, error.getCustomerId());
            assertEquals(EXTRACTION, error.getExtractionId());
            assertEquals(PipelineStage.ENTITY_EXTRACTION, error.getStage());
            assertFalse(error.isRetryable());
        }

        @Test
        @DisplayName("Names longer than four words are not subjects")
        void rejectsSentenceAsName() {
            FileAnalysis file = new FileAnalysis("this is clearly not a name", null, null, null);

            assertThrows(MissingPrimarySubjectException.class,
                () -> extractor.extract(CUSTOMER, EXTRACTION, file, NeedsAnalysis.empty()));
        }
    }

    @Nested
    @DisplayName("Needs and phrases")
    class NeedsAndPhrasesTests {

        @Test
        @DisplayName("Needs at or below the threshold are skipped")
        void thresholdIsExclusive() {
            NeedsAnalysis needs = new NeedsAnalysis("Tim Wolff", null,
                scores("certainty", 0.3, "variety", 0.31, "growth", 0.1), null, null, null);

            List<Entity> entities = extractor.extract(CUSTOMER, EXTRACTION, FileAnalysis.empty(), needs);

            List<String> needLabels = entities.stream()
                .filter(e -> e.getType() == EntityType.NEED)
                .map(Entity::getLabel)
                .toList();
            assertEquals(List.of("variety"), needLabels);
        }

        @Test
        @DisplayName("Skills, themes and goals become typed entities with capped counts")
        void fileInsightsBecomeEntities() {
            FileAnalysis.KeyInsights insights = new FileAnalysis.KeyInsights(
                List.of("Financial planning", "Risk analysis", "Tax law", "Negotiation", "Public speaking", "Sales"),
                List.of("Retirement security"),
                List.of("Mentioned buying a house."));
            FileAnalysis file = new FileAnalysis("Tim Wolff", "transcript", 0.9, insights);

            List<Entity> entities = extractor.extract(CUSTOMER, EXTRACTION, file, NeedsAnalysis.empty());

            long skills = entities.stream().filter(e -> e.getType() == EntityType.SKILL).count();
            assertEquals(EntityExtractor.MAX_SKILLS, skills);
            assertTrue(entities.stream().anyMatch(e -> e.getType() == EntityType.CONCEPT
                && e.getLabel().equals("Buying a house")), "filler prefix and punctuation are stripped");
        }

        @Test
        @DisplayName("Duplicates across analyses merge into one entity with both sources")
        void mergesDuplicates() {
            FileAnalysis.KeyInsights insights = new FileAnalysis.KeyInsights(null, List.of("Family"), null);
            FileAnalysis file = new FileAnalysis("Tim Wolff", null, 0.5, insights);
            NeedsAnalysis needs = new NeedsAnalysis("Tim Wolff", 0.9, null, null, null, List.of("family"));

            List<Entity> entities = extractor.extract(CUSTOMER, EXTRACTION, file, needs);

            List<Entity> concepts = entities.stream().filter(e -> e.getType() == EntityType.CONCEPT).toList();
            assertEquals(1, concepts.size());
            assertEquals(0.9, concepts.get(0).getConfidence(), 1e-9);
            assertTrue(concepts.get(0).hasSource(AnalysisSource.FILE_ANALYSIS));
            assertTrue(concepts.get(0).hasSource(AnalysisSource.NEEDS_ANALYSIS));
        }

        @Test
        @DisplayName("Running twice on identical input yields identical entity ids")
        void deduplicationIsIdempotent() {
            FileAnalysis.KeyInsights insights = new FileAnalysis.KeyInsights(
                List.of("Investing", "investing "), List.of("Security"), null);
            FileAnalysis file = new FileAnalysis("Tim Wolff", null, null, insights);
            NeedsAnalysis needs = new NeedsAnalysis("Tim Wolff", null, scores("certainty", 0.8),
                List.of("Strategic planner"), List.of("Cautious"), null);

            List<String> first = extractor.extract(CUSTOMER, EXTRACTION, file, needs).stream()
                .map(Entity::getId).toList();
            List<String> second = extractor.extract(CUSTOMER, EXTRACTION, file, needs).stream()
                .map(Entity::getId).toList();

            assertEquals(first, second);
            assertEquals(first.size(), first.stream().distinct().count());
        }
    }

    @Nested
    @DisplayName("Phrase cleaning")
    class CleanPhraseTests {

        @Test
        void stripsFillerAndCapitalises() {
            assertEquals("Interest in ETFs", EntityExtractor.cleanPhrase("  Discussed   interest in ETFs; "));
        }

        @Test
        void dropsTooShortPhrases() {
            assertNull(EntityExtractor.cleanPhrase("ok"));
            assertNull(EntityExtractor.cleanPhrase(null));
        }
    }
}

package com.agentic.customergraph.similarity;

import com.agentic.customergraph.core.AnalysisSource;
import com.agentic.customergraph.core.Entity;
import com.agentic.customergraph.core.EntityType;
import com.agentic.customergraph.llm.LLMFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmSimilarityScorerTest {

    private static Entity entity(EntityType type, String label) {
        return Entity.builder()
            .type(type)
            .label(label)
            .confidence(0.8)
            .source(AnalysisSource.NEEDS_ANALYSIS)
            .customerId("customer-1")
            .extractionId("extraction_0000000001_aaaaaaaa")
            .build();
    }

    @Nested
    @DisplayName("Score parsing")
    class ParseScoreTests {

        @Test
        void parsesPlainNumber() {
            assertEquals(0.85, LlmSimilarityScorer.parseScore("0.85"), 1e-9);
        }

        @Test
        void parsesNumberInsideText() {
            assertEquals(1.0, LlmSimilarityScorer.parseScore("Relatedness: 1"), 1e-9);
        }

        @Test
        void rejectsOutOfRange() {
            assertThrows(IllegalStateException.class, () -> LlmSimilarityScorer.parseScore("7"));
        }

        @Test
        void rejectsNull() {
            assertThrows(IllegalStateException.class, () -> LlmSimilarityScorer.parseScore(null));
        }
    }

    @Test
    @DisplayName("Uses the model answer as the score")
    void usesModelAnswer() {
        LLMFunction llm = mock(LLMFunction.class);
        when(llm.apply(any(), any(), anyMap())).thenReturn(CompletableFuture.completedFuture("0.72"));
        LlmSimilarityScorer scorer = new LlmSimilarityScorer(llm, new LexicalSimilarityScorer());

        double score = scorer.scoreSimilarity(entity(EntityType.SKILL, "Investing"),
            entity(EntityType.CONCEPT, "Wealth"));

        assertEquals(0.72, score, 1e-9);
    }

    @Test
    @DisplayName("Fallback delegates to the lexical scorer without calling the model")
    void fallbackIsLexical() {
        LLMFunction llm = mock(LLMFunction.class);
        LlmSimilarityScorer scorer = new LlmSimilarityScorer(llm, new LexicalSimilarityScorer());

        double score = scorer.lexicalFallback(entity(EntityType.SKILL, "Investing"),
            entity(EntityType.CONCEPT, "investing"));

        assertEquals(1.0, score, 1e-9);
        verify(llm, never()).apply(any(), any(), anyMap());
    }

    @Test
    void promptNamesBothItems() {
        String prompt = LlmSimilarityScorer.buildPrompt(entity(EntityType.SKILL, "Investing"),
            entity(EntityType.CONCEPT, "Wealth"));

        assertTrue(prompt.contains("Item A (SKILL): Investing"));
        assertTrue(prompt.contains("Item B (CONCEPT): Wealth"));
    }
}

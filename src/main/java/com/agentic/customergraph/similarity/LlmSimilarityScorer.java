package com.agentic.customergraph.similarity;

import com.agentic.customergraph.core.Entity;
import com.agentic.customergraph.llm.LLMFunction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Similarity scorer that asks an LLM to rate how related two entities are.
 *
 * <p>Calls are bounded by a timeout and retried once; when the model stays
 * unavailable or answers with something that is not a score, the
 * deterministic {@link LexicalSimilarityScorer} answers instead.</p>
 */
@ApplicationScoped
@Named("llmSimilarityScorer")
public class LlmSimilarityScorer implements SimilarityScorer {

    private static final Logger logger = LoggerFactory.getLogger(LlmSimilarityScorer.class);

    static final String SYSTEM_PROMPT = """
        You rate semantic relatedness between two items from a customer profile.
        Answer with a single number between 0.0 (unrelated) and 1.0 (strongly related). No other text.
        """;

    private static final Pattern SCORE = Pattern.compile("(?<![\\d.])(0(?:\\.\\d+)?|1(?:\\.0+)?)(?![\\d.])");

    private final LLMFunction llm;
    private final LexicalSimilarityScorer fallback;

    @Inject
    public LlmSimilarityScorer(LLMFunction llm, LexicalSimilarityScorer fallback) {
        this.llm = llm;
        this.fallback = fallback;
    }

    @Override
    @Timeout(value = 15, unit = ChronoUnit.SECONDS)
    @Retry(maxRetries = 1, delay = 500, delayUnit = ChronoUnit.MILLIS)
    @Fallback(fallbackMethod = "lexicalFallback")
    public double scoreSimilarity(@NotNull Entity first, @NotNull Entity second) {
        String prompt = buildPrompt(first, second);
        String answer = llm.apply(prompt, SYSTEM_PROMPT, Map.of("temperature", 0.0, "max_tokens", 8)).join();
        double score = parseScore(answer);
        logger.debug("LLM similarity '{}' vs '{}' = {}", first.getLabel(), second.getLabel(), score);
        return score;
    }

    double lexicalFallback(@NotNull Entity first, @NotNull Entity second) {
        logger.warn("LLM similarity unavailable for '{}' vs '{}', using lexical heuristic",
            first.getLabel(), second.getLabel());
        return fallback.scoreSimilarity(first, second);
    }

    static String buildPrompt(Entity first, Entity second) {
        return "Item A (" + first.getType() + "): " + first.getLabel() + "\n"
            + "Item B (" + second.getType() + "): " + second.getLabel() + "\n"
            + "Relatedness score:";
    }

    /**
     * Extracts the first standalone number in [0, 1] from a model answer.
     *
     * @throws IllegalStateException if the answer contains no usable score
     */
    static double parseScore(String answer) {
        if (answer == null) {
            throw new IllegalStateException("LLM returned no similarity score");
        }
        Matcher matcher = SCORE.matcher(answer.trim());
        if (!matcher.find()) {
            throw new IllegalStateException("LLM answer is not a similarity score: " + answer);
        }
        return Double.parseDouble(matcher.group(1));
    }
}

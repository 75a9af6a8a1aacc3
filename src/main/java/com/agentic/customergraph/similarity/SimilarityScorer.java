package com.agentic.customergraph.similarity;

import com.agentic.customergraph.core.Entity;
import org.jetbrains.annotations.NotNull;

/**
 * Scores how closely two entities are related, in the range [0.0, 1.0].
 *
 * <p>Used to decide generic RELATES_TO edges between same-domain pairs. The
 * relationship extractor only compares the score against its threshold, so any
 * implementation (lexical, LLM-backed, disabled) can be swapped in.</p>
 */
@FunctionalInterface
public interface SimilarityScorer {

    double scoreSimilarity(@NotNull Entity first, @NotNull Entity second);
}

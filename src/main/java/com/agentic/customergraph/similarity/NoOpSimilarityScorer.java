package com.agentic.customergraph.similarity;

import com.agentic.customergraph.core.Entity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.jetbrains.annotations.NotNull;

/**
 * Scorer that never relates anything, which disables RELATES_TO edges.
 */
@ApplicationScoped
@Named("noOpSimilarityScorer")
public class NoOpSimilarityScorer implements SimilarityScorer {

    @Override
    public double scoreSimilarity(@NotNull Entity first, @NotNull Entity second) {
        return 0.0;
    }
}

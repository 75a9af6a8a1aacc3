package com.agentic.customergraph.similarity;

import com.agentic.customergraph.config.CustomerGraphConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

/**
 * Selects the {@link SimilarityScorer} used for RELATES_TO inference.
 *
 * <pre>
 * customer-graph.extraction.similarity-provider=lexical  # or "llm" or "none"
 * </pre>
 *
 * <p>Unknown providers fall back to the lexical scorer so extraction keeps
 * working without an LLM.</p>
 */
@ApplicationScoped
public class SimilarityScorerFactory {

    private static final Logger LOG = Logger.getLogger(SimilarityScorerFactory.class);

    @Inject
    CustomerGraphConfig config;

    @Inject
    @Named("lexicalSimilarityScorer")
    SimilarityScorer lexicalScorer;

    @Inject
    @Named("llmSimilarityScorer")
    SimilarityScorer llmScorer;

    @Inject
    @Named("noOpSimilarityScorer")
    SimilarityScorer noOpScorer;

    public SimilarityScorer getScorer() {
        return getScorer(config.extraction().similarityProvider());
    }

    public SimilarityScorer getScorer(String providerName) {
        return switch (providerKey(providerName)) {
            case "llm" -> llmScorer;
            case "none" -> noOpScorer;
            case "lexical" -> lexicalScorer;
            default -> {
                LOG.warnf("Unknown similarity provider '%s', using lexical scorer", providerName);
                yield lexicalScorer;
            }
        };
    }

    /**
     * Name recorded in snapshot metadata as part of the extraction method.
     */
    public String providerName() {
        String key = providerKey(config.extraction().similarityProvider());
        return switch (key) {
            case "llm", "none", "lexical" -> key;
            default -> "lexical";
        };
    }

    private static String providerKey(String providerName) {
        return providerName == null || providerName.isBlank() ? "lexical" : providerName.trim().toLowerCase();
    }
}

package com.agentic.customergraph.similarity;

import com.agentic.customergraph.core.Entity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deterministic similarity heuristic over entity labels.
 *
 * <p>The score is the larger of two signals:</p>
 * <ul>
 *   <li>a weighted blend of token Jaccard, token containment and normalised
 *       Levenshtein similarity;</li>
 *   <li>a domain co-occurrence score, granted when both labels mention a
 *       keyword from the same domain cluster (for example a financial skill
 *       and a wealth-planning concept).</li>
 * </ul>
 */
@ApplicationScoped
@Named("lexicalSimilarityScorer")
public class LexicalSimilarityScorer implements SimilarityScorer {

    private static final Logger logger = LoggerFactory.getLogger(LexicalSimilarityScorer.class);

    static final double JACCARD_WEIGHT = 0.4;
    static final double CONTAINMENT_WEIGHT = 0.3;
    static final double LEVENSHTEIN_WEIGHT = 0.3;

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "of", "and", "or", "for", "in", "on", "at", "to", "from", "with", "by");

    private static final List<DomainCluster> CLUSTERS = List.of(
        new DomainCluster("finance", 0.7, Set.of(
            "financial", "finance", "investment", "investing", "insurance", "planning",
            "advisory", "wealth", "retirement", "portfolio")),
        new DomainCluster("analytical", 0.6, Set.of(
            "analytical", "strategic", "methodical", "planner", "cautious", "detail", "risk")),
        new DomainCluster("exploratory", 0.6, Set.of(
            "creative", "innovative", "curious", "explorer", "adventurous", "open")),
        new DomainCluster("relational", 0.6, Set.of(
            "collaborative", "social", "empathetic", "team", "helper", "mentor", "supportive")),
        new DomainCluster("drive", 0.6, Set.of(
            "ambitious", "competitive", "leader", "leadership", "driven", "achiever")));

    @Override
    public double scoreSimilarity(@NotNull Entity first, @NotNull Entity second) {
        String a = normalize(first.getLabel());
        String b = normalize(second.getLabel());
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        Set<String> tokensA = tokenize(a);
        Set<String> tokensB = tokenize(b);

        double lexical = JACCARD_WEIGHT * jaccard(tokensA, tokensB)
            + CONTAINMENT_WEIGHT * containment(tokensA, tokensB)
            + LEVENSHTEIN_WEIGHT * levenshteinSimilarity(a, b);
        double domain = domainScore(tokensA, tokensB);
        double score = Math.min(1.0, Math.max(lexical, domain));

        logger.trace("Lexical similarity '{}' vs '{}': lexical={} domain={}", a, b, lexical, domain);
        return score;
    }

    String normalize(String label) {
        return label.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9\\s]", " ")
            .trim()
            .replaceAll("\\s+", " ");
    }

    Set<String> tokenize(String normalized) {
        return Arrays.stream(normalized.split(" "))
            .filter(token -> !token.isEmpty() && !STOP_WORDS.contains(token))
            .collect(Collectors.toSet());
    }

    double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    /**
     * 1.0 when every token of the smaller set appears in the larger one.
     */
    double containment(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        return larger.containsAll(smaller) ? 1.0 : 0.0;
    }

    double levenshteinSimilarity(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        int maxLength = Math.max(a.length(), b.length());
        return 1.0 - ((double) levenshteinDistance(a, b) / maxLength);
    }

    private int levenshteinDistance(String s1, String s2) {
        int[] previous = new int[s2.length() + 1];
        int[] current = new int[s2.length() + 1];
        for (int j = 0; j <= s2.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= s1.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[s2.length()];
    }

    private double domainScore(Set<String> a, Set<String> b) {
        double best = 0.0;
        for (DomainCluster cluster : CLUSTERS) {
            if (cluster.matches(a) && cluster.matches(b)) {
                best = Math.max(best, cluster.score());
            }
        }
        return best;
    }

    private record DomainCluster(String name, double score, Set<String> keywords) {
        boolean matches(Set<String> tokens) {
            for (String token : tokens) {
                if (keywords.contains(token)) {
                    return true;
                }
            }
            return false;
        }
    }
}

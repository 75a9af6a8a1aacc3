package com.agentic.customergraph.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed lookup table from human needs to the behavioral pattern categories
 * they drive. A pattern belongs to a category when its label mentions one of
 * the category keywords.
 */
public final class NeedBehaviorRules {

    private static final Map<String, List<String>> NEED_TO_BEHAVIOR_KEYWORDS = Map.of(
        "certainty", List.of("strategic", "planner", "risk", "manager", "cautious", "analytical"),
        "variety", List.of("innovative", "creative", "explorer", "adventurous"),
        "significance", List.of("leader", "achiever", "competitive", "ambitious"),
        "connection", List.of("collaborative", "team", "social", "helper"),
        "growth", List.of("learner", "developer", "improver", "student"),
        "contribution", List.of("helper", "mentor", "teacher", "giver")
    );

    private NeedBehaviorRules() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return true when the lookup table maps the need onto the pattern's category
     */
    public static boolean drives(@NotNull String need, @NotNull String patternLabel) {
        List<String> keywords = NEED_TO_BEHAVIOR_KEYWORDS.get(GraphIds.normalizeLabel(need));
        if (keywords == null) {
            return false;
        }
        String pattern = patternLabel.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (pattern.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}

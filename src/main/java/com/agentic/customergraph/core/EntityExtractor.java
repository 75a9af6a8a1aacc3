package com.agentic.customergraph.core;

import com.agentic.customergraph.exception.MissingPrimarySubjectException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Converts file-analysis and needs-analysis output into a deduplicated set of
 * typed entities anchored on exactly one PERSON.
 *
 * <p>Entities that share a type and a normalised label are merged: the result
 * keeps the higher confidence and the union of source attributions. Output
 * order is deterministic (PERSON first, then discovery order), so identical
 * input always yields identical entity sets.</p>
 */
public final class EntityExtractor {

    private static final Logger logger = LoggerFactory.getLogger(EntityExtractor.class);

    static final int MAX_SKILLS = 5;
    static final int MAX_MAIN_THEMES = 3;
    static final int MAX_GOALS = 3;
    static final int MAX_LIFE_THEMES = 3;
    static final int MAX_PATTERNS = 5;
    static final int MAX_TRAITS = 5;
    static final int MAX_NAME_WORDS = 4;
    static final int MIN_LABEL_LENGTH = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.;,:]+$");
    private static final List<String> FILLER_PREFIXES = List.of("Mentioned ", "Discussed ", "Has ", "Shows ");

    private final ExtractionSettings settings;
    private final Clock clock;

    public EntityExtractor(@NotNull ExtractionSettings settings, @NotNull Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public EntityExtractor(@NotNull ExtractionSettings settings) {
        this(settings, Clock.systemUTC());
    }

    /**
     * Extracts entities for one extraction.
     *
     * @return entities with the PERSON first, never empty
     * @throws MissingPrimarySubjectException if neither analysis names a subject
     */
    @NotNull
    public List<Entity> extract(
            @NotNull String customerId,
            @NotNull String extractionId,
            @NotNull FileAnalysis fileAnalysis,
            @NotNull NeedsAnalysis needsAnalysis) {
        Instant now = clock.instant();
        Candidates candidates = new Candidates(customerId, extractionId, now);

        candidates.add(primarySubject(customerId, extractionId, now, fileAnalysis, needsAnalysis));

        double fileConfidence = fileConfidence(fileAnalysis);
        FileAnalysis.KeyInsights insights = fileAnalysis.insights();
        candidates.addPhrases(insights.skills(), MAX_SKILLS, EntityType.SKILL,
            AnalysisSource.FILE_ANALYSIS, "skills_and_competencies", fileConfidence);
        candidates.addPhrases(insights.themes(), MAX_MAIN_THEMES, EntityType.CONCEPT,
            AnalysisSource.FILE_ANALYSIS, "main_themes", fileConfidence);
        candidates.addPhrases(insights.goals(), MAX_GOALS, EntityType.CONCEPT,
            AnalysisSource.FILE_ANALYSIS, "goals_and_aspirations", fileConfidence);

        double needsConfidence = needsConfidence(needsAnalysis);
        addNeeds(candidates, needsAnalysis, needsConfidence);
        candidates.addPhrases(needsAnalysis.patterns(), MAX_PATTERNS, EntityType.BEHAVIORAL_PATTERN,
            AnalysisSource.NEEDS_ANALYSIS, "behavioral_patterns", needsConfidence);
        candidates.addPhrases(needsAnalysis.traits(), MAX_TRAITS, EntityType.PERSONALITY_TRAIT,
            AnalysisSource.NEEDS_ANALYSIS, "personality_traits", needsConfidence);
        candidates.addPhrases(needsAnalysis.themes(), MAX_LIFE_THEMES, EntityType.CONCEPT,
            AnalysisSource.NEEDS_ANALYSIS, "life_themes", needsConfidence);

        List<Entity> entities = candidates.entities();
        logger.debug("Extracted {} entities for customer {} extraction {} (merged {} duplicates)",
            entities.size(), customerId, extractionId, candidates.merged);
        return entities;
    }

    private Entity primarySubject(
            String customerId,
            String extractionId,
            Instant now,
            FileAnalysis fileAnalysis,
            NeedsAnalysis needsAnalysis) {
        String fileName = cleanName(fileAnalysis.customerName());
        String needsName = cleanName(needsAnalysis.subjectName());
        String chosen = fileName != null ? fileName : needsName;
        if (chosen == null) {
            logger.warn("No primary subject in analyses for customer {} extraction {}", customerId, extractionId);
            throw new MissingPrimarySubjectException(customerId, extractionId);
        }

        String key = GraphIds.normalizeLabel(chosen);
        Entity.Builder person = Entity.builder()
            .type(EntityType.PERSON)
            .label(chosen)
            .customerId(customerId)
            .extractionId(extractionId)
            .createdAt(now)
            .property("primary", Boolean.TRUE);

        double confidence = 0.0;
        if (fileName != null && GraphIds.normalizeLabel(fileName).equals(key)) {
            confidence = Math.max(confidence, fileConfidence(fileAnalysis));
            person.source(AnalysisSource.FILE_ANALYSIS).addEvidence("customer_name: " + fileName);
        }
        if (needsName != null && GraphIds.normalizeLabel(needsName).equals(key)) {
            confidence = Math.max(confidence, needsConfidence(needsAnalysis));
            person.source(AnalysisSource.NEEDS_ANALYSIS).addEvidence("subject_name: " + needsName);
        }
        return person.confidence(confidence).build();
    }

    private void addNeeds(Candidates candidates, NeedsAnalysis needsAnalysis, double confidence) {
        for (Map.Entry<String, Double> entry : needsAnalysis.scores().entrySet()) {
            Double score = entry.getValue();
            String need = entry.getKey() != null ? GraphIds.normalizeLabel(entry.getKey()) : "";
            if (score == null || score.isNaN() || need.isEmpty()) {
                continue;
            }
            double clamped = Math.max(0.0, Math.min(1.0, score));
            if (clamped <= settings.needScoreThreshold()) {
                logger.trace("Need {} below threshold ({} <= {})", need, clamped, settings.needScoreThreshold());
                continue;
            }
            candidates.add(candidates.base(EntityType.NEED, need, AnalysisSource.NEEDS_ANALYSIS, confidence)
                .addEvidence(String.format(Locale.ROOT, "needs_scores.%s: %.2f", need, clamped))
                .property("score", clamped)
                .build());
        }
    }

    private double fileConfidence(FileAnalysis fileAnalysis) {
        return boundedOrDefault(fileAnalysis.confidence(), settings.defaultFileAnalysisConfidence());
    }

    private double needsConfidence(NeedsAnalysis needsAnalysis) {
        return boundedOrDefault(needsAnalysis.confidenceScore(), settings.defaultNeedsAnalysisConfidence());
    }

    private static double boundedOrDefault(@Nullable Double value, double fallback) {
        if (value == null || value.isNaN()) {
            return fallback;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Normalises a descriptive phrase: collapses whitespace, strips leading
     * filler verbs and trailing punctuation, capitalises the first letter.
     *
     * @return the cleaned phrase, or null if too short to be meaningful
     */
    @Nullable
    static String cleanPhrase(@Nullable String raw) {
        if (raw == null) {
            return null;
        }
        String text = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
        for (String prefix : FILLER_PREFIXES) {
            if (text.startsWith(prefix)) {
                text = text.substring(prefix.length()).trim();
                break;
            }
        }
        text = TRAILING_PUNCTUATION.matcher(text).replaceAll("");
        if (text.length() < MIN_LABEL_LENGTH) {
            return null;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    @Nullable
    static String cleanName(@Nullable String raw) {
        if (raw == null) {
            return null;
        }
        String name = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
        if (name.length() < 2 || name.split(" ").length > MAX_NAME_WORDS) {
            return null;
        }
        return name;
    }

    /**
     * Ordered candidate set keyed by type and normalised label.
     */
    private static final class Candidates {
        private final String customerId;
        private final String extractionId;
        private final Instant now;
        private final Map<String, Entity> byKey = new LinkedHashMap<>();
        private int merged;

        Candidates(String customerId, String extractionId, Instant now) {
            this.customerId = customerId;
            this.extractionId = extractionId;
            this.now = now;
        }

        Entity.Builder base(EntityType type, String label, AnalysisSource source, double confidence) {
            return Entity.builder()
                .type(type)
                .label(label)
                .confidence(confidence)
                .source(source)
                .customerId(customerId)
                .extractionId(extractionId)
                .createdAt(now);
        }

        void addPhrases(List<String> phrases, int limit, EntityType type, AnalysisSource source,
                String field, double confidence) {
            int taken = 0;
            for (String raw : phrases) {
                if (taken >= limit) {
                    break;
                }
                String label = cleanPhrase(raw);
                if (label == null) {
                    continue;
                }
                add(base(type, label, source, confidence)
                    .addEvidence(field + ": " + raw.trim())
                    .build());
                taken++;
            }
        }

        void add(Entity candidate) {
            Entity existing = byKey.get(candidate.dedupKey());
            if (existing == null) {
                byKey.put(candidate.dedupKey(), candidate);
            } else {
                byKey.put(candidate.dedupKey(), existing.mergeWith(candidate));
                merged++;
            }
        }

        List<Entity> entities() {
            return new ArrayList<>(byKey.values());
        }
    }
}

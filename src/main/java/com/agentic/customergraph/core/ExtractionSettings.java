package com.agentic.customergraph.core;

/**
 * Immutable settings of the extraction pipeline, passed in at construction.
 *
 * @param needScoreThreshold minimum score a need must exceed to become a NEED entity
 * @param similarityThreshold minimum similarity a pair must exceed to get a RELATES_TO edge
 * @param defaultFileAnalysisConfidence confidence used when the file analysis reports none
 * @param defaultNeedsAnalysisConfidence confidence used when the needs analysis reports none
 * @param typeDiversityWeight quality weight of entity-type diversity
 * @param evidenceCoverageWeight quality weight of evidence coverage
 * @param meaningfulRatioWeight quality weight of the meaningful-relationship ratio
 */
public record ExtractionSettings(
    double needScoreThreshold,
    double similarityThreshold,
    double defaultFileAnalysisConfidence,
    double defaultNeedsAnalysisConfidence,
    double typeDiversityWeight,
    double evidenceCoverageWeight,
    double meaningfulRatioWeight
) {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    public ExtractionSettings {
        requireUnitInterval("needScoreThreshold", needScoreThreshold);
        requireUnitInterval("similarityThreshold", similarityThreshold);
        requireUnitInterval("defaultFileAnalysisConfidence", defaultFileAnalysisConfidence);
        requireUnitInterval("defaultNeedsAnalysisConfidence", defaultNeedsAnalysisConfidence);
        requireUnitInterval("typeDiversityWeight", typeDiversityWeight);
        requireUnitInterval("evidenceCoverageWeight", evidenceCoverageWeight);
        requireUnitInterval("meaningfulRatioWeight", meaningfulRatioWeight);

        double sum = typeDiversityWeight + evidenceCoverageWeight + meaningfulRatioWeight;
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException(String.format(
                "Quality weights must sum to 1.0, got %.4f", sum));
        }
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(0.3, 0.5, 0.8, 0.7, 0.4, 0.3, 0.3);
    }

    public ExtractionSettings withSimilarityThreshold(double threshold) {
        return new ExtractionSettings(needScoreThreshold, threshold, defaultFileAnalysisConfidence,
            defaultNeedsAnalysisConfidence, typeDiversityWeight, evidenceCoverageWeight, meaningfulRatioWeight);
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }
}

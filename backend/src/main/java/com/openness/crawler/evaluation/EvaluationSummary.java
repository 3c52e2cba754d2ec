package com.openness.crawler.evaluation;

import com.openness.crawler.catalog.CriterionType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets of one organization's criterion results. Confidence bands: high above 0.8,
 * medium from 0.5 to 0.8, low below 0.5.
 */
public record EvaluationSummary(
    Map<String, DimensionSummary> byDimension,
    Map<String, Integer> byConfidence,
    Map<String, Integer> byPatternType,
    Map<String, Integer> fulfilledByType,
    Map<String, Integer> totalByType
) {
    public static final String HIGH = "high";
    public static final String MEDIUM = "medium";
    public static final String LOW = "low";

    public static String confidenceBand(double confidence) {
        if (confidence > 0.8) {
            return HIGH;
        }
        return confidence >= 0.5 ? MEDIUM : LOW;
    }

    public static EvaluationSummary from(List<CriterionEvaluation> results) {
        Map<String, int[]> dimensionCounts = new LinkedHashMap<>();
        Map<String, Integer> byConfidence = new LinkedHashMap<>();
        byConfidence.put(HIGH, 0);
        byConfidence.put(MEDIUM, 0);
        byConfidence.put(LOW, 0);
        Map<String, Integer> byPatternType = new LinkedHashMap<>();
        Map<String, Integer> fulfilledByType = new LinkedHashMap<>();
        Map<String, Integer> totalByType = new LinkedHashMap<>();
        for (CriterionType type : CriterionType.values()) {
            fulfilledByType.put(type.key(), 0);
            totalByType.put(type.key(), 0);
        }

        for (CriterionEvaluation result : results) {
            if (result.dimension() != null) {
                int[] counts = dimensionCounts.computeIfAbsent(result.dimension(), key -> new int[2]);
                counts[1]++;
                if (result.evaluation()) {
                    counts[0]++;
                }
            }
            if (result.criterionType() != null) {
                totalByType.merge(result.criterionType().key(), 1, Integer::sum);
                if (result.evaluation()) {
                    fulfilledByType.merge(result.criterionType().key(), 1, Integer::sum);
                }
            }
            byConfidence.merge(confidenceBand(result.confidence()), 1, Integer::sum);
            if (!result.patternType().isEmpty()) {
                byPatternType.merge(result.patternType(), 1, Integer::sum);
            }
        }

        Map<String, DimensionSummary> byDimension = new LinkedHashMap<>();
        dimensionCounts.forEach((dimension, counts) -> byDimension.put(dimension, DimensionSummary.of(counts[0], counts[1])));
        return new EvaluationSummary(byDimension, byConfidence, byPatternType, fulfilledByType, totalByType);
    }
}

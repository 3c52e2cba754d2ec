package com.openness.crawler.statistics;

import java.util.Map;

public record CriteriaStatistics(
    double overallFulfillmentRate,
    double overallAverageConfidence,
    Map<String, Double> criterionHitRate,
    Map<String, Double> criterionAverageConfidence,
    int highConfidenceMatches,
    int mediumConfidenceMatches,
    int lowConfidenceMatches,
    int manualReviewNeeded,
    Map<String, Map<String, Integer>> patternHitsByType
) {
}

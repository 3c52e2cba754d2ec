package com.openness.crawler.statistics;

import java.util.List;
import java.util.Map;

public record ComparisonStatistics(
    Map<String, Double> dimensionPerformance,
    String strongestDimension,
    String weakestDimension,
    List<OrganizationRanking> topPerformers,
    List<OrganizationRanking> bottomPerformers
) {
}

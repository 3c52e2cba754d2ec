package com.openness.crawler.statistics;

import java.time.Instant;

public record AssessmentStatistics(
    String catalogName,
    Instant collectedAt,
    CrawlingStatistics crawling,
    CriteriaStatistics criteria,
    ComparisonStatistics comparison
) {
}

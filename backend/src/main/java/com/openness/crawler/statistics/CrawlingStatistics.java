package com.openness.crawler.statistics;

import java.time.Duration;
import java.util.Map;

public record CrawlingStatistics(
    int totalOrganizations,
    int successfulCrawls,
    int failedCrawls,
    int totalPagesCrawled,
    int successfulPages,
    double averagePagesPerOrganization,
    Duration totalCrawlDuration,
    double averageCrawlSecondsPerOrganization,
    Map<String, Integer> errorTypes
) {
}

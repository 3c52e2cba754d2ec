package com.openness.crawler.crawl.service;

import com.openness.crawler.crawl.strategy.CrawlStrategy;

import java.util.List;

/**
 * One organization to crawl. Null strategy or maxPages fall back to the configured defaults.
 */
public record CrawlRequest(
    String organizationName,
    String baseUrl,
    CrawlStrategy strategy,
    Integer maxPages,
    List<String> criteriaNames
) {
    public CrawlRequest {
        criteriaNames = criteriaNames == null ? List.of() : List.copyOf(criteriaNames);
    }

    public static CrawlRequest of(String organizationName, String baseUrl) {
        return new CrawlRequest(organizationName, baseUrl, null, null, List.of());
    }
}

package com.openness.crawler.api;

import com.openness.crawler.crawl.model.CrawlFailure;
import com.openness.crawler.crawl.model.OrganizationCrawlResult;

import java.util.List;

/**
 * Crawl result without page bodies.
 */
public record CrawlSummaryView(
    String organizationName,
    String baseUrl,
    int totalPages,
    int successfulPages,
    long durationMs,
    boolean cancelled,
    List<PageView> pages,
    List<CrawlFailure> errors
) {
    public static CrawlSummaryView of(OrganizationCrawlResult result) {
        return new CrawlSummaryView(
            result.organizationName(),
            result.baseUrl(),
            result.totalPages(),
            result.successfulPages(),
            result.crawlDuration().toMillis(),
            result.cancelled(),
            result.pages().stream()
                .map(page -> new PageView(page.url(), page.title(), page.success(), page.errorMessage(), page.content().length()))
                .toList(),
            result.errors()
        );
    }

    public record PageView(String url, String title, boolean success, String errorMessage, int contentLength) {
    }
}

package com.openness.crawler.crawl.model;

import java.time.Duration;
import java.util.List;

public record OrganizationCrawlResult(
    String organizationName,
    String baseUrl,
    List<PageResult> pages,
    int totalPages,
    int successfulPages,
    Duration crawlDuration,
    List<CrawlFailure> errors,
    boolean cancelled
) {
    public OrganizationCrawlResult {
        pages = pages == null ? List.of() : List.copyOf(pages);
        errors = errors == null ? List.of() : List.copyOf(errors);
        crawlDuration = crawlDuration == null ? Duration.ZERO : crawlDuration;
    }

    /**
     * Freezes the pages fetched so far; counts are derived from the page list.
     */
    public static OrganizationCrawlResult of(
        String organizationName,
        String baseUrl,
        List<PageResult> pages,
        Duration crawlDuration,
        List<CrawlFailure> errors,
        boolean cancelled
    ) {
        List<PageResult> safePages = pages == null ? List.of() : pages;
        int successful = (int) safePages.stream().filter(PageResult::success).count();
        return new OrganizationCrawlResult(
            organizationName,
            baseUrl,
            safePages,
            safePages.size(),
            successful,
            crawlDuration,
            errors,
            cancelled
        );
    }

    public List<PageResult> successfulPageList() {
        return pages.stream().filter(PageResult::success).toList();
    }

    public boolean mainPageFailed() {
        return successfulPages == 0;
    }
}

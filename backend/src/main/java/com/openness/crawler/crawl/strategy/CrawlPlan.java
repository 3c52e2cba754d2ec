package com.openness.crawler.crawl.strategy;

import java.util.List;

/**
 * Ordered crawl set. The base URL is always the first entry.
 */
public record CrawlPlan(
    List<String> urls,
    CrawlStrategy strategy,
    boolean fellBack,
    String reasoning
) {
    public CrawlPlan {
        urls = urls == null ? List.of() : List.copyOf(urls);
        reasoning = reasoning == null ? "" : reasoning;
    }

    public List<String> remainingUrls() {
        return urls.size() <= 1 ? List.of() : urls.subList(1, urls.size());
    }
}

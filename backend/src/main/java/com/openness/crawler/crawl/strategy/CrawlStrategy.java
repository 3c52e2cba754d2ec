package com.openness.crawler.crawl.strategy;

import java.util.Locale;

public enum CrawlStrategy {
    HOMEPAGE_ONLY("homepage_only"),
    ALL_PAGES("all_pages"),
    LIMITED("limited"),
    INTELLIGENT("intelligent");

    private final String key;

    CrawlStrategy(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static CrawlStrategy fromKey(String value) {
        if (value == null || value.isBlank()) {
            return INTELLIGENT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (CrawlStrategy strategy : values()) {
            if (strategy.key.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown crawl strategy: " + value);
    }
}

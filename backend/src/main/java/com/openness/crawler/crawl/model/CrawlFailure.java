package com.openness.crawler.crawl.model;

public record CrawlFailure(String url, String message) {
}

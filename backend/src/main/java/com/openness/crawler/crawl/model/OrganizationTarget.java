package com.openness.crawler.crawl.model;

public record OrganizationTarget(String name, String baseUrl) {
}

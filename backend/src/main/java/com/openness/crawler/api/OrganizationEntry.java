package com.openness.crawler.api;

public record OrganizationEntry(String name, String url) {
}

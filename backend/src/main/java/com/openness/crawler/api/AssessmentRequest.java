package com.openness.crawler.api;

public record AssessmentRequest(
    String organizationName,
    String baseUrl,
    String catalog,
    String strategy,
    Integer maxPages
) {
}

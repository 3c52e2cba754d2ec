package com.openness.crawler.api;

import java.util.List;

public record BatchAssessmentRequest(
    List<OrganizationEntry> organizations,
    String catalog,
    String strategy,
    Integer maxPages
) {
}

package com.openness.crawler.llm;

import java.util.List;

public record SubpageSelectionRequest(
    String organizationName,
    String baseUrl,
    List<SubpageCandidate> candidates,
    List<String> criteriaNames,
    int maxPages
) {
    public SubpageSelectionRequest {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        criteriaNames = criteriaNames == null ? List.of() : List.copyOf(criteriaNames);
    }
}

package com.openness.crawler.crawl.fetch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Top-level JSON response of a Crawl4AI-compatible rendering sidecar's {@code /crawl} endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Crawl4AiResponse(
    boolean success,
    List<Crawl4AiPageResult> results
) {
    public Crawl4AiResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }
}

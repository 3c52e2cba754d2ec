package com.openness.crawler.crawl.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one fetch attempt. A failed page never carries content or links.
 */
public record PageResult(
    String url,
    String title,
    String content,
    List<String> links,
    boolean success,
    String errorMessage,
    Instant fetchedAt
) {
    public PageResult {
        title = title == null ? "" : title;
        if (success) {
            content = content == null ? "" : content;
            links = links == null ? List.of() : List.copyOf(links);
            errorMessage = null;
        } else {
            content = "";
            links = List.of();
            errorMessage = errorMessage == null || errorMessage.isBlank() ? "unknown_error" : errorMessage;
        }
        fetchedAt = fetchedAt == null ? Instant.now() : fetchedAt;
    }

    public static PageResult success(String url, String title, String content, List<String> links, Instant fetchedAt) {
        return new PageResult(url, title, content, links, true, null, fetchedAt);
    }

    public static PageResult failure(String url, String errorMessage, Instant fetchedAt) {
        return new PageResult(url, "", "", List.of(), false, errorMessage, fetchedAt);
    }
}

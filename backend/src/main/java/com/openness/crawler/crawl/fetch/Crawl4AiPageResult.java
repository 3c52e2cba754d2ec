package com.openness.crawler.crawl.fetch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Crawl4AiPageResult(
    String url,
    boolean success,
    String html,
    String cleanedHtml,
    Integer statusCode,
    String errorMessage,
    Map<String, Object> metadata
) {
    public String title() {
        if (metadata == null) {
            return null;
        }
        Object title = metadata.get("title");
        return title == null ? null : title.toString();
    }

    public String renderedHtml() {
        if (html != null && !html.isBlank()) {
            return html;
        }
        return cleanedHtml;
    }
}

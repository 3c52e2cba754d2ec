package com.openness.crawler.crawl.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openness.crawler.crawl.http.PoliteHttpClient;
import com.openness.crawler.crawl.model.HttpFetchResult;
import com.openness.crawler.crawl.model.PageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Delegates page rendering to a Crawl4AI-compatible sidecar and parses the rendered HTML
 * with the same rules as the basic backend.
 */
public class RenderingPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(RenderingPageFetcher.class);

    private final PoliteHttpClient httpClient;
    private final HtmlPageParser parser;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final int timeoutSeconds;

    public RenderingPageFetcher(
        PoliteHttpClient httpClient,
        HtmlPageParser parser,
        ObjectMapper objectMapper,
        String endpoint,
        int timeoutSeconds
    ) {
        this.httpClient = httpClient;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public PageResult fetch(String url) {
        Instant fetchedAt = Instant.now();
        try {
            ObjectNode request = objectMapper.createObjectNode();
            request.putArray("urls").add(url);
            HttpFetchResult response = httpClient.postJson(endpoint, objectMapper.writeValueAsString(request), timeoutSeconds);
            if (!response.isSuccessful()) {
                return PageResult.failure(url, "render_failed: " + response.describeFailure(), fetchedAt);
            }

            Crawl4AiResponse payload = objectMapper.readValue(response.body(), Crawl4AiResponse.class);
            if (!payload.success() || payload.results().isEmpty()) {
                return PageResult.failure(url, "render_failed: sidecar reported no result", fetchedAt);
            }
            Crawl4AiPageResult page = payload.results().get(0);
            if (!page.success()) {
                String reason = page.errorMessage() == null ? "page not rendered" : page.errorMessage();
                return PageResult.failure(url, "render_failed: " + reason, fetchedAt);
            }
            if (page.statusCode() != null && (page.statusCode() < 200 || page.statusCode() >= 300)) {
                return PageResult.failure(url, "HTTP " + page.statusCode(), fetchedAt);
            }

            HtmlPageParser.ParsedPage parsed = parser.parse(page.renderedHtml(), url);
            String title = page.title() == null || page.title().isBlank() ? parsed.title() : page.title().trim();
            return PageResult.success(url, title, parsed.content(), parsed.links(), fetchedAt);
        } catch (JsonProcessingException e) {
            log.debug("Rendering sidecar returned malformed JSON for {}", url, e);
            return PageResult.failure(url, "render_failed: malformed sidecar response", fetchedAt);
        } catch (RuntimeException e) {
            log.warn("Rendering backend failed for {}", url, e);
            return PageResult.failure(url, "render_failed: " + e.getMessage(), fetchedAt);
        }
    }

    @Override
    public String name() {
        return "rendering";
    }
}

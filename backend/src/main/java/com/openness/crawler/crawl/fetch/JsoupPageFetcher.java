package com.openness.crawler.crawl.fetch;

import com.openness.crawler.crawl.http.PoliteHttpClient;
import com.openness.crawler.crawl.model.HttpFetchResult;
import com.openness.crawler.crawl.model.PageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Plain HTTP GET plus jsoup parsing. No script execution.
 */
@Component
public class JsoupPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final PoliteHttpClient httpClient;
    private final HtmlPageParser parser;

    public JsoupPageFetcher(PoliteHttpClient httpClient, HtmlPageParser parser) {
        this.httpClient = httpClient;
        this.parser = parser;
    }

    @Override
    public PageResult fetch(String url) {
        Instant fetchedAt = Instant.now();
        try {
            HttpFetchResult fetch = httpClient.get(url, PoliteHttpClient.HTML_ACCEPT);
            if (!fetch.isSuccessful()) {
                log.debug("Fetch failed url={} error={}", url, fetch.errorKey());
                return PageResult.failure(url, fetch.describeFailure(), fetchedAt);
            }
            HtmlPageParser.ParsedPage parsed = parser.parse(
                fetch.bodyBytes(),
                fetch.declaredCharset(),
                fetch.finalUrlOrRequested()
            );
            return PageResult.success(url, parsed.title(), parsed.content(), parsed.links(), fetchedAt);
        } catch (RuntimeException e) {
            log.warn("Unexpected error fetching {}", url, e);
            return PageResult.failure(url, "parse_error: " + e.getMessage(), fetchedAt);
        }
    }

    @Override
    public String name() {
        return "basic";
    }
}

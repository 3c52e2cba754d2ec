package com.openness.crawler.crawl.fetch;

import com.openness.crawler.crawl.model.PageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Tries the primary backend first and retries the same URL with the fallback backend
 * whenever the primary does not produce a successful page.
 */
public class FallbackPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(FallbackPageFetcher.class);

    private final PageFetcher primary;
    private final PageFetcher fallback;

    public FallbackPageFetcher(PageFetcher primary, PageFetcher fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public PageResult fetch(String url) {
        PageResult result;
        try {
            result = primary.fetch(url);
        } catch (RuntimeException e) {
            result = PageResult.failure(url, primary.name() + " backend error: " + e.getMessage(), Instant.now());
        }
        if (result != null && result.success()) {
            return result;
        }
        log.warn(
            "{} backend failed for {} ({}), falling back to {}",
            primary.name(),
            url,
            result == null ? "no result" : result.errorMessage(),
            fallback.name()
        );
        return fallback.fetch(url);
    }

    @Override
    public String name() {
        return primary.name() + "+" + fallback.name();
    }
}

package com.openness.crawler.crawl.fetch;

import com.openness.crawler.crawl.model.PageResult;

/**
 * Fetches a single absolute URL. Implementations never throw; every problem is reported
 * through a {@link PageResult} with {@code success == false}.
 */
public interface PageFetcher {

    PageResult fetch(String url);

    String name();
}

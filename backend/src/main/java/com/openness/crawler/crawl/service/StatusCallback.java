package com.openness.crawler.crawl.service;

/**
 * Push-only progress sink. Implementations may throw; callers go through {@link StatusReporter}.
 */
@FunctionalInterface
public interface StatusCallback {

    void onStatus(String message);

    static StatusCallback noop() {
        return message -> {
        };
    }
}

package com.openness.crawler.crawl.service;

import org.slf4j.Logger;

/**
 * Mirrors progress messages to a logger and forwards them to a callback, ignoring callback failures.
 */
public final class StatusReporter {
    private final Logger log;
    private final StatusCallback callback;

    public StatusReporter(Logger log, StatusCallback callback) {
        this.log = log;
        this.callback = callback == null ? StatusCallback.noop() : callback;
    }

    public void report(String message) {
        log.info(message);
        try {
            callback.onStatus(message);
        } catch (RuntimeException e) {
            log.debug("Status callback failed: {}", e.toString());
        }
    }
}

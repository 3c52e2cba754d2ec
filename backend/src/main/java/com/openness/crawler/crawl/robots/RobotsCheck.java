package com.openness.crawler.crawl.robots;

import java.util.List;

public record RobotsCheck(
    boolean exists,
    Double crawlDelaySeconds,
    List<String> sitemapUrls,
    List<String> rules,
    RobotsRules parsedRules
) {
    public RobotsCheck {
        sitemapUrls = sitemapUrls == null ? List.of() : List.copyOf(sitemapUrls);
        rules = rules == null ? List.of() : List.copyOf(rules);
        parsedRules = parsedRules == null ? RobotsRules.allowAll() : parsedRules;
    }

    public static RobotsCheck missing() {
        return new RobotsCheck(false, null, List.of(), List.of(), RobotsRules.allowAll());
    }

    public boolean isAllowed(String pathAndQuery) {
        return parsedRules.isAllowed(pathAndQuery);
    }
}

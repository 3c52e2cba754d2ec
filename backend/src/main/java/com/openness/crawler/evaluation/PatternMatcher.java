package com.openness.crawler.evaluation;

import com.openness.crawler.catalog.PatternType;
import com.openness.crawler.config.CrawlerProperties;
import com.openness.crawler.crawl.model.PageResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Heuristic substring matching of catalog patterns against a fetched page. Stateless.
 */
@Component
public class PatternMatcher {
    static final double URL_ON_PAGE_CONFIDENCE = 0.8;
    static final double URL_IN_LINK_CONFIDENCE = 0.7;
    static final double LOGO_CONFIDENCE = 0.6;
    private static final int CONTEXT_CHARS = 50;

    private final boolean caseSensitive;

    public PatternMatcher(CrawlerProperties properties) {
        this.caseSensitive = properties.isCaseSensitive();
    }

    public Optional<PatternMatch> match(PatternType type, List<String> patterns, PageResult page) {
        if (type == null || patterns == null || patterns.isEmpty() || page == null || !page.success()) {
            return Optional.empty();
        }
        return switch (type) {
            case TEXT -> matchText(patterns, page);
            case URL -> matchUrl(patterns, page);
            case LOGO -> matchLogo(patterns, page);
        };
    }

    static double textConfidence(int matchCount) {
        return Math.min(0.9, 0.3 + 0.2 * matchCount);
    }

    private Optional<PatternMatch> matchText(List<String> patterns, PageResult page) {
        if (page.content().isEmpty()) {
            return Optional.empty();
        }
        String content = normalize(page.content());
        List<String> matched = new ArrayList<>();
        String firstContext = null;
        for (String pattern : patterns) {
            String needle = normalize(pattern);
            if (needle.isEmpty()) {
                continue;
            }
            int idx = content.indexOf(needle);
            if (idx < 0) {
                continue;
            }
            matched.add(pattern);
            if (firstContext == null) {
                int from = Math.max(0, idx - CONTEXT_CHARS);
                int to = Math.min(content.length(), idx + needle.length() + CONTEXT_CHARS);
                firstContext = content.substring(from, to).trim();
            }
        }
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        String evidence = "'" + matched.get(0) + "' found in context: " + firstContext;
        return Optional.of(new PatternMatch(true, textConfidence(matched.size()), PatternType.TEXT.key(), evidence, page.url()));
    }

    private Optional<PatternMatch> matchUrl(List<String> patterns, PageResult page) {
        String pageUrl = normalize(page.url());
        for (String pattern : patterns) {
            String needle = normalize(pattern);
            if (!needle.isEmpty() && pageUrl.contains(needle)) {
                String evidence = "URL contains '" + pattern + "': " + page.url();
                return Optional.of(new PatternMatch(true, URL_ON_PAGE_CONFIDENCE, PatternType.URL.key(), evidence, page.url()));
            }
        }
        for (String link : page.links()) {
            String haystack = normalize(link);
            for (String pattern : patterns) {
                String needle = normalize(pattern);
                if (!needle.isEmpty() && haystack.contains(needle)) {
                    String evidence = "Link contains '" + pattern + "': " + link;
                    return Optional.of(new PatternMatch(true, URL_IN_LINK_CONFIDENCE, PatternType.URL.key(), evidence, page.url()));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<PatternMatch> matchLogo(List<String> patterns, PageResult page) {
        if (page.content().isEmpty()) {
            return Optional.empty();
        }
        String content = normalize(page.content());
        for (String pattern : patterns) {
            String needle = normalize(pattern);
            if (needle.isEmpty()) {
                continue;
            }
            for (String indicator : logoIndicators(needle)) {
                if (content.contains(indicator)) {
                    String evidence = "Logo pattern '" + pattern + "' found: " + indicator;
                    return Optional.of(new PatternMatch(true, LOGO_CONFIDENCE, PatternType.LOGO.key(), evidence, page.url()));
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> logoIndicators(String pattern) {
        return List.of(
            "alt=\"" + pattern + "\"",
            "alt='" + pattern + "'",
            pattern + ".png",
            pattern + ".jpg",
            pattern + ".svg",
            "logo/" + pattern,
            "images/" + pattern
        );
    }

    private String normalize(String value) {
        if (value == null) {
            return "";
        }
        return caseSensitive ? value : value.toLowerCase(Locale.ROOT);
    }
}

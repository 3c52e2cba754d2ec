package com.openness.crawler.crawl.util;

import com.openness.crawler.crawl.links.LinkClassifier;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Human readable labels derived from URL paths, used for LLM candidate lists and status messages.
 */
public final class PageNames {
    public static final String HOME = "Home";
    public static final String UNKNOWN = "Unknown page";
    private static final Pattern PAGE_EXTENSION = Pattern.compile("\\.(html?|php|aspx?|jsp)$", Pattern.CASE_INSENSITIVE);
    private static final int MAX_SHORT_NAME = 30;

    private PageNames() {
    }

    public static String titleFromUrl(String url) {
        URI uri = LinkClassifier.safeUri(url);
        if (uri == null) {
            return UNKNOWN;
        }
        String path = uri.getPath() == null ? "" : uri.getPath();
        List<String> parts = Arrays.stream(path.split("/")).filter(part -> !part.isBlank()).toList();
        if (parts.isEmpty()) {
            return HOME;
        }
        String last = PAGE_EXTENSION.matcher(parts.get(parts.size() - 1)).replaceAll("");
        String words = last.replace('-', ' ').replace('_', ' ').trim();
        return words.isEmpty() ? UNKNOWN : titleCase(words);
    }

    public static String shortName(String url) {
        String title = titleFromUrl(url);
        if (title.length() > MAX_SHORT_NAME) {
            return title.substring(0, MAX_SHORT_NAME - 3) + "...";
        }
        return title;
    }

    private static String titleCase(String words) {
        StringBuilder out = new StringBuilder(words.length());
        boolean startOfWord = true;
        for (char c : words.toCharArray()) {
            if (Character.isWhitespace(c)) {
                startOfWord = true;
                out.append(c);
            } else if (startOfWord) {
                out.append(Character.toUpperCase(c));
                startOfWord = false;
            } else {
                out.append(Character.toLowerCase(c));
            }
        }
        return out.toString();
    }
}

package com.openness.crawler.crawl.links;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns the raw hrefs of a page into same-host, content-bearing crawl candidates.
 * Candidates keep first-seen order so that bounded strategies are deterministic.
 */
@Component
public class LinkClassifier {
    private static final List<Pattern> EXCLUDED_PATTERNS = List.of(
        Pattern.compile("\\.(pdf|docx?|xlsx?|zip|rar|tar|gz)$"),
        Pattern.compile("\\.(jpe?g|png|gif|svg)$"),
        Pattern.compile("\\.(mp3|mp4|avi|mov)$"),
        Pattern.compile("/login"),
        Pattern.compile("/admin"),
        Pattern.compile("/wp-admin"),
        Pattern.compile("/user"),
        Pattern.compile("/feed"),
        Pattern.compile("/rss"),
        Pattern.compile("mailto:"),
        Pattern.compile("tel:"),
        Pattern.compile("javascript:"),
        Pattern.compile("#"),
        Pattern.compile("\\.xml$")
    );

    public List<String> classify(String baseUrl, List<String> rawLinks) {
        URI base = safeUri(baseUrl);
        if (base == null || base.getHost() == null || rawLinks == null || rawLinks.isEmpty()) {
            return List.of();
        }
        if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
            base = base.resolve("/");
        }
        String baseHost = base.getHost().toLowerCase(Locale.ROOT);
        String canonicalBase = canonicalize(base);

        LinkedHashSet<String> internal = new LinkedHashSet<>();
        for (String href : rawLinks) {
            if (href == null || href.isBlank()) {
                continue;
            }
            URI resolved = resolve(base, href.trim());
            if (resolved == null || resolved.getHost() == null || resolved.getScheme() == null) {
                continue;
            }
            String scheme = resolved.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                continue;
            }
            if (!resolved.getHost().toLowerCase(Locale.ROOT).equals(baseHost)) {
                continue;
            }
            String canonical = canonicalize(resolved);
            if (isExcluded(canonical) || sameResource(canonical, canonicalBase)) {
                continue;
            }
            internal.add(canonical);
        }
        return new ArrayList<>(internal);
    }

    public boolean isExcluded(String url) {
        if (url == null) {
            return true;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (Pattern pattern : EXCLUDED_PATTERNS) {
            if (pattern.matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Scheme, host, optional port and path; query string and fragment are dropped.
     */
    public static String canonicalize(URI uri) {
        StringBuilder builder = new StringBuilder();
        builder.append(uri.getScheme().toLowerCase(Locale.ROOT)).append("://");
        builder.append(uri.getHost().toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            builder.append(':').append(uri.getPort());
        }
        String path = uri.getRawPath();
        builder.append(path == null ? "" : path);
        return builder.toString();
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private URI resolve(URI base, String href) {
        try {
            return base.resolve(new URI(href));
        } catch (URISyntaxException | IllegalArgumentException first) {
            try {
                return base.resolve(new URI(href.replace(" ", "%20")));
            } catch (URISyntaxException | IllegalArgumentException ignored) {
                return null;
            }
        }
    }

    private boolean sameResource(String candidate, String canonicalBase) {
        return stripTrailingSlash(candidate).equals(stripTrailingSlash(canonicalBase));
    }

    private String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

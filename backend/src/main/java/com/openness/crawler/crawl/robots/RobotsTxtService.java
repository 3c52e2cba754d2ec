package com.openness.crawler.crawl.robots;

import com.openness.crawler.crawl.http.PoliteHttpClient;
import com.openness.crawler.crawl.links.LinkClassifier;
import com.openness.crawler.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;

/**
 * Advisory robots.txt lookup. A missing or unreadable file never blocks crawling.
 */
@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final String ROBOTS_ACCEPT = "text/plain,text/*;q=0.9,*/*;q=0.1";

    private final PoliteHttpClient httpClient;

    public RobotsTxtService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public RobotsCheck check(String baseUrl) {
        URI base = LinkClassifier.safeUri(baseUrl);
        if (base == null || base.getHost() == null || base.getScheme() == null) {
            return RobotsCheck.missing();
        }
        String robotsUrl = base.getScheme() + "://" + base.getRawAuthority() + "/robots.txt";
        try {
            HttpFetchResult fetch = httpClient.get(robotsUrl, ROBOTS_ACCEPT);
            if (!fetch.isSuccessful()) {
                log.debug("No robots.txt for {} ({})", base.getHost(), fetch.errorKey());
                return RobotsCheck.missing();
            }
            RobotsRules rules = RobotsRules.parse(fetch.body());
            log.debug(
                "Loaded robots for host {} rules={} sitemaps={} crawlDelay={}",
                base.getHost(),
                rules.getRules().size(),
                rules.getSitemapUrls().size(),
                rules.getCrawlDelaySeconds()
            );
            return new RobotsCheck(
                true,
                rules.getCrawlDelaySeconds(),
                rules.getSitemapUrls(),
                rules.getRules().stream().map(RobotsRules.Rule::describe).toList(),
                rules
            );
        } catch (RuntimeException e) {
            log.warn("robots check failed for {}: {}", baseUrl, e.toString());
            return RobotsCheck.missing();
        }
    }

    public static String pathAndQuery(String url) {
        URI uri = LinkClassifier.safeUri(url);
        if (uri == null) {
            return "/";
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return path;
    }
}

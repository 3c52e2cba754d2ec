package com.openness.crawler.crawl.service;

import com.openness.crawler.config.CrawlerProperties;
import com.openness.crawler.crawl.fetch.PageFetcher;
import com.openness.crawler.crawl.links.LinkClassifier;
import com.openness.crawler.crawl.model.CrawlFailure;
import com.openness.crawler.crawl.model.OrganizationCrawlResult;
import com.openness.crawler.crawl.model.PageResult;
import com.openness.crawler.crawl.robots.RobotsCheck;
import com.openness.crawler.crawl.robots.RobotsTxtService;
import com.openness.crawler.crawl.strategy.CrawlPlan;
import com.openness.crawler.crawl.strategy.CrawlStrategy;
import com.openness.crawler.crawl.strategy.CrawlStrategySelector;
import com.openness.crawler.crawl.util.PageNames;
import com.openness.crawler.llm.LlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Crawls one organization: main page, strategy resolution, then the remaining pages in order.
 * Fetches are strictly sequential and separated by the intra-domain delay.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);
    private static final String INTERRUPTED = "interrupted";

    private final CrawlerProperties properties;
    private final PageFetcher pageFetcher;
    private final LinkClassifier linkClassifier;
    private final CrawlStrategySelector strategySelector;
    private final RobotsTxtService robotsTxtService;
    private final Optional<LlmClient> llmClient;

    public CrawlOrchestratorService(
        CrawlerProperties properties,
        PageFetcher pageFetcher,
        LinkClassifier linkClassifier,
        CrawlStrategySelector strategySelector,
        RobotsTxtService robotsTxtService,
        Optional<LlmClient> llmClient
    ) {
        this.properties = properties;
        this.pageFetcher = pageFetcher;
        this.linkClassifier = linkClassifier;
        this.strategySelector = strategySelector;
        this.robotsTxtService = robotsTxtService;
        this.llmClient = llmClient == null ? Optional.empty() : llmClient;
    }

    public OrganizationCrawlResult crawl(CrawlRequest request, StatusCallback callback) {
        StatusReporter status = new StatusReporter(log, callback);
        Instant started = Instant.now();
        List<PageResult> pages = new ArrayList<>();
        List<CrawlFailure> errors = new ArrayList<>();
        String name = request.organizationName();
        String baseUrl = request.baseUrl();

        try {
            status.report("Crawling main page of " + name + ": " + baseUrl);
            PageResult mainPage = pageFetcher.fetch(baseUrl);
            pages.add(mainPage);
            if (!mainPage.success()) {
                errors.add(new CrawlFailure(baseUrl, "Failed to crawl main page: " + mainPage.errorMessage()));
                status.report("Main page of " + name + " failed: " + mainPage.errorMessage());
                return finish(name, baseUrl, pages, errors, started, isInterrupted(mainPage));
            }

            RobotsCheck robots = properties.getRobots().isEnabled()
                ? robotsTxtService.check(baseUrl)
                : RobotsCheck.missing();
            long delayMs = effectiveDelayMs(robots);

            CrawlStrategy strategy = request.strategy() != null
                ? request.strategy()
                : CrawlStrategy.fromKey(properties.getStrategy());
            int maxPages = request.maxPages() != null ? Math.max(1, request.maxPages()) : properties.getMaxPagesPerSite();
            List<String> internalLinks = linkClassifier.classify(baseUrl, mainPage.links());
            CrawlPlan plan = strategySelector.select(
                strategy,
                name,
                baseUrl,
                internalLinks,
                maxPages,
                request.criteriaNames(),
                llmClient
            );
            List<String> remaining = plan.remainingUrls();
            status.report(
                "Strategy " + plan.strategy().key() + (plan.fellBack() ? " (fallback)" : "")
                    + ": " + internalLinks.size() + " internal links found, " + remaining.size() + " subpages selected"
            );
            if (robots.exists()) {
                remaining.stream()
                    .filter(url -> !robots.isAllowed(RobotsTxtService.pathAndQuery(url)))
                    .forEach(url -> log.info("robots.txt disallows {} (advisory, crawling anyway)", url));
            }

            int total = remaining.size();
            for (int i = 0; i < total; i++) {
                String url = remaining.get(i);
                String label = (i + 1) + "/" + total + " " + PageNames.shortName(url);
                if (!sleep(delayMs)) {
                    status.report("Crawl of " + name + " cancelled before page " + label);
                    return finish(name, baseUrl, pages, errors, started, true);
                }
                status.report("Crawling page " + label);
                PageResult page = pageFetcher.fetch(url);
                pages.add(page);
                if (page.success()) {
                    status.report("Page " + label + " done");
                } else {
                    errors.add(new CrawlFailure(url, page.errorMessage()));
                    status.report("Page " + label + " failed: " + page.errorMessage());
                }
                if (isInterrupted(page)) {
                    status.report("Crawl of " + name + " cancelled after page " + label);
                    return finish(name, baseUrl, pages, errors, started, true);
                }
            }

            OrganizationCrawlResult result = finish(name, baseUrl, pages, errors, started, false);
            status.report(
                "Crawl of " + name + " complete: " + result.successfulPages() + "/" + result.totalPages()
                    + " pages successful in " + result.crawlDuration().toMillis() + " ms"
            );
            return result;
        } catch (RuntimeException e) {
            log.error("Unexpected error while crawling {} ({})", name, baseUrl, e);
            errors.add(new CrawlFailure(baseUrl, "Unexpected crawl error: " + e.getMessage()));
            status.report("Crawl of " + name + " aborted: " + e.getMessage());
            return finish(name, baseUrl, pages, errors, started, false);
        }
    }

    private long effectiveDelayMs(RobotsCheck robots) {
        long configured = properties.getIntraDomainDelayMs();
        if (!properties.getRobots().isHonorCrawlDelay() || robots.crawlDelaySeconds() == null) {
            return configured;
        }
        long robotsDelay = Math.round(robots.crawlDelaySeconds() * 1000);
        return Math.max(configured, robotsDelay);
    }

    private boolean sleep(long delayMs) {
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean isInterrupted(PageResult page) {
        return Thread.currentThread().isInterrupted()
            || (!page.success() && page.errorMessage() != null && page.errorMessage().startsWith(INTERRUPTED));
    }

    private OrganizationCrawlResult finish(
        String name,
        String baseUrl,
        List<PageResult> pages,
        List<CrawlFailure> errors,
        Instant started,
        boolean cancelled
    ) {
        return OrganizationCrawlResult.of(name, baseUrl, pages, Duration.between(started, Instant.now()), errors, cancelled);
    }
}

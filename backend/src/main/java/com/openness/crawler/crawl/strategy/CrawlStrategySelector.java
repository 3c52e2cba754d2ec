package com.openness.crawler.crawl.strategy;

import com.openness.crawler.config.CrawlerProperties;
import com.openness.crawler.crawl.util.PageNames;
import com.openness.crawler.llm.LlmClient;
import com.openness.crawler.llm.SubpageCandidate;
import com.openness.crawler.llm.SubpageSelection;
import com.openness.crawler.llm.SubpageSelectionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the crawl set for one organization from its classified internal links.
 * The LLM client is passed per call so the orchestrator owns which client is used.
 */
@Component
public class CrawlStrategySelector {
    private static final Logger log = LoggerFactory.getLogger(CrawlStrategySelector.class);

    private final CrawlerProperties properties;

    public CrawlStrategySelector(CrawlerProperties properties) {
        this.properties = properties;
    }

    public CrawlPlan select(
        CrawlStrategy strategy,
        String organizationName,
        String baseUrl,
        List<String> internalLinks,
        int maxPages,
        List<String> criteriaNames,
        Optional<LlmClient> llmClient
    ) {
        List<String> links = internalLinks == null ? List.of() : internalLinks;
        int budget = Math.max(1, maxPages);
        return switch (strategy) {
            case HOMEPAGE_ONLY -> new CrawlPlan(List.of(baseUrl), strategy, false, "homepage only");
            case ALL_PAGES -> new CrawlPlan(withBase(baseUrl, links), strategy, false, "all internal pages");
            case LIMITED -> limited(baseUrl, links, budget, strategy, false, "first " + (budget - 1) + " internal links");
            case INTELLIGENT -> intelligent(organizationName, baseUrl, links, budget, criteriaNames, llmClient);
        };
    }

    private CrawlPlan intelligent(
        String organizationName,
        String baseUrl,
        List<String> links,
        int budget,
        List<String> criteriaNames,
        Optional<LlmClient> llmClient
    ) {
        int wanted = budget - 1;
        if (links.isEmpty() || wanted == 0) {
            return new CrawlPlan(List.of(baseUrl), CrawlStrategy.INTELLIGENT, false, "no subpages to select");
        }
        if (llmClient.isEmpty() || criteriaNames == null || criteriaNames.isEmpty()) {
            log.info("No LLM client or criteria for {}, using limited selection", baseUrl);
            return limited(baseUrl, links, budget, CrawlStrategy.INTELLIGENT, true, "LLM unavailable");
        }

        List<SubpageCandidate> candidates = links.stream()
            .limit(properties.getLlm().getMaxCandidates())
            .map(url -> new SubpageCandidate(url, PageNames.titleFromUrl(url)))
            .toList();
        Set<String> allowed = new LinkedHashSet<>();
        candidates.forEach(candidate -> allowed.add(candidate.url()));

        try {
            SubpageSelection selection = llmClient.get().selectSubpages(
                new SubpageSelectionRequest(organizationName, baseUrl, candidates, criteriaNames, wanted)
            );
            LinkedHashSet<String> chosen = new LinkedHashSet<>();
            for (String url : selection.selectedUrls()) {
                if (chosen.size() >= wanted) {
                    break;
                }
                if (allowed.contains(url)) {
                    chosen.add(url);
                }
            }
            if (chosen.isEmpty()) {
                log.warn("LLM selected no usable subpages for {}, falling back to limited", baseUrl);
                return limited(baseUrl, links, budget, CrawlStrategy.INTELLIGENT, true, "empty LLM selection");
            }
            if (chosen.size() < wanted) {
                log.info("LLM selected {} of {} requested subpages for {}", chosen.size(), wanted, baseUrl);
            }
            return new CrawlPlan(withBase(baseUrl, new ArrayList<>(chosen)), CrawlStrategy.INTELLIGENT, false, selection.reasoning());
        } catch (RuntimeException e) {
            log.warn("LLM subpage selection failed for {}: {}; falling back to limited", baseUrl, e.toString());
            return limited(baseUrl, links, budget, CrawlStrategy.INTELLIGENT, true, "LLM selection failed");
        }
    }

    private CrawlPlan limited(String baseUrl, List<String> links, int budget, CrawlStrategy strategy, boolean fellBack, String reasoning) {
        List<String> subset = links.subList(0, Math.min(links.size(), budget - 1));
        return new CrawlPlan(withBase(baseUrl, subset), strategy, fellBack, reasoning);
    }

    private static List<String> withBase(String baseUrl, List<String> links) {
        List<String> urls = new ArrayList<>(links.size() + 1);
        urls.add(baseUrl);
        urls.addAll(links);
        return urls;
    }
}

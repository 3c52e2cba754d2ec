package com.openness.crawler.evaluation;

import com.openness.crawler.catalog.CriteriaCatalog;
import com.openness.crawler.catalog.CriterionDefinition;
import com.openness.crawler.config.CrawlerProperties;
import com.openness.crawler.crawl.model.OrganizationCrawlResult;
import com.openness.crawler.crawl.model.PageResult;
import com.openness.crawler.llm.LlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scores every catalog criterion against the successfully fetched pages of one organization.
 * For each page the evidence sources run in priority order and the single best match is kept.
 */
@Service
public class CriteriaEvaluationEngine {
    private static final Logger log = LoggerFactory.getLogger(CriteriaEvaluationEngine.class);
    static final String NO_EVIDENCE = "No sufficient evidence found";

    private final double defaultThreshold;
    private final List<EvidenceSource> sources;

    @Autowired
    public CriteriaEvaluationEngine(CrawlerProperties properties, PatternMatcher patternMatcher, Optional<LlmClient> llmClient) {
        this(properties.getDefaultConfidenceThreshold(), defaultSources(patternMatcher, llmClient));
    }

    public CriteriaEvaluationEngine(double defaultThreshold, List<EvidenceSource> sources) {
        this.defaultThreshold = defaultThreshold;
        this.sources = List.copyOf(sources);
    }

    private static List<EvidenceSource> defaultSources(PatternMatcher patternMatcher, Optional<LlmClient> llmClient) {
        List<EvidenceSource> sources = new ArrayList<>();
        if (llmClient != null) {
            llmClient.ifPresent(client -> sources.add(new LlmCriterionAnalyzer(client)));
        }
        sources.add(new PatternEvidenceSource(patternMatcher));
        return sources;
    }

    public OrganizationEvaluation evaluate(OrganizationCrawlResult crawlResult, CriteriaCatalog catalog) {
        List<CriterionDefinition> criteria = catalog == null ? List.of() : catalog.criteria();
        List<PageResult> pages = crawlResult.successfulPageList();
        log.info(
            "Evaluating {} criteria for {} across {} pages",
            criteria.size(),
            crawlResult.organizationName(),
            pages.size()
        );

        List<CriterionEvaluation> results = new ArrayList<>(criteria.size());
        for (CriterionDefinition criterion : criteria) {
            try {
                results.add(evaluateCriterion(criterion, pages, crawlResult.baseUrl()));
            } catch (RuntimeException e) {
                log.error("Evaluation of criterion {} failed for {}", criterion.id(), crawlResult.organizationName(), e);
                results.add(unfulfilled(criterion, 0.0, crawlResult.baseUrl()));
            }
        }

        OrganizationEvaluation evaluation = OrganizationEvaluation.of(crawlResult.organizationName(), crawlResult.baseUrl(), results);
        log.info(
            "Evaluation of {} complete: {}/{} criteria fulfilled ({}%)",
            crawlResult.organizationName(),
            evaluation.fulfilledCriteria(),
            evaluation.totalCriteria(),
            String.format("%.1f", evaluation.fulfillmentPercentage())
        );
        return evaluation;
    }

    CriterionEvaluation evaluateCriterion(CriterionDefinition criterion, List<PageResult> pages, String baseUrl) {
        PatternMatch best = null;
        double bestConfidence = 0.0;
        for (PageResult page : pages) {
            if (!page.success()) {
                continue;
            }
            for (EvidenceSource source : sources) {
                if (bestConfidence >= source.activationCeiling()) {
                    continue;
                }
                Optional<PatternMatch> match = source.evaluate(page, criterion);
                if (match.isPresent() && match.get().matched() && match.get().confidence() > bestConfidence) {
                    best = match.get();
                    bestConfidence = best.confidence();
                }
            }
        }

        double threshold = criterion.effectiveThreshold(defaultThreshold);
        if (best != null && bestConfidence >= threshold) {
            return new CriterionEvaluation(
                criterion.id(),
                criterion.name(),
                criterion.dimension(),
                criterion.factor(),
                criterion.type(),
                true,
                bestConfidence,
                "Evidence found via " + best.patternType() + " match: " + best.evidence(),
                best.sourceUrl(),
                best.evidence(),
                best.patternType()
            );
        }
        return unfulfilled(criterion, bestConfidence, baseUrl);
    }

    private CriterionEvaluation unfulfilled(CriterionDefinition criterion, double confidence, String baseUrl) {
        return new CriterionEvaluation(
            criterion.id(),
            criterion.name(),
            criterion.dimension(),
            criterion.factor(),
            criterion.type(),
            false,
            confidence,
            NO_EVIDENCE,
            baseUrl,
            "",
            ""
        );
    }
}

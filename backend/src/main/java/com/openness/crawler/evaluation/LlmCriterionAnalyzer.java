package com.openness.crawler.evaluation;

import com.openness.crawler.catalog.CriterionDefinition;
import com.openness.crawler.crawl.model.PageResult;
import com.openness.crawler.llm.CriterionAnalysis;
import com.openness.crawler.llm.CriterionAnalysisRequest;
import com.openness.crawler.llm.LlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Semantic check of one page against one criterion. Failures and negative verdicts yield no evidence.
 */
public class LlmCriterionAnalyzer implements EvidenceSource {
    private static final Logger log = LoggerFactory.getLogger(LlmCriterionAnalyzer.class);

    private final LlmClient llmClient;

    public LlmCriterionAnalyzer(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public String name() {
        return PatternMatch.LLM;
    }

    @Override
    public double activationCeiling() {
        return Double.POSITIVE_INFINITY;
    }

    @Override
    public Optional<PatternMatch> evaluate(PageResult page, CriterionDefinition criterion) {
        List<String> hints = criterion.allPatterns();
        if (hints.isEmpty()) {
            return Optional.empty();
        }
        try {
            CriterionAnalysis analysis = llmClient.analyzeCriterion(new CriterionAnalysisRequest(
                page.content(),
                criterion.name(),
                criterion.description(),
                hints,
                page.url()
            ));
            if (analysis == null || !analysis.fulfilled()) {
                return Optional.empty();
            }
            String evidence = analysis.evidence().isEmpty()
                ? analysis.justification()
                : String.join("; ", analysis.evidence());
            log.debug("LLM evidence for {} on {} confidence={}", criterion.id(), page.url(), analysis.confidence());
            return Optional.of(new PatternMatch(true, analysis.confidence(), PatternMatch.LLM, evidence, page.url()));
        } catch (RuntimeException e) {
            log.warn("LLM analysis failed for criterion {} on {}: {}", criterion.id(), page.url(), e.toString());
            return Optional.empty();
        }
    }
}

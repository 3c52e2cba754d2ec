package com.openness.crawler.evaluation;

import com.openness.crawler.TestCrawlerProperties;
import com.openness.crawler.catalog.CatalogMetadata;
import com.openness.crawler.catalog.CriteriaCatalog;
import com.openness.crawler.catalog.CriterionDefinition;
import com.openness.crawler.catalog.CriterionType;
import com.openness.crawler.catalog.PatternType;
import com.openness.crawler.crawl.model.OrganizationCrawlResult;
import com.openness.crawler.crawl.model.PageResult;
import com.openness.crawler.llm.CriterionAnalysis;
import com.openness.crawler.llm.LlmClient;
import com.openness.crawler.llm.LlmException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.openness.crawler.evaluation.EvaluationFixtures.criterion;
import static com.openness.crawler.evaluation.EvaluationFixtures.page;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CriteriaEvaluationEngineTest {
    private static final String BASE = "https://example.org/";

    @Mock
    private LlmClient llmClient;

    private final PatternMatcher patternMatcher = new PatternMatcher(TestCrawlerProperties.fast());

    @Test
    void singleTextHitFulfilsLowThresholdCriterion() {
        CriterionDefinition jahresbericht = criterion("jahresbericht", 0.3, Map.of(PatternType.TEXT, List.of("jahresbericht")));

        OrganizationEvaluation evaluation = engine(Optional.empty()).evaluate(
            crawl(page(BASE, "Unser Jahresbericht ist online.")),
            catalog(jahresbericht)
        );

        CriterionEvaluation result = evaluation.criteriaResults().get(0);
        assertThat(result.evaluation()).isTrue();
        assertThat(result.confidence()).isCloseTo(0.5, within(1e-9));
        assertThat(result.patternType()).isEqualTo("text");
        assertThat(result.sourceUrl()).isEqualTo(BASE);
        assertThat(result.justification()).startsWith("Evidence found via text match: 'jahresbericht'");
    }

    @Test
    void patternHitAboveLowSignalBarStopsPatternScanOnLaterPages() {
        CriterionDefinition openData = criterion("open_data", 0.5, Map.of(
            PatternType.URL, List.of("/open-data"),
            PatternType.TEXT, List.of("open data", "offene daten", "datenportal")
        ));
        PageResult pageA = page("https://example.org/open-data", "Startseite");
        PageResult pageB = page("https://example.org/daten", "Open Data, offene Daten und unser Datenportal");

        OrganizationEvaluation evaluation = engine(Optional.empty()).evaluate(crawl(pageA, pageB), catalog(openData));

        CriterionEvaluation result = evaluation.criteriaResults().get(0);
        assertThat(result.confidence()).isCloseTo(0.8, within(1e-9));
        assertThat(result.sourceUrl()).isEqualTo("https://example.org/open-data");
        assertThat(result.patternType()).isEqualTo("url");
    }

    @Test
    void subThresholdEvidenceIsReportedButNotFulfilled() {
        CriterionDefinition strict = criterion("strict", 0.95, Map.of(PatternType.TEXT, List.of("jahresbericht")));

        CriterionEvaluation result = engine(Optional.empty())
            .evaluate(crawl(page(BASE, "jahresbericht")), catalog(strict))
            .criteriaResults().get(0);

        assertThat(result.evaluation()).isFalse();
        assertThat(result.confidence()).isCloseTo(0.5, within(1e-9));
        assertThat(result.justification()).isEqualTo("No sufficient evidence found");
        assertThat(result.sourceUrl()).isEqualTo(BASE);
        assertThat(result.patternType()).isEmpty();
        assertThat(result.evidenceText()).isEmpty();
    }

    @Test
    void missingThresholdUsesEvaluatorDefault() {
        CriterionDefinition noThreshold = criterion("default", null, Map.of(PatternType.TEXT, List.of("jahresbericht")));
        CriteriaEvaluationEngine engine = new CriteriaEvaluationEngine(0.6, List.of(new PatternEvidenceSource(patternMatcher)));

        CriterionEvaluation result = engine.evaluate(crawl(page(BASE, "jahresbericht")), catalog(noThreshold))
            .criteriaResults().get(0);

        assertThat(result.evaluation()).isFalse();
    }

    @Test
    void confidentLlmVerdictSkipsPatternMatching() {
        CriterionDefinition openData = criterion("open_data", 0.5, Map.of(PatternType.URL, List.of("/open-data")));
        when(llmClient.analyzeCriterion(any())).thenReturn(new CriterionAnalysis(true, 0.75, "portal described", List.of("Datenportal")));

        CriterionEvaluation result = engine(Optional.of(llmClient))
            .evaluate(crawl(page("https://example.org/open-data", "Datenportal")), catalog(openData))
            .criteriaResults().get(0);

        assertThat(result.patternType()).isEqualTo("llm");
        assertThat(result.confidence()).isEqualTo(0.75);
        assertThat(result.evidenceText()).isEqualTo("Datenportal");
    }

    @Test
    void llmFailureStillRunsPatternFallback() {
        CriterionDefinition jahresbericht = criterion("jahresbericht", 0.3, Map.of(PatternType.TEXT, List.of("jahresbericht")));
        when(llmClient.analyzeCriterion(any())).thenThrow(new LlmException("timeout"));

        CriterionEvaluation result = engine(Optional.of(llmClient))
            .evaluate(crawl(page(BASE, "jahresbericht")), catalog(jahresbericht))
            .criteriaResults().get(0);

        assertThat(result.evaluation()).isTrue();
        assertThat(result.patternType()).isEqualTo("text");
    }

    @Test
    void llmRunsOnEveryPageAndCanOvertakePatterns() {
        CriterionDefinition jahresbericht = criterion("jahresbericht", 0.3, Map.of(PatternType.TEXT, List.of("jahresbericht")));
        when(llmClient.analyzeCriterion(any()))
            .thenReturn(new CriterionAnalysis(false, 0.0, "nothing", List.of()))
            .thenReturn(new CriterionAnalysis(true, 0.85, "annual report linked", List.of()));

        CriterionEvaluation result = engine(Optional.of(llmClient))
            .evaluate(crawl(page(BASE, "jahresbericht"), page("https://example.org/berichte", "Berichte")), catalog(jahresbericht))
            .criteriaResults().get(0);

        verify(llmClient, times(2)).analyzeCriterion(any());
        assertThat(result.patternType()).isEqualTo("llm");
        assertThat(result.confidence()).isEqualTo(0.85);
        assertThat(result.evidenceText()).isEqualTo("annual report linked");
        assertThat(result.sourceUrl()).isEqualTo("https://example.org/berichte");
    }

    @Test
    void failedPagesAreSkipped() {
        CriterionDefinition jahresbericht = criterion("jahresbericht", 0.3, Map.of(PatternType.URL, List.of("jahresbericht")));
        PageResult failed = PageResult.failure("https://example.org/jahresbericht", "HTTP 404", Instant.now());

        OrganizationEvaluation evaluation = engine(Optional.of(llmClient)).evaluate(
            crawl(page(BASE, "Start"), failed),
            catalog(jahresbericht)
        );

        assertThat(evaluation.fulfilledCriteria()).isZero();
        verify(llmClient, times(1)).analyzeCriterion(any());
    }

    @Test
    void criteriaWithoutPatternsNeverReachTheLlm() {
        CriterionDefinition bare = criterion("bare", 0.3, Map.of());

        engine(Optional.of(llmClient)).evaluate(crawl(page(BASE, "text")), catalog(bare));

        verify(llmClient, never()).analyzeCriterion(any());
    }

    @Test
    void aggregatesCountsPercentagesAndSummary() {
        CriterionDefinition hit = criterion("hit", 0.3, Map.of(PatternType.TEXT, List.of("jahresbericht")));
        CriterionDefinition miss = new CriterionDefinition(
            "miss",
            "offenes_wissen",
            "open_access",
            "Open access policy",
            "",
            CriterionType.STRATEGIC,
            Map.of(PatternType.TEXT, List.of("open access policy")),
            1.0,
            0.5
        );

        OrganizationEvaluation evaluation = engine(Optional.empty())
            .evaluate(crawl(page(BASE, "jahresbericht")), catalog(hit, miss));

        assertThat(evaluation.totalCriteria()).isEqualTo(2);
        assertThat(evaluation.fulfilledCriteria()).isEqualTo(1);
        assertThat(evaluation.fulfillmentPercentage()).isCloseTo(50.0, within(1e-9));
        assertThat(evaluation.averageConfidence()).isCloseTo(0.25, within(1e-9));

        EvaluationSummary summary = evaluation.summary();
        assertThat(summary.byDimension().get("transparenz")).isEqualTo(DimensionSummary.of(1, 1));
        assertThat(summary.byDimension().get("offenes_wissen").percentage()).isZero();
        assertThat(summary.byConfidence()).containsEntry("medium", 1).containsEntry("low", 1).containsEntry("high", 0);
        assertThat(summary.byPatternType()).containsOnly(Map.entry("text", 1));
        assertThat(summary.fulfilledByType()).containsEntry("operational", 1).containsEntry("strategic", 0);
        assertThat(summary.totalByType()).containsEntry("operational", 1).containsEntry("strategic", 1);
    }

    @Test
    void emptyCatalogYieldsZeroCounts() {
        OrganizationEvaluation evaluation = engine(Optional.empty())
            .evaluate(crawl(page(BASE, "jahresbericht")), CriteriaCatalog.empty("none"));

        assertThat(evaluation.totalCriteria()).isZero();
        assertThat(evaluation.fulfilledCriteria()).isZero();
        assertThat(evaluation.fulfillmentPercentage()).isZero();
        assertThat(evaluation.averageConfidence()).isZero();
    }

    @Test
    void crawlWithoutSuccessfulPagesLeavesEveryCriterionUnfulfilled() {
        CriterionDefinition jahresbericht = criterion("jahresbericht", 0.3, Map.of(PatternType.TEXT, List.of("jahresbericht")));
        OrganizationCrawlResult failed = OrganizationCrawlResult.of(
            "Org",
            BASE,
            List.of(PageResult.failure(BASE, "HTTP 500", Instant.now())),
            Duration.ZERO,
            List.of(),
            false
        );

        OrganizationEvaluation evaluation = engine(Optional.empty()).evaluate(failed, catalog(jahresbericht));

        assertThat(evaluation.totalCriteria()).isEqualTo(1);
        assertThat(evaluation.criteriaResults().get(0).evaluation()).isFalse();
        assertThat(evaluation.criteriaResults().get(0).confidence()).isZero();
    }

    private CriteriaEvaluationEngine engine(Optional<LlmClient> llm) {
        return new CriteriaEvaluationEngine(TestCrawlerProperties.fast(), patternMatcher, llm);
    }

    private static OrganizationCrawlResult crawl(PageResult... pages) {
        return OrganizationCrawlResult.of("Org", BASE, List.of(pages), Duration.ofMillis(10), List.of(), false);
    }

    private static CriteriaCatalog catalog(CriterionDefinition... criteria) {
        return new CriteriaCatalog(
            "test",
            new CatalogMetadata("Test", "", "1.0", "test", null, null),
            Map.of("transparenz", "Transparency"),
            List.of(criteria)
        );
    }
}

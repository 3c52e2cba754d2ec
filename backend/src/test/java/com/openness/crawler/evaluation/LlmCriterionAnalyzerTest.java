package com.openness.crawler.evaluation;

import com.openness.crawler.catalog.CriterionDefinition;
import com.openness.crawler.catalog.PatternType;
import com.openness.crawler.llm.CriterionAnalysis;
import com.openness.crawler.llm.CriterionAnalysisRequest;
import com.openness.crawler.llm.LlmClient;
import com.openness.crawler.llm.LlmException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.openness.crawler.evaluation.EvaluationFixtures.criterion;
import static com.openness.crawler.evaluation.EvaluationFixtures.page;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmCriterionAnalyzerTest {

    private final LlmClient llmClient = mock(LlmClient.class);
    private final LlmCriterionAnalyzer analyzer = new LlmCriterionAnalyzer(llmClient);
    private final CriterionDefinition criterion = criterion(
        "open_data",
        0.5,
        Map.of(PatternType.TEXT, List.of("open data"), PatternType.URL, List.of("/daten"))
    );

    @Test
    void sendsPageAndCriterionToModel() {
        when(llmClient.analyzeCriterion(any())).thenReturn(new CriterionAnalysis(false, 0.1, "", List.of()));

        analyzer.evaluate(page("https://example.org/daten", "Inhalt"), criterion);

        ArgumentCaptor<CriterionAnalysisRequest> captor = ArgumentCaptor.forClass(CriterionAnalysisRequest.class);
        verify(llmClient).analyzeCriterion(captor.capture());
        CriterionAnalysisRequest request = captor.getValue();
        assertEquals("Inhalt", request.content());
        assertEquals("Criterion open_data", request.criterionName());
        assertEquals("https://example.org/daten", request.sourceUrl());
        assertThat(request.patterns()).containsExactlyInAnyOrder("open data", "/daten");
    }

    @Test
    void positiveVerdictJoinsEvidence() {
        when(llmClient.analyzeCriterion(any()))
            .thenReturn(new CriterionAnalysis(true, 0.8, "portal found", List.of("GovData", "CSV downloads")));

        Optional<PatternMatch> match = analyzer.evaluate(page("https://example.org/daten", "x"), criterion);

        assertThat(match).isPresent();
        assertEquals("llm", match.get().patternType());
        assertEquals("GovData; CSV downloads", match.get().evidence());
        assertEquals(0.8, match.get().confidence());
        assertEquals("https://example.org/daten", match.get().sourceUrl());
    }

    @Test
    void negativeVerdictIsNoEvidence() {
        when(llmClient.analyzeCriterion(any())).thenReturn(new CriterionAnalysis(false, 0.9, "not present", List.of()));

        assertThat(analyzer.evaluate(page("https://example.org/", "x"), criterion)).isEmpty();
    }

    @Test
    void clientFailureIsNoEvidence() {
        when(llmClient.analyzeCriterion(any())).thenThrow(new LlmException("rate limited"));

        assertThat(analyzer.evaluate(page("https://example.org/", "x"), criterion)).isEmpty();
    }

    @Test
    void alwaysActiveRegardlessOfCurrentBest() {
        assertThat(analyzer.activationCeiling()).isEqualTo(Double.POSITIVE_INFINITY);
    }
}

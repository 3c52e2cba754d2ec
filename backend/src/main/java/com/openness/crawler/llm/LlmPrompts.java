package com.openness.crawler.llm;

import java.util.stream.Collectors;

final class LlmPrompts {
    static final String ANALYSIS_SYSTEM = """
        You are an expert in assessing the openness of organizations. \
        You analyse website content (often in German) and decide whether a given criterion is fulfilled. \
        Always answer with a single JSON object.""";

    static final String SELECTION_SYSTEM = """
        You are an expert in organizational analysis and openness assessment. \
        Select the web pages most likely to contain evidence for openness criteria. \
        Always answer with a single JSON object.""";

    private LlmPrompts() {
    }

    static String analysis(CriterionAnalysisRequest request, String excerpt) {
        String source = request.sourceUrl().isBlank() ? "" : "\nSOURCE: " + request.sourceUrl();
        return """
            Analyse the following website content and decide whether the criterion "%s" is fulfilled.%s

            CRITERION:
            Name: %s
            Description: %s
            Search terms: %s

            WEBSITE CONTENT:
            %s

            TASK:
            Decide whether the criterion is fulfilled based on the content. Consider:
            1. Direct mentions of the search terms
            2. Agreement with the criterion description
            3. Context and meaning of the information found

            RESPONSE FORMAT (JSON):
            {
                "fulfilled": true/false,
                "confidence": 0.0-1.0,
                "justification": "reason for the verdict",
                "evidence": ["quoted evidence"]
            }

            Respond with the JSON object only.
            """.formatted(
            request.criterionName(),
            source,
            request.criterionName(),
            request.criterionDescription(),
            String.join(", ", request.patterns()),
            excerpt
        );
    }

    static String selection(SubpageSelectionRequest request) {
        String pages = request.candidates().stream()
            .map(candidate -> "- " + candidate.title() + ": " + candidate.url())
            .collect(Collectors.joining("\n"));
        String criteria = request.criteriaNames().stream()
            .map(name -> "- " + name)
            .collect(Collectors.joining("\n"));
        return """
            Select the %d best subpages for assessing openness criteria.

            ORGANIZATION: %s
            HOMEPAGE: %s

            CRITERIA TO ASSESS:
            %s

            AVAILABLE SUBPAGES:
            %s

            TASK:
            Pick the %d subpages most likely to contain relevant information. Prefer pages about the \
            organization, transparency, publications, open data, research, projects, governance, \
            accessibility and services, and cover different areas of the organization.

            RESPONSE FORMAT (JSON):
            {
                "selected_urls": ["url1", "url2"],
                "reasoning": "why these pages",
                "relevance_scores": {"url1": 0.9, "url2": 0.8}
            }

            Select exactly %d URLs, ordered by relevance (highest first).
            """.formatted(
            request.maxPages(),
            request.organizationName(),
            request.baseUrl(),
            criteria,
            pages,
            request.maxPages(),
            request.maxPages()
        );
    }
}

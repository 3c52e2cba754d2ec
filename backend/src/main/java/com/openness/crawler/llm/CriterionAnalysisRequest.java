package com.openness.crawler.llm;

import java.util.List;

public record CriterionAnalysisRequest(
    String content,
    String criterionName,
    String criterionDescription,
    List<String> patterns,
    String sourceUrl
) {
    public CriterionAnalysisRequest {
        content = content == null ? "" : content;
        criterionDescription = criterionDescription == null ? "" : criterionDescription;
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        sourceUrl = sourceUrl == null ? "" : sourceUrl;
    }
}

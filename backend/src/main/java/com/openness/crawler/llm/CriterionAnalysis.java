package com.openness.crawler.llm;

import java.util.List;

public record CriterionAnalysis(
    boolean fulfilled,
    double confidence,
    String justification,
    List<String> evidence
) {
    public CriterionAnalysis {
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        justification = justification == null ? "" : justification;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}

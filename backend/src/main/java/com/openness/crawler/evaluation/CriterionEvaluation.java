package com.openness.crawler.evaluation;

import com.openness.crawler.catalog.CriterionType;

public record CriterionEvaluation(
    String criterionId,
    String criterionName,
    String dimension,
    String factor,
    CriterionType criterionType,
    boolean evaluation,
    double confidence,
    String justification,
    String sourceUrl,
    String evidenceText,
    String patternType
) {
    public CriterionEvaluation {
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        justification = justification == null ? "" : justification;
        evidenceText = evidenceText == null ? "" : evidenceText;
        patternType = patternType == null ? "" : patternType;
    }
}

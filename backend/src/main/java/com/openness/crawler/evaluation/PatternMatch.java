package com.openness.crawler.evaluation;

/**
 * One piece of evidence for a criterion on one page. {@code patternType} is "llm", "text", "url" or "logo".
 */
public record PatternMatch(
    boolean matched,
    double confidence,
    String patternType,
    String evidence,
    String sourceUrl
) {
    public static final String LLM = "llm";

    public PatternMatch {
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        evidence = evidence == null ? "" : evidence;
    }
}

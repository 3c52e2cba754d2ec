package com.openness.crawler.llm;

import java.util.List;
import java.util.Map;

/**
 * URLs ranked best-first by the model, with its reasoning and per-URL relevance.
 */
public record SubpageSelection(
    List<String> selectedUrls,
    String reasoning,
    Map<String, Double> relevanceScores
) {
    public SubpageSelection {
        selectedUrls = selectedUrls == null ? List.of() : List.copyOf(selectedUrls);
        reasoning = reasoning == null ? "" : reasoning;
        relevanceScores = relevanceScores == null ? Map.of() : Map.copyOf(relevanceScores);
    }
}

package com.openness.crawler.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One flattened catalog criterion. Pattern types keep catalog order.
 * A null confidence threshold means "use the evaluator default".
 */
public record CriterionDefinition(
    String id,
    String dimension,
    String factor,
    String name,
    String description,
    CriterionType type,
    Map<PatternType, List<String>> patterns,
    double weight,
    Double confidenceThreshold
) {
    public CriterionDefinition {
        description = description == null ? "" : description;
        Map<PatternType, List<String>> copy = new LinkedHashMap<>();
        if (patterns != null) {
            patterns.forEach((patternType, list) -> copy.put(patternType, list == null ? List.of() : List.copyOf(list)));
        }
        patterns = Collections.unmodifiableMap(copy);
    }

    public List<String> allPatterns() {
        List<String> all = new ArrayList<>();
        patterns.values().forEach(all::addAll);
        return all;
    }

    public double effectiveThreshold(double defaultThreshold) {
        return confidenceThreshold == null ? defaultThreshold : confidenceThreshold;
    }
}

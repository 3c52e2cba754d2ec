package com.openness.crawler.evaluation;

import com.openness.crawler.catalog.CriterionDefinition;
import com.openness.crawler.catalog.PatternType;
import com.openness.crawler.crawl.model.PageResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every configured pattern type of a criterion and keeps the strongest hit (first one on ties).
 */
public class PatternEvidenceSource implements EvidenceSource {
    public static final double LOW_SIGNAL_BAR = 0.3;

    private final PatternMatcher matcher;

    public PatternEvidenceSource(PatternMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public String name() {
        return "patterns";
    }

    @Override
    public double activationCeiling() {
        return LOW_SIGNAL_BAR;
    }

    @Override
    public Optional<PatternMatch> evaluate(PageResult page, CriterionDefinition criterion) {
        PatternMatch best = null;
        for (Map.Entry<PatternType, List<String>> entry : criterion.patterns().entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            Optional<PatternMatch> match = matcher.match(entry.getKey(), entry.getValue(), page);
            if (match.isPresent() && (best == null || match.get().confidence() > best.confidence())) {
                best = match.get();
            }
        }
        return Optional.ofNullable(best);
    }
}

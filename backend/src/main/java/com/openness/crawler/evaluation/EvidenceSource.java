package com.openness.crawler.evaluation;

import com.openness.crawler.catalog.CriterionDefinition;
import com.openness.crawler.crawl.model.PageResult;

import java.util.Optional;

/**
 * One way of finding evidence for a criterion on a page. Sources are consulted in priority order;
 * a source only runs while the best confidence found so far is below its activation ceiling.
 */
public interface EvidenceSource {

    String name();

    double activationCeiling();

    Optional<PatternMatch> evaluate(PageResult page, CriterionDefinition criterion);
}

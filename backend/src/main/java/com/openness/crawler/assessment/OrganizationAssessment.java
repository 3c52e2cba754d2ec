package com.openness.crawler.assessment;

import com.openness.crawler.crawl.model.OrganizationCrawlResult;
import com.openness.crawler.evaluation.OrganizationEvaluation;

public record OrganizationAssessment(OrganizationCrawlResult crawl, OrganizationEvaluation evaluation) {
}

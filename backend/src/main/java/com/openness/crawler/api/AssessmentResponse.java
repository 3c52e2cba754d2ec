package com.openness.crawler.api;

import com.openness.crawler.assessment.OrganizationAssessment;
import com.openness.crawler.evaluation.OrganizationEvaluation;

public record AssessmentResponse(CrawlSummaryView crawl, OrganizationEvaluation evaluation) {

    public static AssessmentResponse of(OrganizationAssessment assessment) {
        return new AssessmentResponse(CrawlSummaryView.of(assessment.crawl()), assessment.evaluation());
    }
}

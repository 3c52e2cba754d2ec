package com.openness.crawler.assessment;

import com.openness.crawler.crawl.model.OrganizationCrawlResult;
import com.openness.crawler.evaluation.OrganizationEvaluation;

import java.time.Instant;
import java.util.List;

public record AssessmentRunSummary(
    String catalogName,
    Instant startedAt,
    Instant finishedAt,
    AssessmentRunStatus status,
    int requestedOrganizations,
    List<OrganizationAssessment> assessments
) {
    public AssessmentRunSummary {
        assessments = assessments == null ? List.of() : List.copyOf(assessments);
    }

    public List<OrganizationCrawlResult> crawlResults() {
        return assessments.stream().map(OrganizationAssessment::crawl).toList();
    }

    public List<OrganizationEvaluation> evaluations() {
        return assessments.stream().map(OrganizationAssessment::evaluation).toList();
    }
}

package com.openness.crawler.api;

import com.openness.crawler.assessment.AssessmentRunStatus;
import com.openness.crawler.statistics.AssessmentStatistics;

import java.time.Instant;
import java.util.List;

public record BatchAssessmentResponse(
    String catalog,
    AssessmentRunStatus status,
    Instant startedAt,
    Instant finishedAt,
    List<AssessmentResponse> results,
    AssessmentStatistics statistics
) {
}

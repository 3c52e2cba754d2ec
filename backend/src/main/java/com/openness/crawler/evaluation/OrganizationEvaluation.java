package com.openness.crawler.evaluation;

import java.time.Instant;
import java.util.List;

public record OrganizationEvaluation(
    String organizationName,
    String baseUrl,
    List<CriterionEvaluation> criteriaResults,
    int totalCriteria,
    int fulfilledCriteria,
    double fulfillmentPercentage,
    double averageConfidence,
    EvaluationSummary summary,
    Instant evaluatedAt
) {
    public OrganizationEvaluation {
        criteriaResults = criteriaResults == null ? List.of() : List.copyOf(criteriaResults);
    }

    /**
     * Derives counts, percentage and mean confidence from the results. Unfulfilled criteria count towards the mean.
     */
    public static OrganizationEvaluation of(String organizationName, String baseUrl, List<CriterionEvaluation> results) {
        List<CriterionEvaluation> safe = results == null ? List.of() : results;
        int total = safe.size();
        int fulfilled = (int) safe.stream().filter(CriterionEvaluation::evaluation).count();
        double percentage = total == 0 ? 0.0 : fulfilled * 100.0 / total;
        double average = safe.stream().mapToDouble(CriterionEvaluation::confidence).average().orElse(0.0);
        return new OrganizationEvaluation(
            organizationName,
            baseUrl,
            safe,
            total,
            fulfilled,
            percentage,
            average,
            EvaluationSummary.from(safe),
            Instant.now()
        );
    }
}

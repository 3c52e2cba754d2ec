package com.openness.crawler.statistics;

import com.openness.crawler.crawl.model.CrawlFailure;
import com.openness.crawler.crawl.model.OrganizationCrawlResult;
import com.openness.crawler.evaluation.CriterionEvaluation;
import com.openness.crawler.evaluation.DimensionSummary;
import com.openness.crawler.evaluation.EvaluationSummary;
import com.openness.crawler.evaluation.OrganizationEvaluation;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cross-organization statistics over one assessment run.
 */
@Service
public class StatisticsService {
    static final int RANKING_SIZE = 10;
    static final double MANUAL_REVIEW_BELOW = 0.3;
    private static final Pattern ERROR_CODE = Pattern.compile("([a-z][a-z0-9_]*):");
    private static final Pattern HTTP_STATUS = Pattern.compile("HTTP (\\d{3})");

    public AssessmentStatistics collect(
        String catalogName,
        List<OrganizationEvaluation> evaluations,
        List<OrganizationCrawlResult> crawlResults
    ) {
        List<OrganizationEvaluation> safeEvaluations = evaluations == null ? List.of() : evaluations;
        List<OrganizationCrawlResult> safeCrawls = crawlResults == null ? List.of() : crawlResults;
        return new AssessmentStatistics(
            catalogName,
            Instant.now(),
            crawling(safeCrawls),
            criteria(safeEvaluations),
            comparison(safeEvaluations)
        );
    }

    CrawlingStatistics crawling(List<OrganizationCrawlResult> crawls) {
        int total = crawls.size();
        int successful = (int) crawls.stream().filter(crawl -> !crawl.mainPageFailed()).count();
        int pages = crawls.stream().mapToInt(OrganizationCrawlResult::totalPages).sum();
        int successfulPages = crawls.stream().mapToInt(OrganizationCrawlResult::successfulPages).sum();
        Duration duration = crawls.stream()
            .map(OrganizationCrawlResult::crawlDuration)
            .reduce(Duration.ZERO, Duration::plus);
        Map<String, Integer> errorTypes = new LinkedHashMap<>();
        for (OrganizationCrawlResult crawl : crawls) {
            for (CrawlFailure failure : crawl.errors()) {
                errorTypes.merge(errorType(failure.message()), 1, Integer::sum);
            }
        }
        return new CrawlingStatistics(
            total,
            successful,
            total - successful,
            pages,
            successfulPages,
            total == 0 ? 0.0 : (double) pages / total,
            duration,
            total == 0 ? 0.0 : duration.toMillis() / 1000.0 / total,
            errorTypes
        );
    }

    CriteriaStatistics criteria(List<OrganizationEvaluation> evaluations) {
        List<CriterionEvaluation> all = new ArrayList<>();
        evaluations.forEach(evaluation -> all.addAll(evaluation.criteriaResults()));

        Map<String, int[]> hits = new LinkedHashMap<>();
        Map<String, Double> confidenceSums = new LinkedHashMap<>();
        Map<String, Map<String, Integer>> patternHits = new LinkedHashMap<>();
        int high = 0;
        int medium = 0;
        int low = 0;
        int manualReview = 0;
        for (CriterionEvaluation result : all) {
            int[] counts = hits.computeIfAbsent(result.criterionId(), key -> new int[2]);
            counts[1]++;
            if (result.evaluation()) {
                counts[0]++;
            }
            confidenceSums.merge(result.criterionId(), result.confidence(), Double::sum);

            switch (EvaluationSummary.confidenceBand(result.confidence())) {
                case EvaluationSummary.HIGH -> high++;
                case EvaluationSummary.MEDIUM -> medium++;
                default -> low++;
            }
            if (result.confidence() < MANUAL_REVIEW_BELOW) {
                manualReview++;
            }
            if (result.evaluation() && !result.patternType().isEmpty()) {
                patternHits
                    .computeIfAbsent(result.patternType(), key -> new LinkedHashMap<>())
                    .merge(result.criterionName(), 1, Integer::sum);
            }
        }

        Map<String, Double> hitRate = new LinkedHashMap<>();
        Map<String, Double> averageConfidence = new LinkedHashMap<>();
        hits.forEach((id, counts) -> {
            hitRate.put(id, counts[0] * 100.0 / counts[1]);
            averageConfidence.put(id, confidenceSums.get(id) / counts[1]);
        });

        long fulfilled = all.stream().filter(CriterionEvaluation::evaluation).count();
        double overallRate = all.isEmpty() ? 0.0 : fulfilled * 100.0 / all.size();
        double overallConfidence = all.stream().mapToDouble(CriterionEvaluation::confidence).average().orElse(0.0);
        return new CriteriaStatistics(
            overallRate,
            overallConfidence,
            hitRate,
            averageConfidence,
            high,
            medium,
            low,
            manualReview,
            patternHits
        );
    }

    ComparisonStatistics comparison(List<OrganizationEvaluation> evaluations) {
        List<OrganizationRanking> ranking = evaluations.stream()
            .map(evaluation -> new OrganizationRanking(evaluation.organizationName(), evaluation.fulfillmentPercentage()))
            .sorted(Comparator.comparingDouble(OrganizationRanking::fulfillmentPercentage).reversed())
            .toList();
        List<OrganizationRanking> top = ranking.subList(0, Math.min(RANKING_SIZE, ranking.size()));
        List<OrganizationRanking> bottom = ranking.subList(Math.max(0, ranking.size() - RANKING_SIZE), ranking.size());

        Map<String, int[]> dimensionTotals = new LinkedHashMap<>();
        for (OrganizationEvaluation evaluation : evaluations) {
            for (Map.Entry<String, DimensionSummary> entry : evaluation.summary().byDimension().entrySet()) {
                int[] totals = dimensionTotals.computeIfAbsent(entry.getKey(), key -> new int[2]);
                totals[0] += entry.getValue().fulfilled();
                totals[1] += entry.getValue().total();
            }
        }
        Map<String, Double> performance = new LinkedHashMap<>();
        dimensionTotals.forEach((dimension, totals) -> {
            if (totals[1] > 0) {
                performance.put(dimension, totals[0] * 100.0 / totals[1]);
            }
        });
        String strongest = performance.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElse("");
        String weakest = performance.entrySet().stream()
            .min(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElse("");
        return new ComparisonStatistics(performance, strongest, weakest, List.copyOf(top), List.copyOf(bottom));
    }

    static String errorType(String message) {
        if (message == null || message.isBlank()) {
            return "unknown_error";
        }
        Matcher status = HTTP_STATUS.matcher(message);
        if (status.find()) {
            return "http_" + status.group(1);
        }
        Matcher code = ERROR_CODE.matcher(message.toLowerCase(Locale.ROOT).replace("failed to crawl main page: ", ""));
        if (code.lookingAt()) {
            return code.group(1);
        }
        return "other";
    }
}

package com.openness.crawler.assessment;

import com.openness.crawler.catalog.CriteriaCatalog;
import com.openness.crawler.config.CrawlerProperties;
import com.openness.crawler.crawl.model.OrganizationCrawlResult;
import com.openness.crawler.crawl.model.OrganizationTarget;
import com.openness.crawler.crawl.service.CrawlOrchestratorService;
import com.openness.crawler.crawl.service.CrawlRequest;
import com.openness.crawler.crawl.service.StatusCallback;
import com.openness.crawler.crawl.service.StatusReporter;
import com.openness.crawler.crawl.strategy.CrawlStrategy;
import com.openness.crawler.evaluation.CriteriaEvaluationEngine;
import com.openness.crawler.evaluation.OrganizationEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Crawls and evaluates organizations strictly one after another, separated by the inter-domain delay.
 */
@Service
public class AssessmentRunService {
    private static final Logger log = LoggerFactory.getLogger(AssessmentRunService.class);

    private final CrawlerProperties properties;
    private final CrawlOrchestratorService crawlOrchestrator;
    private final CriteriaEvaluationEngine evaluationEngine;

    public AssessmentRunService(
        CrawlerProperties properties,
        CrawlOrchestratorService crawlOrchestrator,
        CriteriaEvaluationEngine evaluationEngine
    ) {
        this.properties = properties;
        this.crawlOrchestrator = crawlOrchestrator;
        this.evaluationEngine = evaluationEngine;
    }

    public AssessmentRunSummary run(List<OrganizationTarget> organizations, CriteriaCatalog catalog, StatusCallback callback) {
        return run(organizations, catalog, null, null, callback);
    }

    public AssessmentRunSummary run(
        List<OrganizationTarget> organizations,
        CriteriaCatalog catalog,
        CrawlStrategy strategy,
        Integer maxPages,
        StatusCallback callback
    ) {
        StatusReporter status = new StatusReporter(log, callback);
        Instant startedAt = Instant.now();
        String catalogName = catalog == null ? null : catalog.catalogName();
        List<OrganizationTarget> targets = organizations == null ? List.of() : organizations;
        if (targets.isEmpty()) {
            status.report("No organizations to assess");
            return new AssessmentRunSummary(catalogName, startedAt, Instant.now(), AssessmentRunStatus.NO_TARGETS, 0, List.of());
        }

        List<String> criteriaNames = catalog == null ? List.of() : catalog.criteriaNames();
        List<OrganizationAssessment> assessments = new ArrayList<>();
        boolean hadErrors = false;
        boolean cancelled = false;
        for (int i = 0; i < targets.size(); i++) {
            OrganizationTarget target = targets.get(i);
            if (i > 0 && !pause(properties.getInterDomainDelayMs())) {
                cancelled = true;
                break;
            }
            status.report("Assessing organization " + (i + 1) + "/" + targets.size() + ": " + target.name());
            OrganizationAssessment assessment = assess(target, catalog, strategy, maxPages, criteriaNames, callback);
            assessments.add(assessment);
            hadErrors |= assessment.crawl().mainPageFailed() || !assessment.crawl().errors().isEmpty();
            if (assessment.crawl().cancelled() || Thread.currentThread().isInterrupted()) {
                cancelled = true;
                break;
            }
        }

        AssessmentRunStatus runStatus = cancelled
            ? AssessmentRunStatus.CANCELLED
            : hadErrors ? AssessmentRunStatus.COMPLETED_WITH_ERRORS : AssessmentRunStatus.COMPLETED;
        status.report("Assessment run finished: " + assessments.size() + "/" + targets.size() + " organizations, status " + runStatus);
        return new AssessmentRunSummary(catalogName, startedAt, Instant.now(), runStatus, targets.size(), assessments);
    }

    public OrganizationAssessment assess(
        OrganizationTarget target,
        CriteriaCatalog catalog,
        CrawlStrategy strategy,
        Integer maxPages,
        List<String> criteriaNames,
        StatusCallback callback
    ) {
        OrganizationCrawlResult crawl = crawlOrchestrator.crawl(
            new CrawlRequest(target.name(), target.baseUrl(), strategy, maxPages, criteriaNames),
            callback
        );
        OrganizationEvaluation evaluation = evaluationEngine.evaluate(crawl, catalog);
        return new OrganizationAssessment(crawl, evaluation);
    }

    private boolean pause(long delayMs) {
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Assessment run interrupted during inter-organization delay");
            return false;
        }
    }
}

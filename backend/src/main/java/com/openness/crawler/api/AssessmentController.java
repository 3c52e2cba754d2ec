package com.openness.crawler.api;

import com.openness.crawler.assessment.AssessmentRunService;
import com.openness.crawler.assessment.AssessmentRunSummary;
import com.openness.crawler.assessment.OrganizationAssessment;
import com.openness.crawler.catalog.CatalogInfo;
import com.openness.crawler.catalog.CriteriaCatalog;
import com.openness.crawler.catalog.CriteriaCatalogLoader;
import com.openness.crawler.config.CrawlerProperties;
import com.openness.crawler.crawl.model.OrganizationTarget;
import com.openness.crawler.crawl.service.StatusCallback;
import com.openness.crawler.crawl.strategy.CrawlStrategy;
import com.openness.crawler.llm.LlmClient;
import com.openness.crawler.statistics.AssessmentStatistics;
import com.openness.crawler.statistics.StatisticsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class AssessmentController {
    private final CriteriaCatalogLoader catalogLoader;
    private final AssessmentRunService assessmentRunService;
    private final StatisticsService statisticsService;
    private final CrawlerProperties crawlerProperties;
    private final Optional<LlmClient> llmClient;

    public AssessmentController(
        CriteriaCatalogLoader catalogLoader,
        AssessmentRunService assessmentRunService,
        StatisticsService statisticsService,
        CrawlerProperties crawlerProperties,
        Optional<LlmClient> llmClient
    ) {
        this.catalogLoader = catalogLoader;
        this.assessmentRunService = assessmentRunService;
        this.statisticsService = statisticsService;
        this.crawlerProperties = crawlerProperties;
        this.llmClient = llmClient == null ? Optional.empty() : llmClient;
    }

    @GetMapping("/catalogs")
    public List<String> catalogs() {
        return catalogLoader.availableCatalogs();
    }

    @GetMapping("/catalogs/{name}")
    public CatalogInfo catalog(@PathVariable("name") String name) {
        return catalogLoader.catalogInfo(name);
    }

    @PostMapping("/assessments")
    public AssessmentResponse assess(@RequestBody AssessmentRequest request) {
        if (request == null || isBlank(request.baseUrl())) {
            throw new ResponseStatusException(BAD_REQUEST, "baseUrl is required");
        }
        CriteriaCatalog catalog = loadCatalog(request.catalog());
        String name = isBlank(request.organizationName()) ? request.baseUrl().trim() : request.organizationName().trim();
        OrganizationAssessment assessment = assessmentRunService.assess(
            new OrganizationTarget(name, request.baseUrl().trim()),
            catalog,
            parseStrategy(request.strategy()),
            request.maxPages(),
            catalog.criteriaNames(),
            StatusCallback.noop()
        );
        return AssessmentResponse.of(assessment);
    }

    @PostMapping("/assessments/batch")
    public BatchAssessmentResponse assessBatch(@RequestBody BatchAssessmentRequest request) {
        if (request == null || request.organizations() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "organizations are required");
        }
        CriteriaCatalog catalog = loadCatalog(request.catalog());
        List<OrganizationTarget> targets = request.organizations().stream()
            .filter(entry -> entry != null && !isBlank(entry.url()))
            .map(entry -> new OrganizationTarget(isBlank(entry.name()) ? entry.url().trim() : entry.name().trim(), entry.url().trim()))
            .toList();
        AssessmentRunSummary summary = assessmentRunService.run(
            targets,
            catalog,
            parseStrategy(request.strategy()),
            request.maxPages(),
            StatusCallback.noop()
        );
        AssessmentStatistics statistics = statisticsService.collect(
            catalog.catalogName(),
            summary.evaluations(),
            summary.crawlResults()
        );
        return new BatchAssessmentResponse(
            summary.catalogName(),
            summary.status(),
            summary.startedAt(),
            summary.finishedAt(),
            summary.assessments().stream().map(AssessmentResponse::of).toList(),
            statistics
        );
    }

    @GetMapping("/llm/status")
    public LlmStatusResponse llmStatus() {
        String model = crawlerProperties.getLlm().getModelName();
        return llmClient
            .map(client -> new LlmStatusResponse(true, client.ping(), model))
            .orElseGet(() -> new LlmStatusResponse(false, false, model));
    }

    private CriteriaCatalog loadCatalog(String name) {
        if (isBlank(name)) {
            throw new ResponseStatusException(BAD_REQUEST, "catalog is required");
        }
        return catalogLoader.load(name.trim());
    }

    private CrawlStrategy parseStrategy(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return CrawlStrategy.fromKey(value);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

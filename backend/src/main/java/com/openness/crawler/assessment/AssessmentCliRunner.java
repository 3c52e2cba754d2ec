package com.openness.crawler.assessment;

import com.openness.crawler.catalog.CriteriaCatalog;
import com.openness.crawler.catalog.CriteriaCatalogLoader;
import com.openness.crawler.config.CrawlerProperties;
import com.openness.crawler.crawl.model.OrganizationTarget;
import com.openness.crawler.crawl.service.StatusCallback;
import com.openness.crawler.csv.OrganizationCsvReader;
import com.openness.crawler.csv.ResultCsvWriter;
import com.openness.crawler.evaluation.OrganizationEvaluation;
import com.openness.crawler.statistics.AssessmentStatistics;
import com.openness.crawler.statistics.StatisticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class AssessmentCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(AssessmentCliRunner.class);

    private final CrawlerProperties properties;
    private final CriteriaCatalogLoader catalogLoader;
    private final AssessmentRunService assessmentRunService;
    private final StatisticsService statisticsService;
    private final ConfigurableApplicationContext applicationContext;

    public AssessmentCliRunner(
        CrawlerProperties properties,
        CriteriaCatalogLoader catalogLoader,
        AssessmentRunService assessmentRunService,
        StatisticsService statisticsService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.catalogLoader = catalogLoader;
        this.assessmentRunService = assessmentRunService;
        this.statisticsService = statisticsService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!properties.getCli().isRun()) {
            return;
        }
        CrawlerProperties.Cli cli = properties.getCli();
        if (cli.getCatalog() == null || cli.getCatalog().isBlank()) {
            throw new IllegalStateException("crawler.cli.catalog must name a catalog, available: " + catalogLoader.availableCatalogs());
        }

        List<OrganizationTarget> organizations = new OrganizationCsvReader(cli.getDelimiter())
            .read(Path.of(cli.getOrganizationsCsv()));
        CriteriaCatalog catalog = catalogLoader.load(cli.getCatalog());

        AssessmentRunSummary summary = assessmentRunService.run(organizations, catalog, StatusCallback.noop());
        List<OrganizationEvaluation> evaluations = summary.evaluations();
        for (OrganizationEvaluation evaluation : evaluations) {
            log.info(
                "Summary {}: fulfilled={}/{} ({}%), averageConfidence={}",
                evaluation.organizationName(),
                evaluation.fulfilledCriteria(),
                evaluation.totalCriteria(),
                String.format("%.1f", evaluation.fulfillmentPercentage()),
                String.format("%.2f", evaluation.averageConfidence())
            );
        }

        Path output = Path.of(cli.getOutputCsv());
        ResultCsvWriter csvWriter = new ResultCsvWriter(cli.getDelimiter());
        csvWriter.writeResults(output, evaluations);
        if (cli.getSummaryCsv() != null && !cli.getSummaryCsv().isBlank()) {
            csvWriter.writeSummary(Path.of(cli.getSummaryCsv()), evaluations);
        }
        AssessmentStatistics statistics = statisticsService.collect(catalog.catalogName(), evaluations, summary.crawlResults());
        log.info(
            "Assessment run {} finished with status {}: {} organizations, {} successful crawls, strongest dimension '{}', results written to {}",
            catalog.catalogName(),
            summary.status(),
            statistics.crawling().totalOrganizations(),
            statistics.crawling().successfulCrawls(),
            statistics.comparison().strongestDimension(),
            output.toAbsolutePath()
        );

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}

package com.openness.crawler.csv;

import com.openness.crawler.evaluation.CriterionEvaluation;
import com.openness.crawler.evaluation.OrganizationEvaluation;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class ResultCsvWriter {
    static final String[] RESULT_HEADER = {
        "Organisation", "URL", "Criterion ID", "Criterion", "Dimension", "Fulfilled",
        "Confidence", "Pattern Type", "Source URL", "Evidence", "Justification"
    };
    static final String[] SUMMARY_HEADER = {
        "Organisation", "URL", "Total Criteria", "Fulfilled Criteria", "Fulfillment %", "Average Confidence"
    };

    private final char delimiter;

    public ResultCsvWriter(char delimiter) {
        this.delimiter = delimiter;
    }

    public void writeResults(Path path, List<OrganizationEvaluation> evaluations) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeResults(writer, evaluations);
        }
    }

    /**
     * One row per organization and criterion.
     */
    public void writeResults(Writer writer, List<OrganizationEvaluation> evaluations) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, format(RESULT_HEADER));
        for (OrganizationEvaluation evaluation : evaluations) {
            for (CriterionEvaluation result : evaluation.criteriaResults()) {
                printer.printRecord(
                    evaluation.organizationName(),
                    evaluation.baseUrl(),
                    result.criterionId(),
                    result.criterionName(),
                    result.dimension(),
                    result.evaluation() ? "yes" : "no",
                    decimal(result.confidence()),
                    result.patternType(),
                    result.sourceUrl(),
                    result.evidenceText(),
                    result.justification()
                );
            }
        }
        printer.flush();
    }

    public void writeSummary(Path path, List<OrganizationEvaluation> evaluations) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeSummary(writer, evaluations);
        }
    }

    public void writeSummary(Writer writer, List<OrganizationEvaluation> evaluations) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, format(SUMMARY_HEADER));
        for (OrganizationEvaluation evaluation : evaluations) {
            printer.printRecord(
                evaluation.organizationName(),
                evaluation.baseUrl(),
                evaluation.totalCriteria(),
                evaluation.fulfilledCriteria(),
                String.format(Locale.ROOT, "%.1f", evaluation.fulfillmentPercentage()),
                decimal(evaluation.averageConfidence())
            );
        }
        printer.flush();
    }

    private CSVFormat format(String[] header) {
        return CSVFormat.DEFAULT.builder()
            .setDelimiter(delimiter)
            .setHeader(header)
            .setRecordSeparator("\n")
            .build();
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}

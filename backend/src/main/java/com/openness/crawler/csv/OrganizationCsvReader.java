package com.openness.crawler.csv;

import com.openness.crawler.crawl.model.OrganizationTarget;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads "name;url" organization lists. A header row is optional and only the first two columns are used.
 */
public class OrganizationCsvReader {
    private static final Logger log = LoggerFactory.getLogger(OrganizationCsvReader.class);
    private static final Set<String> HEADER_NAMES = Set.of("organisation", "organization", "url");

    private final CSVFormat format;

    public OrganizationCsvReader(char delimiter) {
        this.format = CSVFormat.DEFAULT.builder()
            .setDelimiter(delimiter)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
    }

    public List<OrganizationTarget> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<OrganizationTarget> read(Reader reader) throws IOException {
        List<OrganizationTarget> targets = new ArrayList<>();
        try (CSVParser parser = format.parse(reader)) {
            boolean first = true;
            for (CSVRecord record : parser) {
                if (first) {
                    first = false;
                    if (record.size() < 2) {
                        throw new IllegalArgumentException("CSV file must have at least 2 columns, found " + record.size());
                    }
                    if (isHeader(record)) {
                        continue;
                    }
                }
                if (record.size() < 2) {
                    log.warn("Skipping CSV line {} with {} column(s)", record.getRecordNumber(), record.size());
                    continue;
                }
                String name = stripBom(record.get(0)).trim();
                String url = record.get(1).trim();
                if (name.isEmpty() || url.isEmpty()) {
                    continue;
                }
                String lower = url.toLowerCase(Locale.ROOT);
                if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
                    log.warn("URL for {} does not start with http(s): {}", name, url);
                }
                targets.add(new OrganizationTarget(name, url));
            }
        }
        log.info("Loaded {} organizations from CSV", targets.size());
        return targets;
    }

    private boolean isHeader(CSVRecord record) {
        for (String value : record) {
            if (HEADER_NAMES.contains(stripBom(value).trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static String stripBom(String value) {
        return value != null && value.startsWith("\uFEFF") ? value.substring(1) : value;
    }
}

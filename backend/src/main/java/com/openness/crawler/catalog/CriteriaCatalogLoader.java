package com.openness.crawler.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.openness.crawler.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads YAML criteria catalogs (dimension, factor, criterion) from the configured directory.
 */
@Service
public class CriteriaCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(CriteriaCatalogLoader.class);
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final List<String> EXTENSIONS = List.of(".yaml", ".yml");

    private final YAMLMapper yamlMapper = new YAMLMapper();
    private final Path directory;

    @Autowired
    public CriteriaCatalogLoader(CrawlerProperties properties) {
        this(Path.of(properties.getCatalog().getDirectory()));
    }

    public CriteriaCatalogLoader(Path directory) {
        this.directory = directory;
    }

    public List<String> availableCatalogs() {
        if (!Files.isDirectory(directory)) {
            log.warn("Catalog directory {} does not exist", directory.toAbsolutePath());
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            List<String> names = files
                .filter(Files::isRegularFile)
                .map(path -> path.getFileName().toString())
                .filter(file -> EXTENSIONS.stream().anyMatch(file::endsWith))
                .map(file -> file.substring(0, file.lastIndexOf('.')))
                .distinct()
                .sorted()
                .toList();
            log.info("Found {} criteria catalogs in {}", names.size(), directory);
            return names;
        } catch (IOException e) {
            throw new CatalogException(null, "Cannot list catalog directory " + directory, e);
        }
    }

    public CriteriaCatalog load(String catalogName) {
        Path file = resolve(catalogName);
        JsonNode root;
        try {
            root = yamlMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new CatalogException(catalogName, "Catalog '" + catalogName + "' is not valid YAML: " + e.getMessage(), e);
        }
        CriteriaCatalog catalog = parse(catalogName, root);
        log.info("Loaded catalog '{}' with {} criteria", catalogName, catalog.criteria().size());
        return catalog;
    }

    public CatalogInfo catalogInfo(String catalogName) {
        return CatalogInfo.of(load(catalogName));
    }

    CriteriaCatalog parse(String catalogName, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new CatalogException(catalogName, "Catalog '" + catalogName + "' must be a mapping");
        }
        List<String> missing = new ArrayList<>();
        for (String key : List.of("metadata", "dimensions")) {
            if (!root.has(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new CatalogException(catalogName, "Catalog '" + catalogName + "' missing required keys: " + missing);
        }

        JsonNode metadataNode = root.get("metadata");
        List<String> missingMetadata = new ArrayList<>();
        for (String key : List.of("name", "organization_type")) {
            if (!metadataNode.has(key)) {
                missingMetadata.add(key);
            }
        }
        if (!missingMetadata.isEmpty()) {
            throw new CatalogException(catalogName, "Catalog '" + catalogName + "' metadata missing: " + missingMetadata);
        }
        CatalogMetadata metadata = new CatalogMetadata(
            text(metadataNode, "name"),
            text(metadataNode, "description"),
            metadataNode.has("version") ? text(metadataNode, "version") : "1.0",
            text(metadataNode, "organization_type"),
            text(metadataNode, "created_date"),
            text(metadataNode, "author")
        );

        JsonNode dimensions = root.get("dimensions");
        if (!dimensions.isObject()) {
            throw new CatalogException(catalogName, "Catalog '" + catalogName + "' dimensions must be a mapping");
        }

        Map<String, String> dimensionNames = new LinkedHashMap<>();
        List<CriterionDefinition> criteria = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> dimensionIt = dimensions.fields();
        while (dimensionIt.hasNext()) {
            Map.Entry<String, JsonNode> dimension = dimensionIt.next();
            String dimensionKey = dimension.getKey();
            JsonNode dimensionNode = dimension.getValue();
            if (!dimensionNode.isObject()) {
                throw new CatalogException(catalogName, "Dimension '" + dimensionKey + "' must be a mapping");
            }
            if (!dimensionNode.has("factors") || !dimensionNode.get("factors").isObject()) {
                throw new CatalogException(catalogName, "Dimension '" + dimensionKey + "' missing 'factors' key");
            }
            dimensionNames.put(dimensionKey, dimensionNode.has("name") ? text(dimensionNode, "name") : dimensionKey);

            Iterator<Map.Entry<String, JsonNode>> factorIt = dimensionNode.get("factors").fields();
            while (factorIt.hasNext()) {
                Map.Entry<String, JsonNode> factor = factorIt.next();
                JsonNode factorNode = factor.getValue();
                if (!factorNode.isObject()) {
                    throw new CatalogException(catalogName, "Factor '" + factor.getKey() + "' must be a mapping");
                }
                if (!factorNode.has("criteria")) {
                    throw new CatalogException(catalogName, "Factor '" + factor.getKey() + "' missing 'criteria' key");
                }
                JsonNode criteriaNode = factorNode.get("criteria");
                if (criteriaNode.isNull()) {
                    continue;
                }
                if (!criteriaNode.isObject()) {
                    throw new CatalogException(catalogName, "Factor '" + factor.getKey() + "' criteria must be a mapping");
                }
                Iterator<Map.Entry<String, JsonNode>> criterionIt = criteriaNode.fields();
                while (criterionIt.hasNext()) {
                    Map.Entry<String, JsonNode> criterion = criterionIt.next();
                    criteria.add(parseCriterion(catalogName, dimensionKey, factor.getKey(), criterion.getKey(), criterion.getValue()));
                }
            }
        }
        return new CriteriaCatalog(catalogName, metadata, dimensionNames, criteria);
    }

    private CriterionDefinition parseCriterion(String catalogName, String dimension, String factor, String id, JsonNode node) {
        String location = dimension + "." + factor;
        if (node == null || !node.isObject()) {
            throw new CatalogException(catalogName, "Criterion '" + id + "' in " + location + " must be a mapping");
        }
        List<String> missing = new ArrayList<>();
        for (String key : List.of("name", "description", "type")) {
            if (!node.has(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new CatalogException(catalogName, "Criterion '" + id + "' in " + location + " missing: " + missing);
        }
        CriterionType type = CriterionType.fromKey(text(node, "type"));
        if (type == null) {
            throw new CatalogException(
                catalogName,
                "Criterion '" + id + "' has invalid type. Must be one of: [operational, strategic]"
            );
        }

        Map<PatternType, List<String>> patterns = new LinkedHashMap<>();
        JsonNode patternsNode = node.path("patterns");
        if (patternsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> patternIt = patternsNode.fields();
            while (patternIt.hasNext()) {
                Map.Entry<String, JsonNode> entry = patternIt.next();
                if (!entry.getValue().isArray()) {
                    throw new CatalogException(
                        catalogName,
                        "Pattern '" + entry.getKey() + "' in criterion '" + id + "' must be a list"
                    );
                }
                PatternType patternType = PatternType.fromKey(entry.getKey());
                if (patternType == null) {
                    log.warn("Unknown pattern type '{}' in criterion '{}'", entry.getKey(), id);
                    continue;
                }
                List<String> values = new ArrayList<>();
                entry.getValue().forEach(value -> {
                    if (!value.isNull() && !value.asText().isBlank()) {
                        values.add(value.asText());
                    }
                });
                patterns.put(patternType, values);
            }
        }

        Double threshold = node.has("confidence_threshold") && node.get("confidence_threshold").isNumber()
            ? node.get("confidence_threshold").asDouble()
            : null;
        double weight = node.has("weight") && node.get("weight").isNumber() ? node.get("weight").asDouble() : 1.0;
        return new CriterionDefinition(id, dimension, factor, text(node, "name"), text(node, "description"), type, patterns, weight, threshold);
    }

    private Path resolve(String catalogName) {
        if (catalogName == null || !SAFE_NAME.matcher(catalogName).matches()) {
            throw new CatalogNotFoundException(catalogName, "Catalog '" + catalogName + "' not found in " + directory);
        }
        for (String extension : EXTENSIONS) {
            Path candidate = directory.resolve(catalogName + extension);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        throw new CatalogNotFoundException(catalogName, "Catalog '" + catalogName + "' not found in " + directory);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}

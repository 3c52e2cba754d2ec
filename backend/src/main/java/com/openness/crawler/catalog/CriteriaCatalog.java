package com.openness.crawler.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, read-only catalog. {@code dimensionNames} maps dimension keys to display names in catalog order.
 */
public record CriteriaCatalog(
    String catalogName,
    CatalogMetadata metadata,
    Map<String, String> dimensionNames,
    List<CriterionDefinition> criteria
) {
    public CriteriaCatalog {
        dimensionNames = dimensionNames == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(dimensionNames));
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
    }

    public static CriteriaCatalog empty(String catalogName) {
        return new CriteriaCatalog(catalogName, new CatalogMetadata(catalogName, "", "1.0", "", null, null), Map.of(), List.of());
    }

    public List<String> criteriaNames() {
        return criteria.stream().map(CriterionDefinition::name).toList();
    }

    public String dimensionName(String dimensionKey) {
        return dimensionNames.getOrDefault(dimensionKey, dimensionKey);
    }
}

package com.openness.crawler.catalog;

public record CatalogInfo(
    String name,
    String description,
    String version,
    String organizationType,
    int dimensions,
    int totalCriteria
) {
    public static CatalogInfo of(CriteriaCatalog catalog) {
        CatalogMetadata metadata = catalog.metadata();
        return new CatalogInfo(
            metadata.name() == null ? catalog.catalogName() : metadata.name(),
            metadata.description() == null ? "" : metadata.description(),
            metadata.version() == null ? "1.0" : metadata.version(),
            metadata.organizationType() == null ? "" : metadata.organizationType(),
            catalog.dimensionNames().size(),
            catalog.criteria().size()
        );
    }
}

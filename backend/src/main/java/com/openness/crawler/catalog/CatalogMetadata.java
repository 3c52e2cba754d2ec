package com.openness.crawler.catalog;

public record CatalogMetadata(
    String name,
    String description,
    String version,
    String organizationType,
    String createdDate,
    String author
) {
}

package com.openness.crawler.catalog;

/**
 * Raised when a catalog file cannot be read or does not have the expected structure.
 */
public class CatalogException extends RuntimeException {
    private final String catalogName;

    public CatalogException(String catalogName, String message) {
        super(message);
        this.catalogName = catalogName;
    }

    public CatalogException(String catalogName, String message, Throwable cause) {
        super(message, cause);
        this.catalogName = catalogName;
    }

    public String getCatalogName() {
        return catalogName;
    }
}

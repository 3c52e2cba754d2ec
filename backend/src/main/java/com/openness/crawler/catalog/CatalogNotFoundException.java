package com.openness.crawler.catalog;

public class CatalogNotFoundException extends CatalogException {

    public CatalogNotFoundException(String catalogName, String message) {
        super(catalogName, message);
    }
}

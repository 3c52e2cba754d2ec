package com.openness.crawler.api;

import com.openness.crawler.catalog.CatalogException;
import com.openness.crawler.catalog.CatalogNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class AssessmentExceptionHandler {

  @ExceptionHandler(CatalogNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleUnknownCatalog(CatalogNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "catalog_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(CatalogException.class)
  public ResponseEntity<Map<String, String>> handleInvalidCatalog(CatalogException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_catalog", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }
}

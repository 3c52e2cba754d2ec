package com.openness.crawler.crawl.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class HttpFetchResultTest {

    @Test
    void declaredCharsetReadsContentTypeParameter() {
        assertEquals("ISO-8859-1", withContentType("text/html; charset=ISO-8859-1").declaredCharset());
        assertEquals("windows-1252", withContentType("text/html;Charset=\"windows-1252\"").declaredCharset());
    }

    @Test
    void missingOrUnknownCharsetIsNull() {
        assertNull(withContentType(null).declaredCharset());
        assertNull(withContentType("text/html").declaredCharset());
        assertNull(withContentType("text/html; charset=klingon-8").declaredCharset());
        assertNull(withContentType("text/html; charset=?!").declaredCharset());
    }

    private static HttpFetchResult withContentType(String contentType) {
        return new HttpFetchResult(
            "https://example.org/",
            null,
            200,
            "",
            new byte[0],
            contentType,
            Instant.now(),
            Duration.ZERO,
            null,
            null
        );
    }
}

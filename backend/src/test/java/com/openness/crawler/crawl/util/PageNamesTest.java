package com.openness.crawler.crawl.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PageNamesTest {

    @Test
    void derivesTitleFromLastPathSegment() {
        assertEquals("Open Access Policy", PageNames.titleFromUrl("https://example.org/forschung/open-access_policy.html"));
        assertEquals("Jahresbericht", PageNames.titleFromUrl("https://example.org/ueber-uns/jahresbericht/"));
        assertEquals("Home", PageNames.titleFromUrl("https://example.org/"));
        assertEquals("Unknown page", PageNames.titleFromUrl("not a url"));
    }

    @Test
    void shortNameIsTruncated() {
        String name = PageNames.shortName("https://example.org/a-very-long-page-name-that-goes-on-and-on");

        assertEquals(30, name.length());
        assertEquals("...", name.substring(27));
    }
}

package com.openness.crawler.crawl.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openness.crawler.TestCrawlerProperties;
import com.openness.crawler.crawl.http.PoliteHttpClient;
import com.openness.crawler.crawl.model.PageResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RenderingPageFetcherTest {
    private MockWebServer sidecar;
    private RenderingPageFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        sidecar = new MockWebServer();
        sidecar.start();
        fetcher = new RenderingPageFetcher(
            new PoliteHttpClient(TestCrawlerProperties.fast()),
            new HtmlPageParser(),
            new ObjectMapper(),
            sidecar.url("/crawl").toString(),
            5
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        sidecar.shutdown();
    }

    @Test
    void parsesRenderedHtmlAndPrefersMetadataTitle() throws Exception {
        sidecar.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"success": true, "results": [{
                  "url": "https://example.org/",
                  "success": true,
                  "status_code": 200,
                  "html": "<html><head><title>Raw</title></head><body>Rendered transparency page <a href='/bericht'>b</a></body></html>",
                  "metadata": {"title": "Rendered Title"}
                }]}
                """));

        PageResult page = fetcher.fetch("https://example.org/");

        assertThat(page.success()).isTrue();
        assertThat(page.title()).isEqualTo("Rendered Title");
        assertThat(page.content()).contains("Rendered transparency page");
        assertThat(page.links()).containsExactly("/bericht");

        RecordedRequest request = sidecar.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getBody().readUtf8()).contains("\"urls\":[\"https://example.org/\"]");
    }

    @Test
    void sidecarErrorBecomesRenderFailure() {
        sidecar.enqueue(new MockResponse().setResponseCode(503));

        PageResult page = fetcher.fetch("https://example.org/");

        assertThat(page.success()).isFalse();
        assertThat(page.errorMessage()).startsWith("render_failed");
    }

    @Test
    void malformedSidecarJsonBecomesRenderFailure() {
        sidecar.enqueue(new MockResponse().setBody("not json"));

        PageResult page = fetcher.fetch("https://example.org/");

        assertThat(page.success()).isFalse();
        assertThat(page.errorMessage()).isEqualTo("render_failed: malformed sidecar response");
    }

    @Test
    void upstreamStatusIsReported() {
        sidecar.enqueue(new MockResponse().setBody("""
            {"success": true, "results": [{"url": "https://example.org/", "success": true, "status_code": 404, "html": "<p>missing</p>"}]}
            """));

        PageResult page = fetcher.fetch("https://example.org/");

        assertThat(page.success()).isFalse();
        assertThat(page.errorMessage()).isEqualTo("HTTP 404");
    }
}

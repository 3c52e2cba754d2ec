package com.openness.crawler.crawl.robots;

import com.openness.crawler.TestCrawlerProperties;
import com.openness.crawler.crawl.http.PoliteHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RobotsTxtServiceTest {
    private MockWebServer server;
    private RobotsTxtService service;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        service = new RobotsTxtService(new PoliteHttpClient(TestCrawlerProperties.fast()));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void readsRobotsFromSiteRoot() throws Exception {
        server.enqueue(new MockResponse().setBody("User-agent: *\nDisallow: /admin\nCrawl-delay: 3\nSitemap: https://example.org/s.xml\n"));

        RobotsCheck check = service.check(server.url("/ueber-uns/index.html").toString());

        assertThat(check.exists()).isTrue();
        assertThat(check.crawlDelaySeconds()).isEqualTo(3.0);
        assertThat(check.sitemapUrls()).containsExactly("https://example.org/s.xml");
        assertThat(check.rules()).containsExactly("Disallow: /admin");
        assertThat(check.isAllowed("/admin/login")).isFalse();
        assertThat(server.takeRequest().getPath()).isEqualTo("/robots.txt");
    }

    @Test
    void missingRobotsIsReportedNotThrown() {
        server.enqueue(new MockResponse().setResponseCode(404));

        RobotsCheck check = service.check(server.url("/").toString());

        assertThat(check.exists()).isFalse();
        assertThat(check.isAllowed("/anything")).isTrue();
    }

    @Test
    void invalidBaseUrlIsReportedNotThrown() {
        assertThat(service.check("no url here").exists()).isFalse();
    }

    @Test
    void pathAndQueryKeepsQueryString() {
        assertThat(RobotsTxtService.pathAndQuery("https://example.org/suche?q=x")).isEqualTo("/suche?q=x");
        assertThat(RobotsTxtService.pathAndQuery("https://example.org")).isEqualTo("/");
    }
}

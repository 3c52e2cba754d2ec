package com.openness.crawler.crawl.fetch;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

@Component
public class HtmlPageParser {

    public ParsedPage parse(String html, String baseUrl) {
        return extract(Jsoup.parse(html == null ? "" : html, baseUrl == null ? "" : baseUrl));
    }

    /**
     * Decodes raw bytes with the header charset when given, otherwise jsoup sniffs the BOM and
     * {@code <meta charset>} and falls back to UTF-8.
     */
    public ParsedPage parse(byte[] html, String charsetName, String baseUrl) {
        if (html == null) {
            return parse((String) null, baseUrl);
        }
        try {
            return extract(Jsoup.parse(new ByteArrayInputStream(html), charsetName, baseUrl == null ? "" : baseUrl));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private ParsedPage extract(Document document) {
        String title = document.title() == null ? "" : document.title().trim();

        List<String> links = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href");
            if (href != null && !href.isBlank()) {
                links.add(href.trim());
            }
        }

        document.select("script, style, noscript").remove();
        String content = document.text().replaceAll("\\s+", " ").trim();
        return new ParsedPage(title, content, links);
    }

    public record ParsedPage(String title, String content, List<String> links) {
    }
}

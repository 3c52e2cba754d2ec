package com.openness.crawler.llm;

public record SubpageCandidate(String url, String title) {
}

package com.openness.crawler.api;

public record LlmStatusResponse(boolean enabled, boolean connected, String model) {
}

package com.openness.crawler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openness.crawler.crawl.fetch.FallbackPageFetcher;
import com.openness.crawler.crawl.fetch.HtmlPageParser;
import com.openness.crawler.crawl.fetch.JsoupPageFetcher;
import com.openness.crawler.crawl.fetch.PageFetcher;
import com.openness.crawler.crawl.fetch.RenderingPageFetcher;
import com.openness.crawler.crawl.http.PoliteHttpClient;
import com.openness.crawler.llm.LangChainLlmClient;
import com.openness.crawler.llm.LlmClient;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

@Configuration
public class CrawlConfig {
    private static final Logger log = LoggerFactory.getLogger(CrawlConfig.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Rendering sidecar first with the plain jsoup fetcher as fallback, or jsoup alone.
     */
    @Bean
    @Primary
    public PageFetcher pageFetcher(
        CrawlerProperties properties,
        JsoupPageFetcher basicFetcher,
        PoliteHttpClient httpClient,
        HtmlPageParser parser,
        ObjectMapper objectMapper
    ) {
        CrawlerProperties.Rendering rendering = properties.getRendering();
        if (!rendering.isEnabled()) {
            return basicFetcher;
        }
        log.info("Rendering fetcher enabled at {} with jsoup fallback", rendering.getEndpoint());
        RenderingPageFetcher renderingFetcher = new RenderingPageFetcher(
            httpClient,
            parser,
            objectMapper,
            rendering.getEndpoint(),
            rendering.getTimeoutSeconds()
        );
        return new FallbackPageFetcher(renderingFetcher, basicFetcher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "crawler.llm", name = "enabled", havingValue = "true")
    public ChatModel chatModel(CrawlerProperties properties) {
        CrawlerProperties.Llm llm = properties.getLlm();
        log.info("LLM enabled model={} baseUrl={}", llm.getModelName(), llm.getBaseUrl());
        return OpenAiChatModel.builder()
            .apiKey(llm.getApiKey())
            .baseUrl(llm.getBaseUrl())
            .modelName(llm.getModelName())
            .temperature(llm.getTemperature())
            .maxTokens(llm.getMaxTokens())
            .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
            .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "crawler.llm", name = "enabled", havingValue = "true")
    public LlmClient llmClient(ChatModel chatModel, ObjectMapper objectMapper, CrawlerProperties properties) {
        return new LangChainLlmClient(chatModel, objectMapper, properties.getLlm().getContentBudgetChars());
    }
}

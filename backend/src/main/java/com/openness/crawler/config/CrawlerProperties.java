package com.openness.crawler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT =
        "openness-crawler/1.0 (research tool; +https://github.com/openness-crawler) Mozilla/5.0 (compatible)";
    private static final String DEFAULT_ACCEPT_LANGUAGE = "de-DE,de;q=0.9,en;q=0.8";

    private String userAgent;
    private String acceptLanguage = DEFAULT_ACCEPT_LANGUAGE;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 0;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private int maxPagesPerSite = 10;
    private String strategy = "intelligent";
    private long intraDomainDelayMs = 1000;
    private long interDomainDelayMs = 2000;
    private boolean caseSensitive = false;
    private double defaultConfidenceThreshold = 0.5;
    private Rendering rendering = new Rendering();
    private Llm llm = new Llm();
    private Robots robots = new Robots();
    private Catalog catalog = new Catalog();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getAcceptLanguage() {
        return acceptLanguage == null || acceptLanguage.isBlank() ? DEFAULT_ACCEPT_LANGUAGE : acceptLanguage;
    }

    public void setAcceptLanguage(String acceptLanguage) {
        this.acceptLanguage = acceptLanguage;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public int getMaxPagesPerSite() {
        return Math.max(1, maxPagesPerSite);
    }

    public void setMaxPagesPerSite(int maxPagesPerSite) {
        this.maxPagesPerSite = Math.max(1, maxPagesPerSite);
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public long getIntraDomainDelayMs() {
        return Math.max(0, intraDomainDelayMs);
    }

    public void setIntraDomainDelayMs(long intraDomainDelayMs) {
        this.intraDomainDelayMs = Math.max(0, intraDomainDelayMs);
    }

    public long getInterDomainDelayMs() {
        return Math.max(0, interDomainDelayMs);
    }

    public void setInterDomainDelayMs(long interDomainDelayMs) {
        this.interDomainDelayMs = Math.max(0, interDomainDelayMs);
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public void setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    public double getDefaultConfidenceThreshold() {
        return clampUnit(defaultConfidenceThreshold);
    }

    public void setDefaultConfidenceThreshold(double defaultConfidenceThreshold) {
        this.defaultConfidenceThreshold = clampUnit(defaultConfidenceThreshold);
    }

    public Rendering getRendering() {
        return rendering;
    }

    public void setRendering(Rendering rendering) {
        this.rendering = rendering;
    }

    public Llm getLlm() {
        return llm;
    }

    public void setLlm(Llm llm) {
        this.llm = llm;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static class Rendering {
        private boolean enabled = false;
        private String endpoint = "http://localhost:11235/crawl";
        private int timeoutSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Llm {
        private boolean enabled = false;
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private String modelName = "gpt-4.1-mini";
        private double temperature = 0.3;
        private int maxTokens = 2000;
        private int timeoutSeconds = 30;
        private int contentBudgetChars = 3000;
        private int maxCandidates = 50;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return Math.max(1, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(1, maxTokens);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getContentBudgetChars() {
            return Math.max(100, contentBudgetChars);
        }

        public void setContentBudgetChars(int contentBudgetChars) {
            this.contentBudgetChars = Math.max(100, contentBudgetChars);
        }

        public int getMaxCandidates() {
            return Math.max(1, maxCandidates);
        }

        public void setMaxCandidates(int maxCandidates) {
            this.maxCandidates = Math.max(1, maxCandidates);
        }
    }

    public static class Robots {
        private boolean enabled = true;
        private boolean honorCrawlDelay = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isHonorCrawlDelay() {
            return honorCrawlDelay;
        }

        public void setHonorCrawlDelay(boolean honorCrawlDelay) {
            this.honorCrawlDelay = honorCrawlDelay;
        }
    }

    public static class Catalog {
        private String directory = "criteria";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Cli {
        private boolean run;
        private String organizationsCsv = "organizations.csv";
        private String catalog = "";
        private String outputCsv = "results.csv";
        private String summaryCsv = "";
        private char delimiter = ';';
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getOrganizationsCsv() {
            return organizationsCsv;
        }

        public void setOrganizationsCsv(String organizationsCsv) {
            this.organizationsCsv = organizationsCsv;
        }

        public String getCatalog() {
            return catalog;
        }

        public void setCatalog(String catalog) {
            this.catalog = catalog;
        }

        public String getOutputCsv() {
            return outputCsv;
        }

        public void setOutputCsv(String outputCsv) {
            this.outputCsv = outputCsv;
        }

        public String getSummaryCsv() {
            return summaryCsv;
        }

        public void setSummaryCsv(String summaryCsv) {
            this.summaryCsv = summaryCsv;
        }

        public char getDelimiter() {
            return delimiter;
        }

        public void setDelimiter(char delimiter) {
            this.delimiter = delimiter;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}

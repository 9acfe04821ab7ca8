package com.tariffmonitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private int sourceConcurrency = 4;
    private boolean quickMode;
    private boolean initialize;
    private Fetch fetch = new Fetch();
    private Selector selector = new Selector();
    private Report report = new Report();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
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

    public int getSourceConcurrency() {
        return Math.max(1, sourceConcurrency);
    }

    public void setSourceConcurrency(int sourceConcurrency) {
        this.sourceConcurrency = Math.max(1, sourceConcurrency);
    }

    public boolean isQuickMode() {
        return quickMode;
    }

    public void setQuickMode(boolean quickMode) {
        this.quickMode = quickMode;
    }

    public boolean isInitialize() {
        return initialize;
    }

    public void setInitialize(boolean initialize) {
        this.initialize = initialize;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Selector getSelector() {
        return selector;
    }

    public void setSelector(Selector selector) {
        this.selector = selector;
    }

    public Report getReport() {
        return report;
    }

    public void setReport(Report report) {
        this.report = report;
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

    public static class Fetch {
        private long maxDocumentBytes = 50_000_000L;
        private int pageTimeoutSeconds = 10;
        private List<String> expectedContentTypes = new ArrayList<>();

        public long getMaxDocumentBytes() {
            return Math.max(1L, maxDocumentBytes);
        }

        public void setMaxDocumentBytes(long maxDocumentBytes) {
            this.maxDocumentBytes = Math.max(1L, maxDocumentBytes);
        }

        public int getPageTimeoutSeconds() {
            return Math.max(1, pageTimeoutSeconds);
        }

        public void setPageTimeoutSeconds(int pageTimeoutSeconds) {
            this.pageTimeoutSeconds = Math.max(1, pageTimeoutSeconds);
        }

        public List<String> getExpectedContentTypes() {
            return expectedContentTypes;
        }

        public void setExpectedContentTypes(List<String> expectedContentTypes) {
            List<String> normalized = new ArrayList<>();
            if (expectedContentTypes != null) {
                for (String value : expectedContentTypes) {
                    if (value != null && !value.isBlank()) {
                        normalized.add(value.trim().toLowerCase(Locale.ROOT));
                    }
                }
            }
            this.expectedContentTypes = normalized;
        }
    }

    public static class Selector {
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4o-mini";
        private int maxSelected = 1;

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

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxSelected() {
            return Math.max(1, maxSelected);
        }

        public void setMaxSelected(int maxSelected) {
            this.maxSelected = Math.max(1, maxSelected);
        }

        public boolean isLlmConfigured() {
            return apiKey != null && !apiKey.isBlank() && baseUrl != null && !baseUrl.isBlank();
        }
    }

    public static class Report {
        private String directory = "reports";
        private int rationaleSummaryLength = 60;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public int getRationaleSummaryLength() {
            return Math.max(1, rationaleSummaryLength);
        }

        public void setRationaleSummaryLength(int rationaleSummaryLength) {
            this.rationaleSummaryLength = Math.max(1, rationaleSummaryLength);
        }
    }

    public static class Cli {
        private boolean run;
        private String sourceList = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSourceList() {
            return sourceList;
        }

        public void setSourceList(String sourceList) {
            this.sourceList = sourceList;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}

package com.tariffmonitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tariffmonitor.monitor.http.DocumentHttpClient;
import com.tariffmonitor.monitor.selection.DocumentSelector;
import com.tariffmonitor.monitor.selection.KeywordDocumentSelector;
import com.tariffmonitor.monitor.selection.LlmDocumentSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class MonitorConfig {
    private static final Logger log = LoggerFactory.getLogger(MonitorConfig.class);

    @Bean(name = "sourceExecutor", destroyMethod = "shutdown")
    public ExecutorService sourceExecutor(MonitorProperties properties) {
        return Executors.newFixedThreadPool(properties.getSourceConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(MonitorProperties properties) {
        int size = Math.max(4, properties.getSourceConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public DocumentSelector documentSelector(
        MonitorProperties properties,
        DocumentHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        MonitorProperties.Selector selector = properties.getSelector();
        if (!selector.isLlmConfigured()) {
            log.info("No selector API key configured; using keyword document selection");
            return new KeywordDocumentSelector(selector.getMaxSelected());
        }
        log.info("Using LLM document selection via {} (model {})", selector.getBaseUrl(), selector.getModel());
        return new LlmDocumentSelector(selector, httpClient, objectMapper);
    }
}

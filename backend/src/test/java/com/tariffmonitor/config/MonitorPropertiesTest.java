package com.tariffmonitor.config;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class MonitorPropertiesTest {

    @Test
    void sanitizesNumericSettings() {
        MonitorProperties properties = new MonitorProperties();
        properties.setRequestTimeoutSeconds(0);
        properties.setRequestMaxRetries(-3);
        properties.setSourceConcurrency(0);
        properties.getSelector().setMaxSelected(0);

        assertThat(properties.getRequestTimeoutSeconds()).isEqualTo(1);
        assertThat(properties.getRequestMaxRetries()).isZero();
        assertThat(properties.getSourceConcurrency()).isEqualTo(1);
        assertThat(properties.getSelector().getMaxSelected()).isEqualTo(1);
    }

    @Test
    void normalizesExpectedContentTypes() {
        MonitorProperties properties = new MonitorProperties();
        properties.getFetch().setExpectedContentTypes(Arrays.asList(" Application/PDF ", "", null));

        assertThat(properties.getFetch().getExpectedContentTypes()).containsExactly("application/pdf");
    }

    @Test
    void llmSelectionRequiresApiKey() {
        MonitorProperties properties = new MonitorProperties();
        assertThat(properties.getSelector().isLlmConfigured()).isFalse();

        properties.getSelector().setApiKey("sk-test");
        assertThat(properties.getSelector().isLlmConfigured()).isTrue();
    }

    @Test
    void blankUserAgentFallsBackToDefault() {
        MonitorProperties properties = new MonitorProperties();
        properties.setUserAgent("  ");

        assertThat(properties.getUserAgent()).isNotBlank();
    }
}

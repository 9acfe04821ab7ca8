package com.tariffmonitor.monitor.service;

import com.tariffmonitor.config.MonitorProperties;
import com.tariffmonitor.monitor.http.DocumentHttpClient;
import com.tariffmonitor.monitor.http.FetchFailureException;
import com.tariffmonitor.monitor.model.DocumentFingerprint;
import com.tariffmonitor.monitor.util.HashUtils;
import com.tariffmonitor.monitor.util.ReasonCodeClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FingerprinterTest {
    private MockWebServer server;
    private ExecutorService executor;
    private MonitorProperties properties;
    private Fingerprinter fingerprinter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new MonitorProperties();
        properties.setRequestMaxRetries(0);
        properties.getFetch().setExpectedContentTypes(List.of("application/pdf"));
        executor = Executors.newFixedThreadPool(1);
        fingerprinter = new Fingerprinter(new DocumentHttpClient(properties, executor), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void digestsExactBytesAndCapturesLastModified() throws Exception {
        String body = "%PDF-1.4 commercial tariff";
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/pdf")
            .setHeader("Last-Modified", "Wed, 03 Jan 2024 08:30:00 GMT")
            .setBody(body));

        DocumentFingerprint fingerprint = fingerprinter.fingerprint(server.url("/rates/tariff-v1.pdf").toString());

        assertThat(fingerprint.fingerprint())
            .isEqualTo(HashUtils.sha256Hex(body.getBytes(StandardCharsets.UTF_8)));
        assertThat(fingerprint.byteSize()).isEqualTo(body.length());
        assertThat(fingerprint.remoteModifiedAt()).isEqualTo(Instant.parse("2024-01-03T08:30:00Z"));
        assertThat(fingerprint.documentName()).isEqualTo("tariff-v1.pdf");
    }

    @Test
    void sameBytesYieldSameFingerprint() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/pdf").setBody("same"));
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/pdf").setBody("same"));
        String url = server.url("/tariff.pdf").toString();

        assertThat(fingerprinter.fingerprint(url).fingerprint())
            .isEqualTo(fingerprinter.fingerprint(url).fingerprint());
    }

    @Test
    void nonSuccessStatusIsFetchFailure() {
        server.enqueue(new MockResponse().setResponseCode(404));
        String url = server.url("/gone.pdf").toString();

        assertThatThrownBy(() -> fingerprinter.fingerprint(url))
            .isInstanceOfSatisfying(FetchFailureException.class, e -> {
                assertThat(e.url()).isEqualTo(url);
                assertThat(e.reasonCode()).isEqualTo(ReasonCodeClassifier.HTTP_404);
            });
    }

    @Test
    void unexpectedContentTypeIsFetchFailure() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody("<html>login</html>"));

        assertThatThrownBy(() -> fingerprinter.fingerprint(server.url("/tariff.pdf").toString()))
            .isInstanceOfSatisfying(FetchFailureException.class, e ->
                assertThat(e.reasonCode()).isEqualTo(ReasonCodeClassifier.UNEXPECTED_CONTENT_TYPE));
    }

    @Test
    void oversizedBodyIsFetchFailure() {
        properties.getFetch().setMaxDocumentBytes(16);
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/pdf").setBody("x".repeat(64)));

        assertThatThrownBy(() -> fingerprinter.fingerprint(server.url("/big.pdf").toString()))
            .isInstanceOfSatisfying(FetchFailureException.class, e ->
                assertThat(e.reasonCode()).isEqualTo(ReasonCodeClassifier.BODY_TOO_LARGE));
    }
}

package com.tariffmonitor.monitor.service;

import com.tariffmonitor.config.MonitorProperties;
import com.tariffmonitor.monitor.http.DocumentHttpClient;
import com.tariffmonitor.monitor.http.FetchFailureException;
import com.tariffmonitor.monitor.model.DocumentFingerprint;
import com.tariffmonitor.monitor.model.HttpFetchResult;
import com.tariffmonitor.monitor.util.DocumentUrlUtils;
import com.tariffmonitor.monitor.util.HashUtils;
import com.tariffmonitor.monitor.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Service
public class Fingerprinter {
    private static final Logger log = LoggerFactory.getLogger(Fingerprinter.class);
    private static final String DOCUMENT_ACCEPT = "application/pdf,*/*";

    private final DocumentHttpClient httpClient;
    private final MonitorProperties properties;

    public Fingerprinter(DocumentHttpClient httpClient, MonitorProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    /**
     * Downloads the document and digests the exact bytes received.
     *
     * @throws FetchFailureException on network errors, timeouts, non-2xx status, an oversized
     *     body or a content type outside {@code monitor.fetch.expected-content-types}
     */
    public DocumentFingerprint fingerprint(String url) throws FetchFailureException {
        HttpFetchResult result = httpClient.get(url, DOCUMENT_ACCEPT, properties.getFetch().getMaxDocumentBytes());
        if (result.errorCode() != null) {
            throw new FetchFailureException(
                url,
                ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage()),
                result.errorMessage()
            );
        }
        if (!result.isSuccessful()) {
            throw new FetchFailureException(
                url,
                ReasonCodeClassifier.fromHttpStatus(result.statusCode()),
                "HTTP status " + result.statusCode()
            );
        }
        if (!isExpectedContentType(result.contentType())) {
            throw new FetchFailureException(
                url,
                ReasonCodeClassifier.UNEXPECTED_CONTENT_TYPE,
                "Content-Type " + result.contentType()
            );
        }

        byte[] body = result.bodyBytes() == null ? new byte[0] : result.bodyBytes();
        String fingerprint = HashUtils.sha256Hex(body);
        log.debug("Fingerprinted {} ({} bytes): {}", url, body.length, fingerprint);
        return new DocumentFingerprint(
            url,
            fingerprint,
            result.lastModified(),
            body.length,
            DocumentUrlUtils.documentName(url)
        );
    }

    private boolean isExpectedContentType(String contentType) {
        List<String> expected = properties.getFetch().getExpectedContentTypes();
        if (expected == null || expected.isEmpty()) {
            return true;
        }
        if (contentType == null) {
            return false;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return expected.stream().anyMatch(lower::contains);
    }
}

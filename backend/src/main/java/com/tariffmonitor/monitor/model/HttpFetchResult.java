package com.tariffmonitor.monitor.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    Instant lastModified,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isNotModified() {
        return statusCode == 304 && errorCode == null;
    }

    public String body() {
        return bodyBytes == null ? null : new String(bodyBytes, StandardCharsets.UTF_8);
    }
}

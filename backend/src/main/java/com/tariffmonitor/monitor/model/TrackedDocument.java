package com.tariffmonitor.monitor.model;

import java.time.Instant;

public record TrackedDocument(
    long id,
    String sourceName,
    String url,
    String displayName,
    String fingerprint,
    Instant lastChecked,
    Instant contentUpdatedAt,
    DocumentStatus status,
    String linkContext
) {
    public boolean isActive() {
        return status == DocumentStatus.ACTIVE;
    }
}

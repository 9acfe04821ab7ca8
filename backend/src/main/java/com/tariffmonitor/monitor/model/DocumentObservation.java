package com.tariffmonitor.monitor.model;

import java.time.Instant;

public record DocumentObservation(
    String sourceName,
    String url,
    String displayName,
    String fingerprint,
    Instant remoteModifiedAt,
    String linkContext,
    Instant checkedAt
) {
    public static DocumentObservation of(
        String sourceName,
        DetectionResult detection,
        String linkContext,
        Instant checkedAt
    ) {
        return new DocumentObservation(
            sourceName,
            detection.url(),
            detection.documentName(),
            detection.fingerprint(),
            detection.remoteModifiedAt(),
            linkContext,
            checkedAt
        );
    }
}

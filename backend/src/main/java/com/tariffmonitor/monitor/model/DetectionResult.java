package com.tariffmonitor.monitor.model;

import java.time.Instant;

/**
 * Outcome of one change check. {@code byteSize} is null when the quick probe short-circuited
 * and no body was downloaded.
 */
public record DetectionResult(
    String url,
    String fingerprint,
    Instant remoteModifiedAt,
    boolean changed,
    Long byteSize,
    String documentName,
    ProbeOutcome probe
) {
    public boolean fullyFetched() {
        return byteSize != null;
    }
}

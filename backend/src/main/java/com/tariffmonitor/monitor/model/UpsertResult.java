package com.tariffmonitor.monitor.model;

/**
 * {@code fingerprintChanged} compares against the row as it was before this write, so
 * re-applying the same observation reports {@code false}.
 */
public record UpsertResult(TrackedDocument document, boolean newRecord, boolean fingerprintChanged) {
    public boolean contentChanged() {
        return newRecord || fingerprintChanged;
    }
}

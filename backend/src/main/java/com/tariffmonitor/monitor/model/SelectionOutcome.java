package com.tariffmonitor.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * One selected url within a source. Either a recorded detection or a failure description.
 */
public record SelectionOutcome(
    String url,
    String rationale,
    boolean changed,
    boolean newRecord,
    DocumentStatus status,
    Instant remoteModifiedAt,
    String failure
) {
    public static SelectionOutcome recorded(SelectedDocument selected, UpsertResult upsert, DetectionResult detection) {
        TrackedDocument document = upsert.document();
        return new SelectionOutcome(
            selected.url(),
            selected.rationale(),
            upsert.contentChanged(),
            upsert.newRecord(),
            document.status(),
            detection.remoteModifiedAt() != null ? detection.remoteModifiedAt() : document.contentUpdatedAt(),
            null
        );
    }

    public static SelectionOutcome failed(SelectedDocument selected, String failure) {
        return new SelectionOutcome(selected.url(), selected.rationale(), false, false, null, null, failure);
    }

    @JsonIgnore
    public boolean isFailure() {
        return failure != null;
    }

    @JsonIgnore
    public boolean isAdded() {
        return !isFailure() && newRecord;
    }

    @JsonIgnore
    public boolean isUpdated() {
        return !isFailure() && !newRecord && changed;
    }

    /**
     * Folds a later recording of the same url into this one. A url that was new or changed on its
     * first recording stays so, since the store answers a repeated write with "unchanged".
     */
    public SelectionOutcome mergedWith(SelectionOutcome later) {
        if (isFailure() || later.isFailure()) {
            return later;
        }
        return new SelectionOutcome(
            later.url,
            later.rationale,
            changed || later.changed,
            newRecord || later.newRecord,
            later.status,
            later.remoteModifiedAt,
            null
        );
    }

    public SelectionOutcome withStatus(DocumentStatus newStatus) {
        return new SelectionOutcome(url, rationale, changed, newRecord, newStatus, remoteModifiedAt, failure);
    }
}

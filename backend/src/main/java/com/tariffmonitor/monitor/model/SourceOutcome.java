package com.tariffmonitor.monitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Accumulated result for one source page. Immutable: every {@code with*} call returns a copy.
 * Counters are derived from the selections, and a url recorded twice is merged into its
 * earlier entry, so repeated recording leaves the counts as they were.
 */
public record SourceOutcome(
    String sourceName,
    String sourceUrl,
    int candidatesFound,
    int candidatesSelected,
    String selectionRationale,
    List<SelectionOutcome> selections,
    List<String> sourceErrors
) {
    public SourceOutcome {
        selections = selections == null ? List.of() : List.copyOf(selections);
        sourceErrors = sourceErrors == null ? List.of() : List.copyOf(sourceErrors);
    }

    public static SourceOutcome started(MonitoredSource source) {
        return new SourceOutcome(source.sourceName(), source.sourceUrl(), 0, 0, null, List.of(), List.of());
    }

    public SourceOutcome withCandidatesFound(int found) {
        return new SourceOutcome(sourceName, sourceUrl, found, candidatesSelected, selectionRationale, selections, sourceErrors);
    }

    public SourceOutcome withSelection(int selectedCount, String rationale) {
        return new SourceOutcome(sourceName, sourceUrl, candidatesFound, selectedCount, rationale, selections, sourceErrors);
    }

    public SourceOutcome withOutcome(SelectionOutcome outcome) {
        List<SelectionOutcome> updated = new ArrayList<>(selections);
        int existing = indexOf(outcome.url());
        if (existing >= 0) {
            updated.set(existing, updated.get(existing).mergedWith(outcome));
        } else {
            updated.add(outcome);
        }
        return new SourceOutcome(sourceName, sourceUrl, candidatesFound, candidatesSelected, selectionRationale, updated, sourceErrors);
    }

    public SourceOutcome withSourceError(String description) {
        List<String> updated = new ArrayList<>(sourceErrors);
        updated.add(description);
        return new SourceOutcome(sourceName, sourceUrl, candidatesFound, candidatesSelected, selectionRationale, selections, updated);
    }

    public SourceOutcome withStatus(Collection<String> urls, DocumentStatus status) {
        List<SelectionOutcome> updated = new ArrayList<>(selections.size());
        for (SelectionOutcome outcome : selections) {
            if (!outcome.isFailure() && urls.contains(outcome.url())) {
                updated.add(outcome.withStatus(status));
            } else {
                updated.add(outcome);
            }
        }
        return new SourceOutcome(sourceName, sourceUrl, candidatesFound, candidatesSelected, selectionRationale, updated, sourceErrors);
    }

    @JsonProperty("added")
    public int added() {
        return (int) selections.stream().filter(SelectionOutcome::isAdded).count();
    }

    @JsonProperty("updated")
    public int updated() {
        return (int) selections.stream().filter(SelectionOutcome::isUpdated).count();
    }

    @JsonProperty("errors")
    public int errors() {
        return (int) selections.stream().filter(SelectionOutcome::isFailure).count() + sourceErrors.size();
    }

    private int indexOf(String url) {
        for (int i = 0; i < selections.size(); i++) {
            if (selections.get(i).url().equals(url)) {
                return i;
            }
        }
        return -1;
    }
}

package com.tariffmonitor.monitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcomes of one batch run, in the order sources were processed.
 */
public record RunRecord(String sourceList, Instant startedAt, List<SourceOutcome> sources) {
    public RunRecord {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static RunRecord empty(String sourceList, Instant startedAt) {
        return new RunRecord(sourceList, startedAt, List.of());
    }

    public RunRecord append(SourceOutcome outcome) {
        List<SourceOutcome> updated = new ArrayList<>(sources);
        updated.add(outcome);
        return new RunRecord(sourceList, startedAt, updated);
    }

    @JsonProperty("totalAdded")
    public int totalAdded() {
        return sources.stream().mapToInt(SourceOutcome::added).sum();
    }

    @JsonProperty("totalUpdated")
    public int totalUpdated() {
        return sources.stream().mapToInt(SourceOutcome::updated).sum();
    }

    @JsonProperty("totalErrors")
    public int totalErrors() {
        return sources.stream().mapToInt(SourceOutcome::errors).sum();
    }
}

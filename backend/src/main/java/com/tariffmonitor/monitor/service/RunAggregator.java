package com.tariffmonitor.monitor.service;

import com.tariffmonitor.monitor.model.DetectionResult;
import com.tariffmonitor.monitor.model.DocumentSelection;
import com.tariffmonitor.monitor.model.DocumentStatus;
import com.tariffmonitor.monitor.model.RunRecord;
import com.tariffmonitor.monitor.model.SelectedDocument;
import com.tariffmonitor.monitor.model.SelectionOutcome;
import com.tariffmonitor.monitor.model.SourceOutcome;
import com.tariffmonitor.monitor.model.UpsertResult;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Folds per-source events into immutable {@link SourceOutcome} and {@link RunRecord} values.
 * Holds no state, so sources processed in parallel never share anything here.
 */
@Component
public class RunAggregator {

    public SourceOutcome recordCandidates(SourceOutcome outcome, int candidatesFound) {
        return outcome.withCandidatesFound(candidatesFound);
    }

    public SourceOutcome recordSelection(SourceOutcome outcome, DocumentSelection selection) {
        return outcome.withSelection(selection.selected().size(), selection.overallRationale());
    }

    public SourceOutcome recordDetection(
        SourceOutcome outcome,
        SelectedDocument selected,
        DetectionResult detection,
        UpsertResult upsert
    ) {
        return outcome.withOutcome(SelectionOutcome.recorded(selected, upsert, detection));
    }

    public SourceOutcome recordFailure(SourceOutcome outcome, SelectedDocument selected, String description) {
        return outcome.withOutcome(SelectionOutcome.failed(selected, description));
    }

    public SourceOutcome recordSourceError(SourceOutcome outcome, String description) {
        return outcome.withSourceError(description);
    }

    public SourceOutcome markStatus(SourceOutcome outcome, Collection<String> urls, DocumentStatus status) {
        return outcome.withStatus(urls, status);
    }

    public RunRecord appendSource(RunRecord record, SourceOutcome outcome) {
        return record.append(outcome);
    }
}

package com.tariffmonitor.monitor.service;

import com.tariffmonitor.monitor.discovery.CandidateResolutionException;
import com.tariffmonitor.monitor.discovery.CandidateResolver;
import com.tariffmonitor.monitor.http.FetchFailureException;
import com.tariffmonitor.monitor.model.CandidateLink;
import com.tariffmonitor.monitor.model.DetectionResult;
import com.tariffmonitor.monitor.model.DocumentObservation;
import com.tariffmonitor.monitor.model.DocumentSelection;
import com.tariffmonitor.monitor.model.DocumentStatus;
import com.tariffmonitor.monitor.model.MonitoredSource;
import com.tariffmonitor.monitor.model.SelectedDocument;
import com.tariffmonitor.monitor.model.SourceOutcome;
import com.tariffmonitor.monitor.model.TrackedDocument;
import com.tariffmonitor.monitor.model.UpsertResult;
import com.tariffmonitor.monitor.persistence.DocumentStoreException;
import com.tariffmonitor.monitor.selection.DocumentSelectionException;
import com.tariffmonitor.monitor.selection.DocumentSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one source end to end: resolve candidates, select, detect changes, record, supersede.
 *
 * <p>Fetch failures stay local to their url. A source is only superseded when every selected
 * url was recorded, so a partial run never retires the previous active document.
 */
@Service
public class SourceMonitorService {
    private static final Logger log = LoggerFactory.getLogger(SourceMonitorService.class);

    private final CandidateResolver candidateResolver;
    private final DocumentSelector documentSelector;
    private final ChangeDetector changeDetector;
    private final DocumentStore documentStore;
    private final RunAggregator aggregator;

    public SourceMonitorService(
        CandidateResolver candidateResolver,
        DocumentSelector documentSelector,
        ChangeDetector changeDetector,
        DocumentStore documentStore,
        RunAggregator aggregator
    ) {
        this.candidateResolver = candidateResolver;
        this.documentSelector = documentSelector;
        this.changeDetector = changeDetector;
        this.documentStore = documentStore;
        this.aggregator = aggregator;
    }

    public SourceOutcome process(MonitoredSource source, boolean quickMode) {
        SourceOutcome outcome = SourceOutcome.started(source);
        log.info("Processing {} ({})", source.sourceName(), source.sourceUrl());

        List<CandidateLink> candidates;
        try {
            candidates = candidateResolver.resolveCandidates(source.sourceUrl());
        } catch (CandidateResolutionException e) {
            log.warn("Candidate resolution failed for {}: {}", source.sourceName(), e.getMessage());
            return aggregator.recordSourceError(outcome, "candidate_resolution_failed: " + e.getMessage());
        }
        outcome = aggregator.recordCandidates(outcome, candidates.size());
        if (candidates.isEmpty()) {
            log.info("No PDF candidates found for {}", source.sourceName());
            return outcome;
        }

        DocumentSelection selection;
        try {
            selection = documentSelector.select(source.sourceName(), candidates);
        } catch (DocumentSelectionException e) {
            log.warn("Selection failed for {}: {}", source.sourceName(), e.getMessage());
            outcome = aggregator.recordSelection(outcome, DocumentSelection.none(null));
            return aggregator.recordSourceError(outcome, "selection_failed: " + e.getMessage());
        }
        outcome = aggregator.recordSelection(outcome, selection);

        Map<String, CandidateLink> candidatesByUrl = new LinkedHashMap<>();
        candidates.forEach(candidate -> candidatesByUrl.putIfAbsent(candidate.url(), candidate));

        Set<String> recordedUrls = new LinkedHashSet<>();
        boolean anyFailed = false;
        for (SelectedDocument selected : selection.selected()) {
            try {
                TrackedDocument prior = documentStore.findByUrl(selected.url());
                DetectionResult detection = changeDetector.detect(selected.url(), prior, quickMode);
                CandidateLink candidate = candidatesByUrl.get(selected.url());
                DocumentObservation observation = DocumentObservation.of(
                    source.sourceName(),
                    detection,
                    candidate == null ? null : candidate.linkContext(),
                    Instant.now().truncatedTo(ChronoUnit.MILLIS)
                );
                UpsertResult upsert = documentStore.upsert(observation);
                outcome = aggregator.recordDetection(outcome, selected, detection, upsert);
                recordedUrls.add(selected.url());
            } catch (FetchFailureException e) {
                log.warn("Fetch failed for {}: {} {}", e.url(), e.reasonCode(), e.detail());
                outcome = aggregator.recordFailure(outcome, selected, e.reasonCode() + ": " + e.detail());
                anyFailed = true;
            } catch (DocumentStoreException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Unexpected failure checking {} for {}", selected.url(), source.sourceName(), e);
                outcome = aggregator.recordFailure(
                    outcome,
                    selected,
                    "source_processing_exception: " + e.getClass().getSimpleName()
                );
                anyFailed = true;
            }
        }

        if (!recordedUrls.isEmpty() && !anyFailed) {
            documentStore.supersede(source.sourceName(), recordedUrls);
            outcome = aggregator.markStatus(outcome, recordedUrls, DocumentStatus.ACTIVE);
        } else if (anyFailed) {
            log.info("Skipping supersession for {}: at least one selected document failed", source.sourceName());
        }

        log.info(
            "Summary {}: candidates={}, selected={}, added={}, updated={}, errors={}",
            source.sourceName(),
            outcome.candidatesFound(),
            outcome.candidatesSelected(),
            outcome.added(),
            outcome.updated(),
            outcome.errors()
        );
        return outcome;
    }
}

package com.tariffmonitor.monitor.service;

import com.tariffmonitor.config.MonitorProperties;
import com.tariffmonitor.config.SchemaInitializer;
import com.tariffmonitor.monitor.model.MonitorRunRequest;
import com.tariffmonitor.monitor.model.MonitorRunSummary;
import com.tariffmonitor.monitor.model.MonitoredSource;
import com.tariffmonitor.monitor.model.RunRecord;
import com.tariffmonitor.monitor.model.SourceOutcome;
import com.tariffmonitor.monitor.persistence.DocumentStoreException;
import com.tariffmonitor.monitor.report.MarkdownReportRenderer;
import com.tariffmonitor.monitor.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch entry point: loads a source list, processes every source on the source executor,
 * folds the outcomes in list order and writes the Markdown report next to the other reports.
 */
@Service
public class MonitorRunService {
    private static final Logger log = LoggerFactory.getLogger(MonitorRunService.class);

    private final SourceListLoader sourceListLoader;
    private final SourceMonitorService sourceMonitorService;
    private final RunAggregator aggregator;
    private final MarkdownReportRenderer reportRenderer;
    private final ReportWriter reportWriter;
    private final SchemaInitializer schemaInitializer;
    private final ExecutorService sourceExecutor;
    private final MonitorProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MonitorRunService(
        SourceListLoader sourceListLoader,
        SourceMonitorService sourceMonitorService,
        RunAggregator aggregator,
        MarkdownReportRenderer reportRenderer,
        ReportWriter reportWriter,
        SchemaInitializer schemaInitializer,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor,
        MonitorProperties properties
    ) {
        this.sourceListLoader = sourceListLoader;
        this.sourceMonitorService = sourceMonitorService;
        this.aggregator = aggregator;
        this.reportRenderer = reportRenderer;
        this.reportWriter = reportWriter;
        this.schemaInitializer = schemaInitializer;
        this.sourceExecutor = sourceExecutor;
        this.properties = properties;
    }

    public boolean isRunning() {
        return running.get();
    }

    public MonitorRunSummary run(MonitorRunRequest request) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveMonitorRunException("A monitor run is already in progress");
        }
        try {
            return runExclusive(request);
        } finally {
            running.set(false);
        }
    }

    private MonitorRunSummary runExclusive(MonitorRunRequest request) {
        if (request == null || request.sourceListPath() == null || request.sourceListPath().isBlank()) {
            throw new SourceListException("A source list path is required");
        }
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        Path sourceListPath = Path.of(request.sourceListPath().trim());

        if (request.initialize() || properties.isInitialize()) {
            schemaInitializer.initialize();
        }

        List<MonitoredSource> sources = sourceListLoader.load(sourceListPath);
        log.info("Monitor run {} started: sources={}, quickMode={}", runId, sources.size(), request.quickMode());

        AtomicBoolean aborted = new AtomicBoolean(false);
        List<CompletableFuture<SourceOutcome>> futures = new ArrayList<>();
        for (MonitoredSource source : sources) {
            futures.add(CompletableFuture.supplyAsync(
                () -> aborted.get() ? null : sourceMonitorService.process(source, request.quickMode()),
                sourceExecutor
            ));
        }

        RunRecord record = RunRecord.empty(sourceListPath.toString(), startedAt);
        for (int i = 0; i < futures.size(); i++) {
            MonitoredSource source = sources.get(i);
            SourceOutcome outcome;
            try {
                outcome = futures.get(i).join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof DocumentStoreException storeFailure) {
                    aborted.set(true);
                    awaitSettled(futures);
                    log.error("Monitor run {} failed: document store unavailable", runId, storeFailure);
                    throw new MonitorRunException("Monitor run " + runId + " failed: " + storeFailure.getMessage(), storeFailure);
                }
                log.warn("Source processing failed for {} ({})", source.sourceName(), source.sourceUrl(), cause);
                outcome = aggregator.recordSourceError(
                    SourceOutcome.started(source),
                    "source_processing_exception: " + cause.getClass().getSimpleName()
                );
            }
            record = aggregator.appendSource(record, outcome);
        }

        String report = reportRenderer.render(record, "Tariff Monitor Report: " + ReportWriter.stem(sourceListPath));
        Path reportPath;
        try {
            reportPath = reportWriter.write(sourceListPath, report);
        } catch (IOException e) {
            throw new MonitorRunException("Monitor run " + runId + " could not write its report", e);
        }

        Instant finishedAt = Instant.now();
        String status = record.totalErrors() > 0 ? "COMPLETED_WITH_ERRORS" : "COMPLETED";
        log.info(
            "Monitor run {} {}: sources={}, added={}, updated={}, errors={}, report={}",
            runId,
            status,
            record.sources().size(),
            record.totalAdded(),
            record.totalUpdated(),
            record.totalErrors(),
            reportPath
        );
        return new MonitorRunSummary(
            runId,
            startedAt,
            finishedAt,
            status,
            request.quickMode(),
            reportPath.toString(),
            record
        );
    }

    /**
     * Blocks until every source task has finished. Sources not yet started see the abort flag and
     * return immediately; sources already writing are allowed to finish before the guard is released.
     */
    private static void awaitSettled(List<CompletableFuture<SourceOutcome>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
            .handle((ignored, error) -> null)
            .join();
    }
}

package com.tariffmonitor.monitor.model;

import java.time.Instant;

public record MonitorRunSummary(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    boolean quickMode,
    String reportPath,
    RunRecord record
) {}

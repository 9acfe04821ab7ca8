package com.tariffmonitor.monitor.api;

public record MonitorApiRunRequest(
    String sourceListPath,
    Boolean quickMode,
    Boolean initialize
) {
}

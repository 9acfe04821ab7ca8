package com.tariffmonitor.monitor.model;

public record MonitorRunRequest(String sourceListPath, boolean quickMode, boolean initialize) {}

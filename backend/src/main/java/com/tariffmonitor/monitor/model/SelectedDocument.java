package com.tariffmonitor.monitor.model;

public record SelectedDocument(String url, String rationale) {}

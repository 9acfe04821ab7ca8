package com.tariffmonitor.monitor.model;

public record CandidateLink(String url, String linkText, String context) {
    public String linkContext() {
        if (linkText != null && !linkText.isBlank()) {
            return linkText;
        }
        return context;
    }
}

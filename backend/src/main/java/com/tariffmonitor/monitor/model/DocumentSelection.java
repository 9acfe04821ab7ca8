package com.tariffmonitor.monitor.model;

import java.util.List;

public record DocumentSelection(List<SelectedDocument> selected, String overallRationale) {
    public DocumentSelection {
        selected = selected == null ? List.of() : List.copyOf(selected);
    }

    public static DocumentSelection none(String rationale) {
        return new DocumentSelection(List.of(), rationale);
    }
}

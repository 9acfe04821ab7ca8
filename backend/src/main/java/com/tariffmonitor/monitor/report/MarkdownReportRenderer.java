package com.tariffmonitor.monitor.report;

import com.tariffmonitor.config.MonitorProperties;
import com.tariffmonitor.monitor.model.RunRecord;
import com.tariffmonitor.monitor.model.SelectionOutcome;
import com.tariffmonitor.monitor.model.SourceOutcome;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Renders a {@link RunRecord} as Markdown: a summary table with one row per source, followed
 * by one anchored detail section per source.
 */
@Component
public class MarkdownReportRenderer {
    private final int rationaleSummaryLength;

    public MarkdownReportRenderer(MonitorProperties properties) {
        this.rationaleSummaryLength = properties.getReport().getRationaleSummaryLength();
    }

    public String render(RunRecord record, String title) {
        StringBuilder out = new StringBuilder();
        out.append("# ").append(flatten(title)).append("\n\n");
        out.append("Source list: `").append(nullToDash(record.sourceList())).append("`  \n");
        out.append("Started: ").append(formatInstant(record.startedAt())).append("  \n");
        out.append("Totals: added=").append(record.totalAdded())
            .append(", updated=").append(record.totalUpdated())
            .append(", errors=").append(record.totalErrors())
            .append("\n\n");

        out.append("## Summary\n\n");
        out.append("| # | Source | Candidates Found | Selected | Rationale | Added | Updated | Errors |\n");
        out.append("|---|--------|------------------|----------|-----------|-------|---------|--------|\n");
        List<SourceOutcome> sources = record.sources();
        for (int i = 0; i < sources.size(); i++) {
            SourceOutcome source = sources.get(i);
            int ordinal = i + 1;
            out.append("| ").append(ordinal)
                .append(" | [").append(linkText(source.sourceName())).append("](#").append(anchor(ordinal)).append(")")
                .append(" | ").append(source.candidatesFound())
                .append(" | ").append(source.candidatesSelected())
                .append(" | ").append(cell(summarize(source.selectionRationale())))
                .append(" | ").append(source.added())
                .append(" | ").append(source.updated())
                .append(" | ").append(source.errors())
                .append(" |\n");
        }
        if (sources.isEmpty()) {
            out.append("\nNo sources were processed.\n");
        }

        out.append("\n## Details\n");
        for (int i = 0; i < sources.size(); i++) {
            appendDetail(out, i + 1, sources.get(i));
        }
        return out.toString();
    }

    private void appendDetail(StringBuilder out, int ordinal, SourceOutcome source) {
        out.append("\n<a id=\"").append(anchor(ordinal)).append("\"></a>\n");
        out.append("### ").append(ordinal).append(". ").append(flatten(source.sourceName())).append("\n\n");
        out.append("- Source url: ").append(nullToDash(source.sourceUrl())).append("\n");
        out.append("- Candidates found: ").append(source.candidatesFound()).append("\n");
        out.append("- Selected: ").append(source.candidatesSelected()).append("\n");
        out.append("- Selection rationale: ").append(nullToDash(flatten(source.selectionRationale()))).append("\n");

        if (!source.sourceErrors().isEmpty()) {
            out.append("\n**Source errors**\n\n");
            for (String error : source.sourceErrors()) {
                out.append("- ").append(flatten(error)).append("\n");
            }
        }

        if (source.selections().isEmpty()) {
            out.append("\nNo documents selected.\n");
            return;
        }
        out.append("\n**Selected documents**\n\n");
        for (SelectionOutcome selection : source.selections()) {
            out.append("- ").append(selection.url()).append("\n");
            out.append("  - Rationale: ").append(nullToDash(flatten(selection.rationale()))).append("\n");
            if (selection.isFailure()) {
                out.append("  - Error: ").append(flatten(selection.failure())).append("\n");
                continue;
            }
            out.append("  - Changed: ").append(selection.changed() ? "yes" : "no")
                .append(selection.newRecord() ? " (new document)" : "").append("\n");
            out.append("  - Status: ").append(selection.status() == null ? "-" : selection.status().name()).append("\n");
            out.append("  - Remote last modified: ").append(formatInstant(selection.remoteModifiedAt())).append("\n");
        }
    }

    String summarize(String rationale) {
        if (rationale == null || rationale.isBlank()) {
            return "-";
        }
        String flat = flatten(rationale);
        if (flat.codePointCount(0, flat.length()) <= rationaleSummaryLength) {
            return flat;
        }
        return flat.substring(0, flat.offsetByCodePoints(0, rationaleSummaryLength)) + "...";
    }

    static String anchor(int ordinal) {
        return "source-" + ordinal;
    }

    private static String cell(String value) {
        return flatten(value).replace("|", "\\|");
    }

    private static String linkText(String value) {
        return cell(value).replace("[", "\\[").replace("]", "\\]");
    }

    private static String flatten(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ').trim();
    }

    private static String nullToDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }

    private static String formatInstant(Instant value) {
        return value == null ? "-" : value.toString();
    }
}

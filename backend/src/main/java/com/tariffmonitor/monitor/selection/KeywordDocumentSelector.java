package com.tariffmonitor.monitor.selection;

import com.tariffmonitor.monitor.model.CandidateLink;
import com.tariffmonitor.monitor.model.DocumentSelection;
import com.tariffmonitor.monitor.model.SelectedDocument;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic selector used when no LLM is configured. Scores each candidate by the tariff
 * keywords found in its link text, context and url; ties keep page order.
 */
public class KeywordDocumentSelector implements DocumentSelector {
    private static final List<String> KEYWORDS = List.of(
        "commercial",
        "tariff",
        "rate",
        "schedule",
        "general service",
        "business"
    );

    private final int maxSelected;

    public KeywordDocumentSelector(int maxSelected) {
        this.maxSelected = Math.max(1, maxSelected);
    }

    @Override
    public DocumentSelection select(String sourceName, List<CandidateLink> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return DocumentSelection.none("No candidates to select from");
        }
        List<Scored> scored = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            CandidateLink candidate = candidates.get(i);
            scored.add(new Scored(candidate, score(candidate), i));
        }
        List<Scored> ranked = scored.stream()
            .filter(entry -> entry.score() > 0)
            .sorted(Comparator.comparingInt(Scored::score).reversed().thenComparingInt(Scored::position))
            .limit(maxSelected)
            .toList();
        if (ranked.isEmpty()) {
            return DocumentSelection.none("No candidate matched tariff keywords");
        }

        List<SelectedDocument> selected = new ArrayList<>();
        for (Scored entry : ranked) {
            selected.add(new SelectedDocument(
                entry.candidate().url(),
                "Matched " + entry.score() + " tariff keyword(s) in \"" + describe(entry.candidate()) + "\""
            ));
        }
        return new DocumentSelection(
            selected,
            "Keyword match over " + candidates.size() + " candidate(s) for " + sourceName
        );
    }

    private int score(CandidateLink candidate) {
        String haystack = String.join(
            " ",
            nullToEmpty(candidate.linkText()),
            nullToEmpty(candidate.context()),
            nullToEmpty(candidate.url())
        ).toLowerCase(Locale.ROOT);
        int score = 0;
        for (String keyword : KEYWORDS) {
            if (haystack.contains(keyword)) {
                score++;
            }
        }
        return score;
    }

    private String describe(CandidateLink candidate) {
        String text = candidate.linkContext();
        return text == null || text.isBlank() ? candidate.url() : text;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record Scored(CandidateLink candidate, int score, int position) {}
}

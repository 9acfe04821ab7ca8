package com.tariffmonitor.monitor.selection;

import com.tariffmonitor.monitor.model.CandidateLink;
import com.tariffmonitor.monitor.model.DocumentSelection;
import com.tariffmonitor.monitor.model.SelectedDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordDocumentSelectorTest {

    @Test
    void picksBestScoringCandidate() {
        KeywordDocumentSelector selector = new KeywordDocumentSelector(1);
        List<CandidateLink> candidates = List.of(
            new CandidateLink("https://u.example/annual-report.pdf", "Annual Report", null),
            new CandidateLink("https://u.example/residential-rates.pdf", "Residential Rates", null),
            new CandidateLink("https://u.example/commercial-tariff.pdf", "Commercial Rate Schedule", null)
        );

        DocumentSelection selection = selector.select("Acme Electric", candidates);

        assertThat(selection.selected()).extracting(SelectedDocument::url)
            .containsExactly("https://u.example/commercial-tariff.pdf");
        assertThat(selection.selected().get(0).rationale()).contains("Commercial Rate Schedule");
        assertThat(selection.overallRationale()).contains("Acme Electric");
    }

    @Test
    void tiesKeepPageOrderAndRespectLimit() {
        KeywordDocumentSelector selector = new KeywordDocumentSelector(2);
        List<CandidateLink> candidates = List.of(
            new CandidateLink("https://u.example/a.pdf", "Tariff A", null),
            new CandidateLink("https://u.example/b.pdf", "Tariff B", null),
            new CandidateLink("https://u.example/c.pdf", "Tariff C", null)
        );

        DocumentSelection selection = selector.select("Acme Electric", candidates);

        assertThat(selection.selected()).extracting(SelectedDocument::url)
            .containsExactly("https://u.example/a.pdf", "https://u.example/b.pdf");
    }

    @Test
    void selectsNothingWithoutKeywordMatch() {
        KeywordDocumentSelector selector = new KeywordDocumentSelector(1);

        DocumentSelection selection = selector.select(
            "Acme Electric",
            List.of(new CandidateLink("https://u.example/newsletter.pdf", "Newsletter", null))
        );

        assertThat(selection.selected()).isEmpty();
        assertThat(selection.overallRationale()).isNotBlank();
    }

    @Test
    void emptyCandidatesSelectNothing() {
        assertThat(new KeywordDocumentSelector(1).select("Acme Electric", List.of()).selected()).isEmpty();
    }
}

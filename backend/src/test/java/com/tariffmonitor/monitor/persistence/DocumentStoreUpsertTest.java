package com.tariffmonitor.monitor.persistence;

import com.tariffmonitor.monitor.model.DetectionResult;
import com.tariffmonitor.monitor.model.DocumentObservation;
import com.tariffmonitor.monitor.model.DocumentStatus;
import com.tariffmonitor.monitor.model.MonitoredSource;
import com.tariffmonitor.monitor.model.ProbeOutcome;
import com.tariffmonitor.monitor.model.SelectedDocument;
import com.tariffmonitor.monitor.model.SourceOutcome;
import com.tariffmonitor.monitor.model.TrackedDocument;
import com.tariffmonitor.monitor.model.UpsertResult;
import com.tariffmonitor.monitor.service.DocumentStore;
import com.tariffmonitor.monitor.service.RunAggregator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class DocumentStoreUpsertTest {

    @Autowired
    private DocumentStore store;

    @Autowired
    private TrackedDocumentRepository repository;

    @Test
    void firstObservationInsertsActiveRow() {
        String source = uniqueSource();
        String url = "https://acme.example/" + source + "/tariff-v1.pdf";
        Instant modified = Instant.parse("2024-01-01T00:00:00Z");

        UpsertResult result = store.upsert(observation(source, url, "H1", modified));

        assertThat(result.newRecord()).isTrue();
        assertThat(result.contentChanged()).isTrue();
        TrackedDocument row = store.findByUrl(url);
        assertThat(row.status()).isEqualTo(DocumentStatus.ACTIVE);
        assertThat(row.fingerprint()).isEqualTo("H1");
        assertThat(row.sourceName()).isEqualTo(source);
        assertThat(row.displayName()).isEqualTo("tariff-v1.pdf");
        assertThat(row.contentUpdatedAt()).isEqualTo(modified);
    }

    @Test
    void repeatedObservationIsIdempotent() {
        String source = uniqueSource();
        String url = "https://acme.example/" + source + "/tariff-v1.pdf";
        DocumentObservation observation = observation(source, url, "H1", null);

        UpsertResult first = store.upsert(observation);
        UpsertResult second = store.upsert(observation);

        assertThat(second.newRecord()).isFalse();
        assertThat(second.fingerprintChanged()).isFalse();
        assertThat(second.contentChanged()).isFalse();
        assertThat(second.document().id()).isEqualTo(first.document().id());
        assertThat(repository.countByUrl(url)).isEqualTo(1);
    }

    @Test
    void reapplyingDetectionLeavesRunCountsUnchanged() {
        String source = uniqueSource();
        String url = "https://acme.example/" + source + "/tariff-v1.pdf";
        SelectedDocument selected = new SelectedDocument(url, "commercial");
        DetectionResult detection = new DetectionResult(
            url, "H1", null, true, 10L, "tariff-v1.pdf", ProbeOutcome.NOT_ATTEMPTED);
        DocumentObservation observation = DocumentObservation.of(
            source, detection, "Commercial tariff", Instant.now().truncatedTo(ChronoUnit.MILLIS));
        RunAggregator aggregator = new RunAggregator();
        SourceOutcome outcome = SourceOutcome.started(new MonitoredSource(source, "https://acme.example/rates"));

        outcome = aggregator.recordDetection(outcome, selected, detection, store.upsert(observation));
        SourceOutcome once = outcome;
        outcome = aggregator.recordDetection(outcome, selected, detection, store.upsert(observation));

        assertThat(outcome.added()).isEqualTo(once.added()).isEqualTo(1);
        assertThat(outcome.updated()).isEqualTo(once.updated()).isZero();
        assertThat(outcome.selections()).hasSize(1);
        assertThat(outcome.selections().get(0).changed()).isTrue();
        assertThat(repository.countByUrl(url)).isEqualTo(1);
    }

    @Test
    void changedBytesUpdateFingerprintInPlace() {
        String source = uniqueSource();
        String url = "https://acme.example/" + source + "/tariff-v1.pdf";
        Instant firstModified = Instant.parse("2024-01-01T00:00:00Z");
        UpsertResult first = store.upsert(observation(source, url, "H1", firstModified));

        UpsertResult second = store.upsert(observation(source, url, "H2", null));

        assertThat(second.newRecord()).isFalse();
        assertThat(second.fingerprintChanged()).isTrue();
        assertThat(second.document().id()).isEqualTo(first.document().id());
        assertThat(second.document().fingerprint()).isEqualTo("H2");
        assertThat(second.document().contentUpdatedAt()).isNull();
    }

    @Test
    void unchangedBytesKeepRecordedContentTimestamp() {
        String source = uniqueSource();
        String url = "https://acme.example/" + source + "/tariff-v1.pdf";
        Instant modified = Instant.parse("2024-02-01T12:00:00Z");
        store.upsert(observation(source, url, "H1", modified));

        UpsertResult again = store.upsert(observation(source, url, "H1", null));

        assertThat(again.document().contentUpdatedAt()).isEqualTo(modified);
    }

    @Test
    void updatePreservesObsoleteStatus() {
        String source = uniqueSource();
        String url = "https://acme.example/" + source + "/tariff-v1.pdf";
        store.upsert(observation(source, url, "H1", null));
        assertThat(store.markObsolete(url)).isTrue();

        UpsertResult result = store.upsert(observation(source, url, "H2", null));

        assertThat(result.document().status()).isEqualTo(DocumentStatus.OBSOLETE);
        assertThat(repository.countByUrl(url)).isEqualTo(1);
    }

    @Test
    void supersedeRetiresOtherActiveDocumentsOfSource() {
        String source = uniqueSource();
        String otherSource = uniqueSource();
        String v1 = "https://acme.example/" + source + "/tariff-v1.pdf";
        String v2 = "https://acme.example/" + source + "/tariff-v2.pdf";
        String unrelated = "https://other.example/" + otherSource + "/tariff.pdf";
        store.upsert(observation(source, v1, "H1", null));
        store.upsert(observation(source, v2, "H2", null));
        store.upsert(observation(otherSource, unrelated, "H9", null));

        int superseded = store.supersede(source, List.of(v2));

        assertThat(superseded).isEqualTo(1);
        assertThat(store.findByUrl(v1).status()).isEqualTo(DocumentStatus.OBSOLETE);
        assertThat(store.findByUrl(v2).status()).isEqualTo(DocumentStatus.ACTIVE);
        assertThat(store.findByUrl(unrelated).status()).isEqualTo(DocumentStatus.ACTIVE);
        assertThat(store.findBySource(source)).hasSize(2);
    }

    @Test
    void supersedeReactivatesReselectedDocument() {
        String source = uniqueSource();
        String v1 = "https://acme.example/" + source + "/tariff-v1.pdf";
        String v2 = "https://acme.example/" + source + "/tariff-v2.pdf";
        store.upsert(observation(source, v1, "H1", null));
        store.upsert(observation(source, v2, "H2", null));
        store.supersede(source, List.of(v2));

        store.supersede(source, List.of(v1));

        assertThat(store.findByUrl(v1).status()).isEqualTo(DocumentStatus.ACTIVE);
        assertThat(store.findByUrl(v2).status()).isEqualTo(DocumentStatus.OBSOLETE);
        assertThat(repository.findActiveBySource(source))
            .extracting(TrackedDocument::url)
            .containsExactly(v1);
    }

    @Test
    void supersedeWithNothingRecordedIsNoOp() {
        String source = uniqueSource();
        String v1 = "https://acme.example/" + source + "/tariff-v1.pdf";
        store.upsert(observation(source, v1, "H1", null));

        assertThat(store.supersede(source, List.of())).isZero();
        assertThat(store.findByUrl(v1).isActive()).isTrue();
    }

    private static DocumentObservation observation(String source, String url, String hash, Instant modified) {
        return new DocumentObservation(
            source,
            url,
            url.substring(url.lastIndexOf('/') + 1),
            hash,
            modified,
            "Commercial tariff",
            Instant.now().truncatedTo(ChronoUnit.MILLIS)
        );
    }

    private static String uniqueSource() {
        return "Utility " + UUID.randomUUID().toString().substring(0, 8);
    }
}

package com.tariffmonitor.monitor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tariffmonitor.monitor.model.MonitoredSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceListLoaderTest {
    private final SourceListLoader loader = new SourceListLoader(new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void readsSeedCandidateShapeAndCanonicalNames() throws Exception {
        Path file = tempDir.resolve("sources.json");
        Files.writeString(file, """
            [
              {"utilityName": "Austin Energy", "eiaId": 1015, "sector": "Municipal",
               "rateName": "General Service", "sourceReference": "https://austinenergy.com/rates"},
              {"sourceName": "Acme Electric", "sourceUrl": "https://acme.example/rates"}
            ]
            """);

        List<MonitoredSource> sources = loader.load(file);

        assertThat(sources).containsExactly(
            new MonitoredSource("Austin Energy", "https://austinenergy.com/rates"),
            new MonitoredSource("Acme Electric", "https://acme.example/rates")
        );
    }

    @Test
    void skipsBlankEntriesAndCollapsesDuplicates() throws Exception {
        Path file = tempDir.resolve("sources.json");
        Files.writeString(file, """
            [
              {"sourceName": "Acme Electric", "sourceUrl": "https://acme.example/rates"},
              {"sourceName": " Acme Electric ", "sourceUrl": "https://acme.example/rates "},
              {"sourceName": "", "sourceUrl": "https://blank.example"},
              {"sourceName": "No Url"},
              {"sourceName": "Acme Electric", "sourceUrl": "https://acme.example/business"}
            ]
            """);

        List<MonitoredSource> sources = loader.load(file);

        assertThat(sources).extracting(MonitoredSource::sourceUrl)
            .containsExactly("https://acme.example/rates", "https://acme.example/business");
    }

    @Test
    void missingFileIsSourceListError() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.json")))
            .isInstanceOf(SourceListException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void malformedFileIsSourceListError() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"sourceName\": \"not an array\"");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(SourceListException.class);
    }
}

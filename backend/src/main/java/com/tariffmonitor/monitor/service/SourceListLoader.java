package com.tariffmonitor.monitor.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tariffmonitor.monitor.model.MonitoredSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the JSON source list. Entries without a name or url are skipped and repeated
 * (name, url) pairs collapse to their first occurrence.
 */
@Service
public class SourceListLoader {
    private static final Logger log = LoggerFactory.getLogger(SourceListLoader.class);
    private static final TypeReference<List<MonitoredSource>> SOURCE_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public SourceListLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<MonitoredSource> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new SourceListException("Source list not found: " + path);
        }
        List<MonitoredSource> raw;
        try {
            raw = objectMapper.readValue(path.toFile(), SOURCE_LIST);
        } catch (IOException e) {
            throw new SourceListException("Source list is not a JSON array of sources: " + path, e);
        }
        if (raw == null) {
            return List.of();
        }

        List<MonitoredSource> sources = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        int skipped = 0;
        for (MonitoredSource entry : raw) {
            if (entry == null || isBlank(entry.sourceName()) || isBlank(entry.sourceUrl())) {
                skipped++;
                continue;
            }
            MonitoredSource source = new MonitoredSource(entry.sourceName().trim(), entry.sourceUrl().trim());
            if (seen.add(source.sourceName() + "\n" + source.sourceUrl())) {
                sources.add(source);
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} incomplete entr(ies) in {}", skipped, path);
        }
        log.info("Loaded {} source(s) from {}", sources.size(), path);
        return sources;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

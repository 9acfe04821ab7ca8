package com.tariffmonitor.monitor.report;

import com.tariffmonitor.config.MonitorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final MonitorProperties properties;

    public ReportWriter(MonitorProperties properties) {
        this.properties = properties;
    }

    /**
     * Writes {@code <reports-dir>/<source-list stem>_report.md}, replacing an earlier report for
     * the same source list.
     */
    public Path write(Path sourceListPath, String markdown) throws IOException {
        Path directory = Path.of(properties.getReport().getDirectory());
        Files.createDirectories(directory);
        Path target = directory.resolve(stem(sourceListPath) + "_report.md");
        Files.writeString(target, markdown, StandardCharsets.UTF_8);
        log.info("Wrote report {}", target.toAbsolutePath());
        return target;
    }

    public static String stem(Path sourceListPath) {
        if (sourceListPath == null || sourceListPath.getFileName() == null) {
            return "monitor";
        }
        String fileName = sourceListPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return stem.isBlank() ? "monitor" : stem;
    }
}

package com.tariffmonitor.monitor.service;

import com.tariffmonitor.config.MonitorProperties;
import com.tariffmonitor.monitor.model.MonitorRunRequest;
import com.tariffmonitor.monitor.model.MonitorRunSummary;
import com.tariffmonitor.monitor.model.SourceOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class MonitorCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(MonitorCliRunner.class);

    private final MonitorProperties properties;
    private final MonitorRunService monitorRunService;
    private final ConfigurableApplicationContext applicationContext;

    public MonitorCliRunner(
        MonitorProperties properties,
        MonitorRunService monitorRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.monitorRunService = monitorRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        MonitorRunRequest request = new MonitorRunRequest(
            properties.getCli().getSourceList(),
            properties.isQuickMode(),
            properties.isInitialize()
        );

        int exitCode = 0;
        try {
            MonitorRunSummary summary = monitorRunService.run(request);
            log.info("Monitor run {} completed with status {}", summary.runId(), summary.status());
            for (SourceOutcome source : summary.record().sources()) {
                log.info(
                    "Summary {}: candidates={}, selected={}, added={}, updated={}, errors={}",
                    source.sourceName(),
                    source.candidatesFound(),
                    source.candidatesSelected(),
                    source.added(),
                    source.updated(),
                    source.errors()
                );
            }
            log.info("Report written to {}", summary.reportPath());
        } catch (MonitorRunException | SourceListException e) {
            log.error("Monitor run failed: {}", e.getMessage(), e);
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = exitCode;
            int status = SpringApplication.exit(applicationContext, () -> code);
            System.exit(status);
        }
    }
}

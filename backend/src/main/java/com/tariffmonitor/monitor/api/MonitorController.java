package com.tariffmonitor.monitor.api;

import com.tariffmonitor.config.MonitorProperties;
import com.tariffmonitor.monitor.model.MonitorRunRequest;
import com.tariffmonitor.monitor.model.MonitorRunSummary;
import com.tariffmonitor.monitor.service.MonitorRunService;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/monitor")
public class MonitorController {
  private final MonitorRunService monitorRunService;
  private final MonitorProperties properties;

  public MonitorController(MonitorRunService monitorRunService, MonitorProperties properties) {
    this.monitorRunService = monitorRunService;
    this.properties = properties;
  }

  @PostMapping("/runs")
  public MonitorRunSummary run(@RequestBody(required = false) MonitorApiRunRequest request) {
    String sourceListPath = request == null || request.sourceListPath() == null || request.sourceListPath().isBlank()
        ? properties.getCli().getSourceList()
        : request.sourceListPath();
    boolean quickMode = request == null || request.quickMode() == null
        ? properties.isQuickMode()
        : request.quickMode();
    boolean initialize = request != null && request.initialize() != null && request.initialize();
    return monitorRunService.run(new MonitorRunRequest(sourceListPath, quickMode, initialize));
  }

  @GetMapping("/runs/active")
  public Map<String, Boolean> active() {
    return Map.of("running", monitorRunService.isRunning());
  }
}

package com.tariffmonitor.monitor.api;

import com.tariffmonitor.monitor.service.ActiveMonitorRunException;
import com.tariffmonitor.monitor.service.MonitorRunException;
import com.tariffmonitor.monitor.service.SourceListException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class MonitorExceptionHandler {

  @ExceptionHandler(ActiveMonitorRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveMonitorRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_monitor_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(SourceListException.class)
  public ResponseEntity<Map<String, String>> handleSourceList(SourceListException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_source_list", "message", ex.getMessage()));
  }

  @ExceptionHandler(MonitorRunException.class)
  public ResponseEntity<Map<String, String>> handleRunFailure(MonitorRunException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "monitor_run_failed", "message", ex.getMessage()));
  }
}

package com.marketwatch.tracker.scrape.api;

import com.marketwatch.tracker.scrape.service.CycleAlreadyRunningException;
import com.marketwatch.tracker.scrape.service.SchedulerStartupException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {

  @ExceptionHandler(CycleAlreadyRunningException.class)
  public ResponseEntity<Map<String, String>> handleCycleRunning(CycleAlreadyRunningException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "cycle_running", "message", ex.getMessage()));
  }

  @ExceptionHandler(SchedulerStartupException.class)
  public ResponseEntity<Map<String, String>> handleStartup(SchedulerStartupException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "persistence_unreachable", "message", ex.getMessage()));
  }
}

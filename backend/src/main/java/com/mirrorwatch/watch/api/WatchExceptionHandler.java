package com.mirrorwatch.watch.api;

import com.mirrorwatch.watch.service.CycleInProgressException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class WatchExceptionHandler {

  @ExceptionHandler(CycleInProgressException.class)
  public ResponseEntity<Map<String, String>> handleCycleInProgress(CycleInProgressException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "cycle_in_progress", "message", ex.getMessage()));
  }
}

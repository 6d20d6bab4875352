package com.autoping.monitor.ping.api;

import com.autoping.monitor.ping.service.InvalidJobStateException;
import com.autoping.monitor.ping.service.JobNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class PingExceptionHandler {

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidJobStateException.class)
  public ResponseEntity<Map<String, String>> handleInvalidState(InvalidJobStateException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", ex.getCode(), "message", ex.getMessage()));
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<Map<String, String>> handleStatus(ResponseStatusException ex) {
    String reason = ex.getReason() == null ? ex.getStatusCode().toString() : ex.getReason();
    return ResponseEntity.status(ex.getStatusCode())
        .body(Map.of("error", "invalid_request", "message", reason));
  }
}

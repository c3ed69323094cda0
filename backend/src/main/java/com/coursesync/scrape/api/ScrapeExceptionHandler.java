package com.coursesync.scrape.api;

import com.coursesync.scrape.service.ActiveScrapeException;
import com.coursesync.scrape.service.ScrapeTooSoonException;
import com.coursesync.scrape.service.SubjectNotFoundException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {

  @ExceptionHandler(SubjectNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleUnknownSubject(SubjectNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_subject", "message", ex.getMessage()));
  }

  @ExceptionHandler(ActiveScrapeException.class)
  public ResponseEntity<Map<String, Object>> handleActiveScrape(ActiveScrapeException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "active_scrape");
    body.put("message", ex.getMessage());
    body.put("activeJobId", ex.getActiveJobId());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(ScrapeTooSoonException.class)
  public ResponseEntity<Map<String, Object>> handleTooSoon(ScrapeTooSoonException ex) {
    long waitSeconds = Math.max(1L, Duration.between(Instant.now(), ex.getRetryAfter()).getSeconds());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "scrape_too_soon");
    body.put("message", ex.getMessage());
    body.put("retryAfter", ex.getRetryAfter().toString());
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(waitSeconds))
        .body(body);
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
    String message = ex.getMessage() == null ? "bad request" : ex.getMessage();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", message));
  }
}

package io.intellixity.querydog.server.web;

import io.intellixity.querydog.exec.StorageException;
import io.intellixity.querydog.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps core failures onto HTTP. Rejected input is a client error; guarded statements are
 * forbidden; storage failures surface the server message as a 500.
 */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<Map<String, Object>> validation(QueryValidationException e) {
    HttpStatus status = switch (e.reason()) {
      case DESTRUCTIVE_STATEMENT, NON_SELECT_STATEMENT -> HttpStatus.FORBIDDEN;
      default -> HttpStatus.BAD_REQUEST;
    };
    log.debug("Rejected request ({}): {}", e.reason().code(), e.getMessage());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", e.getMessage());
    body.put("reason", e.reason().code());
    return ResponseEntity.status(status).body(body);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<Map<String, Object>> storage(StorageException e) {
    log.error("ClickHouse request failed: {}", e.getMessage(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
  }

  @ExceptionHandler(UncheckedIOException.class)
  public ResponseEntity<Map<String, Object>> io(UncheckedIOException e) {
    log.error("I/O failure: {}", e.getMessage(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", message == null ? status.getReasonPhrase() : message);
    return ResponseEntity.status(status).body(body);
  }
}

package io.intellixity.discover.server.web;

import io.intellixity.discover.governance.AccessDeniedException;
import io.intellixity.discover.query.QueryValidationException;
import io.intellixity.discover.server.service.FeatureDisabledException;
import io.intellixity.discover.spi.exec.QueryEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;

@RestControllerAdvice
public final class DiscoverExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(DiscoverExceptionHandler.class);

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<Map<String, List<String>>> invalid(QueryValidationException e) {
    return ResponseEntity.badRequest().body(e.errors());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, List<String>>> unreadable(HttpMessageNotReadableException e) {
    return ResponseEntity.badRequest()
        .body(Map.of(QueryValidationException.NON_FIELD_ERRORS, List.of("Malformed JSON body.")));
  }

  @ExceptionHandler(InvalidPageRequestException.class)
  public ResponseEntity<Map<String, String>> badPage(InvalidPageRequestException e) {
    return ResponseEntity.badRequest().body(Map.of("detail", e.getMessage()));
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Void> denied(AccessDeniedException e) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
  }

  @ExceptionHandler(FeatureDisabledException.class)
  public ResponseEntity<Void> disabled(FeatureDisabledException e) {
    log.debug("discover.http feature_disabled msg={}", e.getMessage());
    return ResponseEntity.notFound().build();
  }

  @ExceptionHandler(QueryEngineException.class)
  public ResponseEntity<Void> engine(QueryEngineException e) {
    log.warn("discover.http engine_failure msg={}", e.getMessage(), e);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).build();
  }
}

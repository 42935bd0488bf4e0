package com.chatrelay.backend.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final String INVALID_PAYLOAD = "Invalid request payload";

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(BindException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(resolveValidationMessage(ex));
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler({
    MissingRequestHeaderException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ProblemDetail> handleBadRequestParameters(Exception ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Bad request");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    if (ex.getStatusCode().is5xxServerError()) {
      log.warn("Request failed with {}: {}", ex.getStatusCode(), ex.getReason());
    }
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private String resolveValidationMessage(BindException ex) {
    return ex.getBindingResult().getAllErrors().stream()
        .findFirst()
        .map(
            error -> {
              String message =
                  error.getDefaultMessage() != null ? error.getDefaultMessage() : INVALID_PAYLOAD;
              return error instanceof FieldError fieldError
                  ? fieldError.getField() + ": " + message
                  : message;
            })
        .orElse(INVALID_PAYLOAD);
  }
}

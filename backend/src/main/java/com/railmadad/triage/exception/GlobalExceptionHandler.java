package com.railmadad.triage.exception;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  static final String RETRY_MESSAGE = "Complaint could not be registered, please retry";

  private static final Set<String> IGNORED_PATHS = Set.of("favicon.ico");

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  /** Fatal intake failures: the user only ever sees a generic retry message. */
  @ExceptionHandler(TriageException.class)
  public ResponseEntity<ErrorResponse> handleTriageException(
      TriageException ex, WebRequest request) {
    log.error("Complaint intake refused: {}", ex.getMessage(), ex);

    ErrorResponse.ErrorResponseBuilder builder =
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.SERVICE_UNAVAILABLE.value())
            .error(HttpStatus.SERVICE_UNAVAILABLE.getReasonPhrase())
            .message(RETRY_MESSAGE)
            .path(extractPath(request));

    if (isDebug()) {
      builder.debugMessage(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }

    return new ResponseEntity<>(builder.build(), HttpStatus.SERVICE_UNAVAILABLE);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationExceptions(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> errors = new HashMap<>();
    ex.getBindingResult()
        .getAllErrors()
        .forEach(
            error -> {
              String fieldName = ((FieldError) error).getField();
              errors.put(fieldName, error.getDefaultMessage());
            });

    log.warn("Validation failed: {}", errors);

    ErrorResponse errorResponse =
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.BAD_REQUEST.value())
            .error("Validation Failed")
            .message("Invalid request data")
            .validationErrors(errors)
            .path(extractPath(request))
            .build();

    return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFoundExceptions(Exception ex, WebRequest request) {
    String path = extractPath(request);

    if (IGNORED_PATHS.stream().noneMatch(path::contains)) {
      log.warn("Not found: {}", path);
    }
    return buildErrorResponse(HttpStatus.NOT_FOUND, "The requested resource was not found", request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = String.format("Request method '%s' is not supported", ex.getMethod());
    log.warn("Method not allowed: {}", message);
    return buildErrorResponse(HttpStatus.METHOD_NOT_ALLOWED, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Bad request: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed JSON request", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
    log.error("Unexpected error occurred", ex);

    ErrorResponse.ErrorResponseBuilder builder =
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .error(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase())
            .message("An unexpected error occurred")
            .path(extractPath(request));

    if (isDebug()) {
      builder.debugMessage(ex.getMessage());
    }

    return new ResponseEntity<>(builder.build(), HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private boolean isDebug() {
    return debugEnabled && !"production".equals(environment);
  }

  private ResponseEntity<ErrorResponse> buildErrorResponse(
      HttpStatus status, String message, WebRequest request) {
    ErrorResponse errorResponse =
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(status.value())
            .error(status.getReasonPhrase())
            .message(message)
            .path(extractPath(request))
            .build();

    return new ResponseEntity<>(errorResponse, status);
  }

  private String extractPath(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }

  /** Standard error response structure */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Standard error response")
  public static class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;
    private String message;
    private String path;
    private Map<String, String> validationErrors;
    private String debugMessage;

    public Map<String, String> getValidationErrors() {
      return validationErrors == null ? null : Collections.unmodifiableMap(validationErrors);
    }
  }
}

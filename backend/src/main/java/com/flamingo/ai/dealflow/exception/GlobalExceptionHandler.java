package com.flamingo.ai.dealflow.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());

    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, "Document not found", request);
  }

  @ExceptionHandler(DealNotFoundException.class)
  public ResponseEntity<ApiError> handleDealNotFound(
      DealNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("deal_not_found");
    String errorId = generateErrorId();
    log.warn("Deal not found [{}]: {}", errorId, ex.getDealId());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.DEAL_NOT_FOUND, "Deal not found", request);
  }

  @ExceptionHandler(AlertNotFoundException.class)
  public ResponseEntity<ApiError> handleAlertNotFound(
      AlertNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("alert_not_found");
    String errorId = generateErrorId();
    log.warn("Alert not found [{}]: {}", errorId, ex.getAlertId());

    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.ALERT_NOT_FOUND, "Alert not found", request);
  }

  @ExceptionHandler(InvalidDealStateException.class)
  public ResponseEntity<ApiError> handleInvalidDealState(
      InvalidDealStateException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_deal_state");
    String errorId = generateErrorId();
    log.warn("Invalid deal transition [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.CONFLICT, errorId, ApiError.INVALID_DEAL_STATE, ex.getUserMessage(), request);
  }

  @ExceptionHandler(AlertAlreadyResolvedException.class)
  public ResponseEntity<ApiError> handleAlertAlreadyResolved(
      AlertAlreadyResolvedException ex, HttpServletRequest request) {

    incrementErrorCounter("alert_already_resolved");
    String errorId = generateErrorId();
    log.warn("Alert already resolved [{}]: {}", errorId, ex.getAlertId());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.ALERT_ALREADY_RESOLVED,
        "Alert has already been resolved",
        request);
  }

  @ExceptionHandler(PipelineBusyException.class)
  public ResponseEntity<ApiError> handlePipelineBusy(
      PipelineBusyException ex, HttpServletRequest request) {

    incrementErrorCounter("pipeline_busy");
    String errorId = generateErrorId();
    log.info("Pipeline run rejected [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.CONFLICT, errorId, ApiError.PIPELINE_BUSY, ex.getUserMessage(), request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Malformed request: check parameter and body formats",
        request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Rejected request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}

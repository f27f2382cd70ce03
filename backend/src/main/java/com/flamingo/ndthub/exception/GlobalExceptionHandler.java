package com.flamingo.ndthub.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(UnauthorizedException.class)
  public ResponseEntity<ApiError> handleUnauthorized(
      UnauthorizedException ex, HttpServletRequest request) {

    incrementErrorCounter("unauthorized");
    String errorId = generateErrorId();
    log.warn("Unauthorized [{}]: {} {}", errorId, request.getRequestURI(), ex.getMessage());

    return respond(
        HttpStatus.UNAUTHORIZED, errorId, ApiError.AUTH_REQUIRED, ex.getMessage(), request);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ApiError> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {

    incrementErrorCounter("forbidden");
    String errorId = generateErrorId();
    log.warn("Forbidden [{}]: {} {}", errorId, request.getRequestURI(), ex.getMessage());

    return respond(
        HttpStatus.FORBIDDEN, errorId, ApiError.AUTH_FORBIDDEN, ex.getMessage(), request);
  }

  @ExceptionHandler(ManufacturerNotFoundException.class)
  public ResponseEntity<ApiError> handleManufacturerNotFound(
      ManufacturerNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("manufacturer_not_found");
    String errorId = generateErrorId();
    log.warn("Manufacturer not found [{}]: {}", errorId, ex.getManufacturerId());

    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.MANUFACTURER_NOT_FOUND,
        "Manufacturer not found",
        request);
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, "Document not found", request);
  }

  @ExceptionHandler(StoredFileMissingException.class)
  public ResponseEntity<ApiError> handleStoredFileMissing(
      StoredFileMissingException ex, HttpServletRequest request) {

    incrementErrorCounter("stored_file_missing");
    String errorId = generateErrorId();
    log.error("Stored PDF missing [{}]: {}", errorId, ex.getStorageKey());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.STORED_FILE_MISSING, "PDF missing", request);
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<ApiError> handleUserNotFound(
      UserNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("user_not_found");
    String errorId = generateErrorId();
    log.warn("User not found [{}]: {}", errorId, ex.getUserId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.USER_NOT_FOUND, "User not found", request);
  }

  @ExceptionHandler(DuplicateUsernameException.class)
  public ResponseEntity<ApiError> handleDuplicateUsername(
      DuplicateUsernameException ex, HttpServletRequest request) {

    incrementErrorCounter("user_conflict");
    String errorId = generateErrorId();
    log.warn("Duplicate username [{}]: {}", errorId, ex.getUsername());

    return respond(
        HttpStatus.CONFLICT, errorId, ApiError.USER_CONFLICT, "Username already exists", request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.warn(
        "Document rejected [{}]: file={}, reason={}", errorId, ex.getFileName(), ex.getMessage());

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_too_large");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.UPLOAD_TOO_LARGE,
        "Uploaded file is too large",
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

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ApiError> handleMissingInput(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Missing request input [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
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

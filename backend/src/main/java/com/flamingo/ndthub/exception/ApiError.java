package com.flamingo.ndthub.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String AUTH_REQUIRED = "AUTH_001";
  public static final String AUTH_FORBIDDEN = "AUTH_002";
  public static final String MANUFACTURER_NOT_FOUND = "MANUFACTURER_001";
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_003";
  public static final String STORED_FILE_MISSING = "DOCUMENT_004";
  public static final String UPLOAD_TOO_LARGE = "DOCUMENT_005";
  public static final String USER_NOT_FOUND = "USER_001";
  public static final String USER_CONFLICT = "USER_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}

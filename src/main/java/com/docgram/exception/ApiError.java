package com.docgram.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_INPUT = "INPUT_001";
  public static final String VALIDATION_ERROR = "INPUT_002";
  public static final String UNAUTHORIZED = "AUTH_001";
  public static final String FORBIDDEN = "AUTH_002";
  public static final String NOT_FOUND = "RESOURCE_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}

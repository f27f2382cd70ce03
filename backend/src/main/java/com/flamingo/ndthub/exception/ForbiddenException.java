package com.flamingo.ndthub.exception;

/** Exception thrown when an authenticated user may not perform an action. */
public class ForbiddenException extends RuntimeException {

  public ForbiddenException(String message) {
    super(message);
  }
}

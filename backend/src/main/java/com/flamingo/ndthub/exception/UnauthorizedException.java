package com.flamingo.ndthub.exception;

/** Exception thrown when a request carries no usable credentials. */
public class UnauthorizedException extends RuntimeException {

  public UnauthorizedException(String message) {
    super(message);
  }
}

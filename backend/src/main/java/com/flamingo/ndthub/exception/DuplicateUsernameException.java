package com.flamingo.ndthub.exception;

/** Exception thrown when creating a user whose username is already taken. */
public class DuplicateUsernameException extends RuntimeException {

  private final String username;

  public DuplicateUsernameException(String username) {
    super("Username already exists: " + username);
    this.username = username;
  }

  public String getUsername() {
    return username;
  }
}

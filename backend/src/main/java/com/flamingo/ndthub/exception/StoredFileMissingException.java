package com.flamingo.ndthub.exception;

/** Exception thrown when a document row exists but its stored PDF does not. */
public class StoredFileMissingException extends RuntimeException {

  private final String storageKey;

  public StoredFileMissingException(String storageKey) {
    super("Stored PDF missing: " + storageKey);
    this.storageKey = storageKey;
  }

  public String getStorageKey() {
    return storageKey;
  }
}

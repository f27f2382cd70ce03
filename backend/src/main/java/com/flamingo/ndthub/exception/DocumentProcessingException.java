package com.flamingo.ndthub.exception;

/**
 * Exception thrown when an uploaded file is rejected or cannot be read as a PDF.
 *
 * <p>Raised before anything is persisted, so the upload leaves no trace.
 */
public class DocumentProcessingException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  public DocumentProcessingException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
    this.userMessage = "Invalid document";
  }

  public DocumentProcessingException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.userMessage = "Malformed document: the PDF could not be read";
  }

  public DocumentProcessingException(String fileName, String message, String userMessage) {
    super(message);
    this.fileName = fileName;
    this.userMessage = userMessage;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

package com.flamingo.ndthub.exception;

/** Exception thrown when a document is not found. */
public class DocumentNotFoundException extends RuntimeException {

  private final Long documentId;

  public DocumentNotFoundException(Long documentId) {
    super("Document not found: " + documentId);
    this.documentId = documentId;
  }

  public Long getDocumentId() {
    return documentId;
  }
}

package com.flamingo.ndthub.service.document;

/**
 * Editable metadata of a document. On update, {@code null} or blank fields leave the stored value
 * unchanged.
 *
 * @param title display title
 * @param revisionDate manufacturer revision date, free text
 * @param tags free-text tags
 */
public record DocumentMetadata(String title, String revisionDate, String tags) {}

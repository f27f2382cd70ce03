package com.flamingo.ndthub.service.document;

import com.flamingo.ndthub.domain.entity.Document;

/**
 * Outcome of a committed upload.
 *
 * @param document the created document
 * @param sectionsCreated number of sections persisted with it
 * @param figuresCreated number of figures persisted with it
 */
public record UploadResult(Document document, int sectionsCreated, int figuresCreated) {}

package com.flamingo.ndthub.service.document;

import java.nio.file.Path;

/**
 * Location of a document's stored PDF.
 *
 * @param path file on disk
 * @param originalFilename name to offer the client
 */
public record StoredPdf(Path path, String originalFilename) {}

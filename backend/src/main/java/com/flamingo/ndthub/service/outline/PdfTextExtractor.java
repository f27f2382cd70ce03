package com.flamingo.ndthub.service.outline;

/** Reads the per-page plain text of a PDF. */
public interface PdfTextExtractor {

  /**
   * Extracts the text of every page.
   *
   * @param pdfBytes raw PDF content
   * @param fileName original file name, used for error reporting
   * @return page texts in page order
   * @throws com.flamingo.ndthub.exception.DocumentProcessingException if the PDF cannot be opened
   *     or parsed
   */
  ExtractedPages extract(byte[] pdfBytes, String fileName);
}

package com.flamingo.ndthub.service.outline;

import java.util.List;

/**
 * Sections and figures detected in one PDF, ready to be persisted.
 *
 * @param sections sections in detection order, never empty
 * @param figures figures in detection order
 * @param pageCount number of pages in the PDF
 * @param fallback whether {@code sections} holds only the synthesized whole-document section
 */
public record DocumentOutline(
    List<DetectedSection> sections, List<DetectedFigure> figures, int pageCount, boolean fallback) {

  public DocumentOutline {
    sections = List.copyOf(sections);
    figures = List.copyOf(figures);
  }
}

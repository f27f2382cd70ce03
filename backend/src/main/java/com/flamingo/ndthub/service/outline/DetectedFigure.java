package com.flamingo.ndthub.service.outline;

/**
 * A caption line found by {@link OutlineDetector}, not yet persisted.
 *
 * @param sectionIndex 0-based index into {@link DocumentOutline#sections()} of the section most
 *     recently detected before this caption, or {@code null} when none was
 * @param pageNumber page the caption was found on
 * @param captionText full trimmed line
 * @param orderIndex 1-based position among the figures of the document
 */
public record DetectedFigure(
    Integer sectionIndex, int pageNumber, String captionText, int orderIndex) {

  public boolean hasSection() {
    return sectionIndex != null;
  }
}

package com.flamingo.ndthub.service.outline;

import com.flamingo.ndthub.domain.enums.HeadingLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives a lightweight outline from extracted page text.
 *
 * <ul>
 *   <li><strong>Sections</strong>: a trimmed line that is a dotted numeric label, whitespace and a
 *       title, e.g. {@code "4.10.1 Probe Calibration"}. The whole line becomes the heading text.
 *   <li><strong>Figures</strong>: any trimmed line containing the word {@code Figure} or the token
 *       {@code Fig.}, case-insensitively. A figure is attached to the section detected most
 *       recently when it is reached.
 * </ul>
 *
 * <p>Each page is scanned twice: first for headings, then for captions. A caption is therefore
 * attached to the last heading of its own page when that page has one. When the document yields no
 * heading at all, a single "Document Overview" section spanning every page is synthesized; figures
 * found during the scan stay unattached.
 *
 * <p>Detection is deterministic and never fails on odd text.
 */
@Component
@Slf4j
public class OutlineDetector {

  public static final String FALLBACK_HEADING = "Document Overview";

  // Digits, whitespace and word boundaries follow Unicode, so "３ Scope" is a heading too
  static final Pattern HEADING_PATTERN =
      Pattern.compile("(\\d+(?:\\.\\d+)*)\\s+(.+)", Pattern.UNICODE_CHARACTER_CLASS);
  static final Pattern FIGURE_PATTERN =
      Pattern.compile(
          "\\b(?:Figure\\b|Fig\\.)",
          Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

  private static final Pattern LINE_BREAK = Pattern.compile("\\R");

  /**
   * Detects sections and figures across all pages.
   *
   * @param pages extracted page texts
   * @return the outline, with at least one section
   */
  public DocumentOutline detect(ExtractedPages pages) {
    List<DetectedSection> sections = new ArrayList<>();
    List<DetectedFigure> figures = new ArrayList<>();

    for (int pageNumber = 1; pageNumber <= pages.pageCount(); pageNumber++) {
      List<String> lines = nonBlankLines(pages.page(pageNumber));

      for (String line : lines) {
        if (isHeading(line)) {
          sections.add(
              new DetectedSection(
                  line, HeadingLevel.H1, pageNumber, pageNumber, sections.size() + 1));
        }
      }

      for (String line : lines) {
        if (isFigureCaption(line)) {
          Integer sectionIndex = sections.isEmpty() ? null : sections.size() - 1;
          figures.add(new DetectedFigure(sectionIndex, pageNumber, line, figures.size() + 1));
        }
      }
    }

    boolean fallback = sections.isEmpty();
    if (fallback) {
      sections.add(
          new DetectedSection(FALLBACK_HEADING, HeadingLevel.H1, 1, pages.pageCount(), 1));
    }

    log.debug(
        "Detected {} sections{} and {} figures over {} pages",
        sections.size(),
        fallback ? " (fallback)" : "",
        figures.size(),
        pages.pageCount());
    return new DocumentOutline(sections, figures, pages.pageCount(), fallback);
  }

  /** Whether a trimmed line is a numbered heading. */
  static boolean isHeading(String line) {
    return HEADING_PATTERN.matcher(line).matches();
  }

  /** Whether a trimmed line is a figure caption or reference. */
  static boolean isFigureCaption(String line) {
    return FIGURE_PATTERN.matcher(line).find();
  }

  private static List<String> nonBlankLines(String pageText) {
    List<String> lines = new ArrayList<>();
    if (pageText == null || pageText.isEmpty()) {
      return lines;
    }
    for (String raw : LINE_BREAK.split(pageText)) {
      String line = raw.strip();
      if (!line.isEmpty()) {
        lines.add(line);
      }
    }
    return lines;
  }
}

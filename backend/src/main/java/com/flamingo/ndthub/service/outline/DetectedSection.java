package com.flamingo.ndthub.service.outline;

import com.flamingo.ndthub.domain.enums.HeadingLevel;

/**
 * A heading found by {@link OutlineDetector}, not yet persisted.
 *
 * @param headingText full trimmed line, numeric label included
 * @param headingLevel always {@link HeadingLevel#H1}
 * @param pageStart page the heading was found on
 * @param pageEnd same as {@code pageStart}, except for the whole-document fallback section
 * @param orderIndex 1-based position among the sections of the document
 */
public record DetectedSection(
    String headingText, HeadingLevel headingLevel, int pageStart, int pageEnd, int orderIndex) {}

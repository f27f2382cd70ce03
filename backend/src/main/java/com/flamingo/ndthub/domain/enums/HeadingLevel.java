package com.flamingo.ndthub.domain.enums;

/**
 * Coarse tier of a detected heading.
 *
 * <p>Outline detection does not derive the tier from the numeric label depth, so every section
 * is currently stored as {@link #H1}.
 */
public enum HeadingLevel {
  H1
}

package com.flamingo.ndthub.service.outline;

import java.util.List;

/**
 * Plain text of every page of a PDF, in page order.
 *
 * @param pageTexts text of page {@code i + 1} at index {@code i}; empty when a page yields none
 */
public record ExtractedPages(List<String> pageTexts) {

  public ExtractedPages {
    pageTexts = List.copyOf(pageTexts);
  }

  public int pageCount() {
    return pageTexts.size();
  }

  /** Text of a 1-indexed page. */
  public String page(int pageNumber) {
    return pageTexts.get(pageNumber - 1);
  }
}

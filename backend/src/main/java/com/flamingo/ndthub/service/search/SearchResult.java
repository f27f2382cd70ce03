package com.flamingo.ndthub.service.search;

import java.util.List;

/**
 * One hit returned by an external NDT site.
 *
 * @param title result title
 * @param description short description, empty when the site gives none
 * @param features feature or tag labels
 * @param source name of the site the hit came from
 * @param link target URL as published by the site
 */
public record SearchResult(
    String title, String description, List<String> features, String source, String link) {

  static final String SYSTEM_SOURCE = "system";

  /** Placeholder returned when no source produced anything. */
  public static SearchResult noResults() {
    return new SearchResult(
        "No results",
        "Search endpoints unavailable or returned no data.",
        List.of(),
        SYSTEM_SOURCE,
        "#");
  }
}

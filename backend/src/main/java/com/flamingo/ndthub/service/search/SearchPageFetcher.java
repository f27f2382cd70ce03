package com.flamingo.ndthub.service.search;

import java.io.IOException;
import org.jsoup.nodes.Document;

/** Downloads and parses a search result page. */
public interface SearchPageFetcher {

  Document fetch(String url) throws IOException;
}

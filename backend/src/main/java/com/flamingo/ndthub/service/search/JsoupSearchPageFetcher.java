package com.flamingo.ndthub.service.search;

import com.flamingo.ndthub.config.HubConfig;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/** Fetches pages over HTTP with jsoup; non-2xx responses raise {@link IOException}. */
@Component
@RequiredArgsConstructor
public class JsoupSearchPageFetcher implements SearchPageFetcher {

  private final HubConfig hubConfig;

  @Override
  public Document fetch(String url) throws IOException {
    HubConfig.Search search = hubConfig.getSearch();
    return Jsoup.connect(url)
        .userAgent(search.getUserAgent())
        .timeout(search.getTimeoutMs())
        .get();
  }
}

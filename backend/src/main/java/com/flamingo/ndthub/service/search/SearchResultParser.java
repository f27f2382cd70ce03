package com.flamingo.ndthub.service.search;

import com.flamingo.ndthub.config.HubConfig;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Turns a search result page into {@link SearchResult}s using the CSS selectors configured for
 * its source. Cards without a title or a link are skipped.
 */
@Component
public class SearchResultParser {

  public List<SearchResult> parse(Document page, HubConfig.Source source) {
    List<SearchResult> results = new ArrayList<>();
    for (Element card : page.select(source.getCardSelector())) {
      Element title = card.selectFirst(source.getTitleSelector());
      Element link = card.selectFirst(source.getLinkSelector());
      if (title == null || link == null) {
        continue;
      }
      Element description = card.selectFirst(source.getDescriptionSelector());
      List<String> features =
          card.select(source.getFeatureSelector()).stream()
              .map(Element::text)
              .map(String::strip)
              .filter(text -> !text.isEmpty())
              .toList();
      results.add(
          new SearchResult(
              title.text().strip(),
              description == null ? "" : description.text().strip(),
              features,
              source.getName(),
              link.attr("href")));
    }
    return results;
  }
}

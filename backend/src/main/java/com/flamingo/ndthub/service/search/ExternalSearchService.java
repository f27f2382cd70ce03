package com.flamingo.ndthub.service.search;

import com.flamingo.ndthub.config.HubConfig;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.domain.enums.AuditAction;
import com.flamingo.ndthub.service.audit.AuditService;
import com.flamingo.ndthub.service.audit.AuditTarget;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Aggregates results from the configured external NDT sites.
 *
 * <p>Sources are queried in parallel. A source that fails is logged and skipped; when nothing
 * comes back a single placeholder result is returned so callers always get a non-empty list.
 */
@Service
@Slf4j
public class ExternalSearchService {

  private final HubConfig hubConfig;
  private final SearchPageFetcher pageFetcher;
  private final SearchResultParser resultParser;
  private final AuditService auditService;
  private final MeterRegistry meterRegistry;
  private final Executor searchExecutor;

  public ExternalSearchService(
      HubConfig hubConfig,
      SearchPageFetcher pageFetcher,
      SearchResultParser resultParser,
      AuditService auditService,
      MeterRegistry meterRegistry,
      @Qualifier("searchExecutor") Executor searchExecutor) {
    this.hubConfig = hubConfig;
    this.pageFetcher = pageFetcher;
    this.resultParser = resultParser;
    this.auditService = auditService;
    this.meterRegistry = meterRegistry;
    this.searchExecutor = searchExecutor;
  }

  /**
   * Runs a query against every source and records it in the audit trail.
   *
   * @param query free-text query
   * @param requester the user asking
   * @return results in source order, or the placeholder result
   */
  @Timed(value = "search.external", description = "Time to query external search sources")
  public List<SearchResult> search(String query, User requester) {
    String trimmed = query == null ? "" : query.strip();
    log.info("External search for '{}' by {}", trimmed, requester.getUsername());

    List<CompletableFuture<List<SearchResult>>> pending = new ArrayList<>();
    for (HubConfig.Source source : hubConfig.getSearch().getSources()) {
      pending.add(
          CompletableFuture.supplyAsync(() -> querySource(source, trimmed), searchExecutor)
              .exceptionally(ex -> skipSource(source, ex)));
    }

    List<SearchResult> results = new ArrayList<>();
    for (CompletableFuture<List<SearchResult>> future : pending) {
      results.addAll(future.join());
    }
    if (results.isEmpty()) {
      results.add(SearchResult.noResults());
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("query", trimmed);
    metadata.put("count", results.size());
    auditService.record(requester, AuditAction.SEARCH_TOOL, AuditTarget.none(), metadata);
    return results;
  }

  private List<SearchResult> querySource(HubConfig.Source source, String query) {
    String url = buildUrl(source, query);
    log.debug("Querying {} at {}", source.getName(), url);
    try {
      List<SearchResult> found = resultParser.parse(pageFetcher.fetch(url), source);
      log.debug("{} returned {} result(s)", source.getName(), found.size());
      return found;
    } catch (IOException e) {
      throw new CompletionException(e);
    }
  }

  private List<SearchResult> skipSource(HubConfig.Source source, Throwable ex) {
    Throwable cause = ex instanceof CompletionException && ex.getCause() != null
        ? ex.getCause()
        : ex;
    log.warn("Search source {} failed, skipping: {}", source.getName(), cause.toString());
    meterRegistry.counter("search.source.failed", "source", source.getName()).increment();
    return List.of();
  }

  static String buildUrl(HubConfig.Source source, String query) {
    return source
        .getUrlTemplate()
        .replace("{query}", URLEncoder.encode(query, StandardCharsets.UTF_8));
  }
}

package com.flamingo.ndthub.api.rest;

import com.flamingo.ndthub.api.auth.AuthInterceptor;
import com.flamingo.ndthub.api.dto.request.SearchRequest;
import com.flamingo.ndthub.api.dto.response.SearchResponse;
import com.flamingo.ndthub.domain.entity.User;
import com.flamingo.ndthub.service.search.ExternalSearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the external NDT search tool. */
@RestController
@RequestMapping("/api/tool/search")
@RequiredArgsConstructor
public class SearchToolController {

  private final ExternalSearchService externalSearchService;

  @PostMapping
  public ResponseEntity<SearchResponse> search(
      @Valid @RequestBody SearchRequest request,
      @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    return ResponseEntity.ok(run(request.getQuery(), user));
  }

  @GetMapping
  public ResponseEntity<SearchResponse> searchByParam(
      @RequestParam("q") String query,
      @RequestAttribute(AuthInterceptor.CURRENT_USER) User user) {
    return ResponseEntity.ok(run(query, user));
  }

  private SearchResponse run(String query, User user) {
    return SearchResponse.builder()
        .query(query)
        .results(externalSearchService.search(query, user))
        .build();
  }
}

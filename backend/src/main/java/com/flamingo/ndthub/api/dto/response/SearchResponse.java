package com.flamingo.ndthub.api.dto.response;

import com.flamingo.ndthub.service.search.SearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the external search tool. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private String query;
  private List<SearchResult> results;
}

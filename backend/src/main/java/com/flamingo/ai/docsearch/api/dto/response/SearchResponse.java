package com.flamingo.ai.docsearch.api.dto.response;

import com.flamingo.ai.docsearch.domain.enums.SearchMode;
import com.flamingo.ai.docsearch.service.rag.model.ScoredResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a search: the ranked results and how they were produced. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private String query;
  private SearchMode mode;
  private int limit;
  private int resultCount;

  /** True when any result was ranked without the primary embedding tier. */
  private boolean degraded;

  private List<ScoredResult> results;

  public static SearchResponse of(
      String query, SearchMode mode, int limit, List<ScoredResult> results) {
    return SearchResponse.builder()
        .query(query)
        .mode(mode)
        .limit(limit)
        .resultCount(results.size())
        .degraded(results.stream().anyMatch(ScoredResult::degraded))
        .results(results)
        .build();
  }
}

package com.flamingo.ai.docsearch.api.rest;

import com.flamingo.ai.docsearch.api.dto.response.SearchResponse;
import com.flamingo.ai.docsearch.config.RagConfig;
import com.flamingo.ai.docsearch.domain.enums.SearchMode;
import com.flamingo.ai.docsearch.exception.ValidationException;
import com.flamingo.ai.docsearch.service.rag.HybridSearchService;
import com.flamingo.ai.docsearch.service.rag.model.ScoredResult;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for searching indexed documents. */
@RestController
@RequestMapping("/search")
@RequiredArgsConstructor
public class SearchController {

  private static final int DEFAULT_SUGGESTION_LIMIT = 5;

  private final HybridSearchService hybridSearchService;
  private final RagConfig ragConfig;

  /**
   * Searches all indexed chunks.
   *
   * @param query query text
   * @param mode semantic, keyword or hybrid (default), case-insensitive
   * @param limit maximum number of results
   */
  @GetMapping
  public ResponseEntity<SearchResponse> search(
      @RequestParam("q") String query,
      @RequestParam(value = "mode", required = false) String mode,
      @RequestParam(value = "limit", required = false) Integer limit) {
    SearchMode searchMode = parseMode(mode);
    int effectiveLimit = limit != null ? limit : ragConfig.getRetrieval().getDefaultLimit();
    List<ScoredResult> results = hybridSearchService.search(query, searchMode, effectiveLimit);
    return ResponseEntity.ok(SearchResponse.of(query, searchMode, effectiveLimit, results));
  }

  /** Completes the last word of a partially typed query from indexed keywords. */
  @GetMapping("/suggestions")
  public ResponseEntity<List<String>> suggest(
      @RequestParam("q") String partialQuery,
      @RequestParam(value = "limit", required = false) Integer limit) {
    int effectiveLimit = limit != null ? limit : DEFAULT_SUGGESTION_LIMIT;
    return ResponseEntity.ok(hybridSearchService.suggest(partialQuery, effectiveLimit));
  }

  private static SearchMode parseMode(String mode) {
    if (mode == null || mode.isBlank()) {
      return SearchMode.HYBRID;
    }
    try {
      return SearchMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("mode", "Mode must be one of semantic, keyword, hybrid");
    }
  }
}

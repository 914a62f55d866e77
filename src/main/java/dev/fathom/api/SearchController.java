package dev.fathom.api;

import dev.fathom.search.SearchProperties;
import dev.fathom.search.SearchQuery;
import dev.fathom.search.SearchResponse;
import dev.fathom.search.SearchRouter;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** HTTP entry point for searches and the health check. */
@RestController
public class SearchController {

  private final SearchRouter searchRouter;
  private final SearchProperties searchProperties;

  public SearchController(SearchRouter searchRouter, SearchProperties searchProperties) {
    this.searchRouter = searchRouter;
    this.searchProperties = searchProperties;
  }

  @PostMapping("/search")
  public SearchResponse search(@RequestBody SearchRequest request) {
    return searchRouter.route(
        new SearchQuery(
            request.projectName(),
            request.query(),
            request.searchType(),
            searchProperties.clampTopK(request.topK())));
  }

  @GetMapping("/")
  public Map<String, String> health() {
    return Map.of("status", "ok", "message", "Fathom search service is running");
  }
}

package dev.fathom.api;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.fathom.project.ProjectNotFoundException;
import dev.fathom.search.BackendErrorKind;
import dev.fathom.search.SearchBackendException;
import dev.fathom.search.SearchHit;
import dev.fathom.search.SearchProperties;
import dev.fathom.search.SearchQuery;
import dev.fathom.search.SearchResponse;
import dev.fathom.search.SearchRouter;
import dev.fathom.search.SearchType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SearchControllerTest {

  @Mock SearchRouter searchRouter;

  MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SearchController(searchRouter, new SearchProperties()))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void healthEndpointAnswersOk() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
  }

  @Test
  void semanticSearchReturnsEnvelope() throws Exception {
    given(searchRouter.route(new SearchQuery("demo", "greeting", SearchType.SEMANTIC, 3)))
        .willReturn(
            new SearchResponse(
                SearchType.SEMANTIC,
                List.of(
                    new SearchHit.SemanticHit(
                        "return \"Hello\";", Map.of("method_name", "greet"), 0.25)),
                SearchResponse.SUCCESS));

    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectName": "demo", "query": "greeting", "searchType": "semantic", "topK": 3}"""))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.searchType").value("semantic"))
        .andExpect(jsonPath("$.message").value("Success"))
        .andExpect(jsonPath("$.results[0].document").value("return \"Hello\";"))
        .andExpect(jsonPath("$.results[0].metadata.method_name").value("greet"))
        .andExpect(jsonPath("$.results[0].distance").value(0.25));
  }

  @Test
  void snakeCaseFieldsAreAccepted() throws Exception {
    given(searchRouter.route(any()))
        .willReturn(new SearchResponse(SearchType.LITERAL, List.of(), SearchResponse.SUCCESS));

    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"project_name": "demo", "query": "foo", "search_type": "LITERAL", "n_results": 7}"""))
        .andExpect(status().isOk());

    verify(searchRouter).route(new SearchQuery("demo", "foo", SearchType.LITERAL, 7));
  }

  @Test
  void unknownSearchTypeIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectName": "demo", "query": "x", "searchType": "fuzzy"}"""))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("Unknown search type 'fuzzy'")));
    verifyNoInteractions(searchRouter);
  }

  @Test
  void blankQueryIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectName": "demo", "query": "  "}"""))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Query must not be blank"));
  }

  @Test
  void missingSearchTypeIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectName": "demo", "query": "greeting"}"""))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("searchType is required")));
    verifyNoInteractions(searchRouter);
  }

  @Test
  void unknownProjectIsNotFound() throws Exception {
    given(searchRouter.route(any())).willThrow(new ProjectNotFoundException("ghost"));

    mockMvc
        .perform(
            post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectName": "ghost", "query": "x", "searchType": "literal"}"""))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Project not found"));
  }

  @Test
  void backendErrorsMapToGatewayStatuses() throws Exception {
    given(searchRouter.route(any()))
        .willThrow(
            new SearchBackendException(
                SearchType.LITERAL, BackendErrorKind.UNAVAILABLE, "ripgrep not found"))
        .willThrow(
            new SearchBackendException(SearchType.LITERAL, BackendErrorKind.TIMEOUT, "timed out"))
        .willThrow(
            new SearchBackendException(
                SearchType.LITERAL, BackendErrorKind.PROCESS_FAILURE, "exit 2"));
    String body =
        """
        {"projectName": "demo", "query": "x", "searchType": "literal"}""";

    mockMvc
        .perform(post("/search").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.kind").value("UNAVAILABLE"))
        .andExpect(jsonPath("$.searchType").value("literal"));
    mockMvc
        .perform(post("/search").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isGatewayTimeout());
    mockMvc
        .perform(post("/search").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadGateway());
  }
}

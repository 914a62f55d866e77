package dev.fathom.api;

import dev.fathom.indexing.IndexingInProgressException;
import dev.fathom.project.ProjectAlreadyExistsException;
import dev.fathom.project.ProjectNotFoundException;
import dev.fathom.search.SearchBackendException;
import dev.fathom.structural.StructuralIndexerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>404 - unknown project
 *   <li>400 - invalid request
 *   <li>409 - duplicate project name or index build already running
 *   <li>503 / 502 / 504 - backend unavailable, failed or timed out
 *   <li>500 - anything else
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ProjectNotFoundException.class)
  ProblemDetail handleProjectNotFound(ProjectNotFoundException ex) {
    return problem(HttpStatus.NOT_FOUND, "Project not found", ex.getMessage());
  }

  @ExceptionHandler({ProjectAlreadyExistsException.class, IndexingInProgressException.class})
  ProblemDetail handleConflict(RuntimeException ex) {
    return problem(HttpStatus.CONFLICT, "Conflict", ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return problem(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
    Throwable cause = ex.getMostSpecificCause();
    return problem(HttpStatus.BAD_REQUEST, "Invalid request", cause.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Request body is invalid");
    return problem(HttpStatus.BAD_REQUEST, "Invalid request", detail);
  }

  @ExceptionHandler(SearchBackendException.class)
  ProblemDetail handleSearchBackend(SearchBackendException ex) {
    HttpStatus status =
        switch (ex.getKind()) {
          case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
          case PROCESS_FAILURE -> HttpStatus.BAD_GATEWAY;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    log.warn("{} search failed ({}): {}", ex.getSearchType().wireName(), ex.getKind(), ex.getMessage());
    ProblemDetail problem = problem(status, "Search backend error", ex.getMessage());
    problem.setProperty("searchType", ex.getSearchType().wireName());
    problem.setProperty("kind", ex.getKind().name());
    return problem;
  }

  @ExceptionHandler(StructuralIndexerException.class)
  ProblemDetail handleStructuralIndexer(StructuralIndexerException ex) {
    HttpStatus status =
        switch (ex.getKind()) {
          case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
          case PROCESS_FAILURE -> HttpStatus.BAD_GATEWAY;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
    ProblemDetail problem = problem(status, "Structural indexer error", ex.getMessage());
    problem.setProperty("kind", ex.getKind().name());
    return problem;
  }

  @ExceptionHandler(Exception.class)
  ProblemDetail handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse errorResponse) {
      // framework errors (unknown route, wrong method) keep their own status
      return errorResponse.getBody();
    }
    log.error("Unhandled request failure", ex);
    return problem(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "Internal error",
        "An internal error occurred: " + ex.getMessage());
  }

  private static ProblemDetail problem(HttpStatus status, String title, String detail) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(title);
    return problem;
  }
}

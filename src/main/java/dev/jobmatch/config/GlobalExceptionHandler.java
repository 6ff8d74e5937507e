package dev.jobmatch.config;

import dev.jobmatch.index.SearchIndexException;
import dev.jobmatch.index.SearchIndexUnavailableException;
import dev.jobmatch.matching.DocumentNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException} (including validation and missing-field errors) - 400
 *   <li>{@link DocumentNotFoundException} - 404
 *   <li>{@link SearchIndexException} - 502
 *   <li>{@link SearchIndexUnavailableException} - 503
 * </ul>
 *
 * <p>Bean-validation failures on request bodies are rendered as 400 by Spring's own problem-detail
 * support.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  ProblemDetail handleNotFound(DocumentNotFoundException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(SearchIndexUnavailableException.class)
  ProblemDetail handleIndexUnavailable(SearchIndexUnavailableException ex) {
    log.error("Search index unavailable: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.SERVICE_UNAVAILABLE, "Search index is unavailable");
  }

  @ExceptionHandler(SearchIndexException.class)
  ProblemDetail handleIndexError(SearchIndexException ex) {
    log.error("Search index rejected request: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, ex.getMessage());
  }
}

package dev.jobmatch.index;

/**
 * Thrown when the search index cannot be reached or answers with a server error. The HTTP layer
 * maps it to 503 Service Unavailable; there is no silent fallback to canned data.
 */
public class SearchIndexUnavailableException extends SearchIndexException {

  public SearchIndexUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

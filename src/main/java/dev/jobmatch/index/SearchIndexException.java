package dev.jobmatch.index;

/** Thrown when the search index rejects a request, e.g. a malformed query or mapping conflict. */
public class SearchIndexException extends RuntimeException {

  public SearchIndexException(String message, Throwable cause) {
    super(message, cause);
  }
}

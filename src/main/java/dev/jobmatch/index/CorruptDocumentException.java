package dev.jobmatch.index;

/**
 * Thrown when a stored document cannot be turned into a job or candidate, e.g. a blank skill or a
 * negative salary. The data is bad on the server side, so this is not a caller error.
 */
public class CorruptDocumentException extends SearchIndexException {

  private final String documentId;

  public CorruptDocumentException(String documentId, Throwable cause) {
    super("Stored document " + documentId + " is invalid: " + cause.getMessage(), cause);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}

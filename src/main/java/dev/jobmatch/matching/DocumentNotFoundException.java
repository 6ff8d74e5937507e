package dev.jobmatch.matching;

import dev.jobmatch.profile.DocumentType;

/** Thrown when the source document of a lookup or match request does not exist. */
public class DocumentNotFoundException extends RuntimeException {

  private final DocumentType type;
  private final String id;

  public DocumentNotFoundException(DocumentType type, String id) {
    super((type == DocumentType.JOB ? "Job" : "Candidate") + " with ID " + id + " not found");
    this.type = type;
    this.id = id;
  }

  public DocumentType getType() {
    return type;
  }

  public String getId() {
    return id;
  }
}

package dev.jobmatch.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of document a request refers to. */
public enum DocumentType {
  JOB("job"),
  CANDIDATE("candidate");

  private final String value;

  DocumentType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static DocumentType fromValue(String value) {
    for (DocumentType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new ValidationException("Invalid document type: " + value);
  }
}

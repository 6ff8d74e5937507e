package dev.jobmatch.matching;

import dev.jobmatch.profile.ValidationException;

/**
 * Thrown when an enabled filter needs a field the source document does not have, e.g. salary
 * matching for a job without {@code max_salary}. The match cannot be evaluated, so this is a
 * validation failure rather than an empty result.
 */
public class MissingFieldException extends ValidationException {

  private final String field;

  public MissingFieldException(String field, MatchFilter filter) {
    super("Missing required field '" + field + "' for " + filter.requestKey());
    this.field = field;
  }

  public String getField() {
    return field;
  }
}

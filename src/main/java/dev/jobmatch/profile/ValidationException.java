package dev.jobmatch.profile;

/**
 * Thrown when a value object, entity or match request is constructed from malformed input.
 *
 * <p>Extends {@link IllegalArgumentException} so callers that only care about "bad input" can keep
 * catching the JDK type; the HTTP layer maps it to 400 Bad Request.
 */
public class ValidationException extends IllegalArgumentException {

  public ValidationException(String message) {
    super(message);
  }
}

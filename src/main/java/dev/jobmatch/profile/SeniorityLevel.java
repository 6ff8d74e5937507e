package dev.jobmatch.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Seniority of a candidate, or one of the levels a job accepts.
 *
 * <p>Levels are compared by equality only; the declaration order carries no ranking.
 */
public enum SeniorityLevel {
  NONE("none"),
  JUNIOR("junior"),
  MIDLEVEL("midlevel"),
  SENIOR("senior"),
  LEAD("lead"),
  PRINCIPAL("principal");

  private final String value;

  SeniorityLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Parses a seniority level, ignoring case and surrounding whitespace.
   *
   * @param value the wire value, e.g. {@code "senior"}
   * @return the matching level
   * @throws ValidationException if the value is null or not one of the known levels
   */
  @JsonCreator
  public static SeniorityLevel fromValue(String value) {
    if (value != null) {
      String normalized = value.strip().toLowerCase(Locale.ROOT);
      for (SeniorityLevel level : values()) {
        if (level.value.equals(normalized)) {
          return level;
        }
      }
    }
    throw new ValidationException(
        "Invalid seniority level: " + value + ". Valid levels are: " + validValues());
  }

  static String validValues() {
    return Arrays.stream(values()).map(SeniorityLevel::value).collect(Collectors.joining(", "));
  }
}

package dev.jobmatch.matching;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.jobmatch.profile.ValidationException;

/**
 * Which score a match request reports.
 *
 * <p>The two scores live in different numeric domains and are not comparable with each other:
 * index relevance is unbounded and depends on the index's similarity model, the weighted score is
 * bounded to [0, 1].
 */
public enum ScoringMode {
  /** Score assigned by the search index to each hit, returned verbatim in index order. */
  INDEX_RELEVANCE("index_relevance"),
  /** Hits re-scored with {@link WeightedMatchScorer} and sorted by that score, descending. */
  WEIGHTED("weighted");

  private final String value;

  ScoringMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ScoringMode fromValue(String value) {
    for (ScoringMode mode : values()) {
      if (mode.value.equalsIgnoreCase(value)) {
        return mode;
      }
    }
    throw new ValidationException("Invalid scoring mode: " + value);
  }
}

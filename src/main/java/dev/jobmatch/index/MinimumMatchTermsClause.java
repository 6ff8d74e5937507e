package dev.jobmatch.index;

import java.util.List;
import java.util.Map;

/**
 * At least {@code minimumShouldMatch} of {@code values} must be present in a multi-valued field.
 *
 * <p>A plain {@code terms} query has no per-clause threshold and cannot ignore case, so this
 * renders as a nested {@code bool} of one case-insensitive {@code term} per value.
 */
public record MinimumMatchTermsClause(
    String field, List<String> values, int minimumShouldMatch, double boost)
    implements QueryClause {

  public MinimumMatchTermsClause {
    values = List.copyOf(values);
    if (minimumShouldMatch < 1 || minimumShouldMatch > values.size()) {
      throw new IllegalArgumentException(
          "minimumShouldMatch must be in [1, " + values.size() + "], got: " + minimumShouldMatch);
    }
  }

  @Override
  public Map<String, Object> toQueryDsl() {
    List<Map<String, Object>> terms =
        values.stream().map(v -> TermClause.caseInsensitiveTerm(field, v)).toList();
    return Map.of(
        "bool",
        Map.of("should", terms, "minimum_should_match", minimumShouldMatch, "boost", boost));
  }
}

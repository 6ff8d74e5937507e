package dev.jobmatch.index;

import java.util.List;
import java.util.Map;

/**
 * Field value is any one of {@code values}, compared ignoring case. A {@code terms} query cannot
 * ignore case, so this renders as a nested {@code bool} of case-insensitive {@code term} queries.
 */
public record TermsClause(String field, List<String> values, double boost) implements QueryClause {

  public TermsClause {
    values = List.copyOf(values);
  }

  @Override
  public Map<String, Object> toQueryDsl() {
    List<Map<String, Object>> terms =
        values.stream().map(v -> TermClause.caseInsensitiveTerm(field, v)).toList();
    return Map.of("bool", Map.of("should", terms, "minimum_should_match", 1, "boost", boost));
  }
}

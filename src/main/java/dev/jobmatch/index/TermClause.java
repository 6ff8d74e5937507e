package dev.jobmatch.index;

import java.util.Map;

/**
 * Value on a keyword field, compared ignoring case. Against a multi-valued field it matches when
 * any element equals the value.
 */
public record TermClause(String field, String value, double boost) implements QueryClause {

  /** A boost-free, case-insensitive {@code term} query, used inside compound clauses. */
  static Map<String, Object> caseInsensitiveTerm(String field, String value) {
    return Map.of("term", Map.of(field, Map.of("value", value, "case_insensitive", true)));
  }

  @Override
  public Map<String, Object> toQueryDsl() {
    return Map.of(
        "term",
        Map.of(field, Map.of("value", value, "case_insensitive", true, "boost", boost)));
  }
}

package dev.jobmatch.index;

import java.util.Map;

/**
 * Numeric range bound on a single field, e.g. {@code max_salary >= 80000}.
 *
 * @param field the document field
 * @param bound the comparison
 * @param value the bound value, inclusive
 */
public record RangeClause(String field, Bound bound, long value) implements QueryClause {

  /** Inclusive comparison operators. */
  public enum Bound {
    GTE("gte"),
    LTE("lte");

    private final String operator;

    Bound(String operator) {
      this.operator = operator;
    }

    public String operator() {
      return operator;
    }
  }

  @Override
  public Map<String, Object> toQueryDsl() {
    return Map.of("range", Map.of(field, Map.of(bound.operator(), value)));
  }
}

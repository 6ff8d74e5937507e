package dev.jobmatch.index;

import java.util.List;
import java.util.Map;

/**
 * Disjunctive query: a document matches when at least {@code minimumShouldMatch} of the clauses
 * match, and its relevance grows with every additional matching clause.
 *
 * @param should the clauses, one per enabled filter; never empty
 * @param minimumShouldMatch how many clauses must match (1 for match queries)
 */
public record MatchQuery(List<QueryClause> should, int minimumShouldMatch) {

  public MatchQuery {
    should = List.copyOf(should);
    if (should.isEmpty()) {
      throw new IllegalArgumentException("A match query needs at least one clause");
    }
  }

  /** A query requiring any one of the clauses. */
  public static MatchQuery anyOf(List<QueryClause> clauses) {
    return new MatchQuery(clauses, 1);
  }

  public Map<String, Object> toQueryDsl() {
    List<Map<String, Object>> clauses = should.stream().map(QueryClause::toQueryDsl).toList();
    return Map.of("bool", Map.of("should", clauses, "minimum_should_match", minimumShouldMatch));
  }
}

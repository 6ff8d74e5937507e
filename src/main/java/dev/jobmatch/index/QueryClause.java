package dev.jobmatch.index;

import java.util.Map;

/** One disjunct of a {@link MatchQuery}, renderable as Elasticsearch query DSL. */
public interface QueryClause {

  /** Elasticsearch query DSL for this clause, ready for JSON serialization. */
  Map<String, Object> toQueryDsl();
}

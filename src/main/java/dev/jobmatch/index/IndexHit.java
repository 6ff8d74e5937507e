package dev.jobmatch.index;

import dev.jobmatch.matching.Match;

/**
 * One ranked search result.
 *
 * @param id the document id
 * @param score the relevance score the index assigned to the hit
 */
public record IndexHit(String id, double score) {

  Match toMatch() {
    return new Match(id, score);
  }
}

package dev.jobmatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobmatch.matching.Match;

/** One matched counterpart in a match response. */
public record MatchView(String id, @JsonProperty("relevance_score") double relevanceScore) {

  static MatchView from(Match match) {
    return new MatchView(match.id(), match.score());
  }
}

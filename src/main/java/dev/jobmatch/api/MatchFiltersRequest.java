package dev.jobmatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobmatch.matching.MatchFilters;

/**
 * The three filter switches of a match request. Absent flags default to {@code false}; at least
 * one must be {@code true}.
 */
public record MatchFiltersRequest(
    @JsonProperty("salary_match") boolean salaryMatch,
    @JsonProperty("top_skill_match") boolean topSkillMatch,
    @JsonProperty("seniority_match") boolean seniorityMatch) {

  MatchFilters toMatchFilters() {
    return MatchFilters.fromFlags(topSkillMatch, seniorityMatch, salaryMatch);
  }
}

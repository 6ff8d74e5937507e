package dev.jobmatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.SeniorityLevel;
import dev.jobmatch.profile.Skill;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** JSON view of a candidate, field names as stored in the index plus the document id. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CandidateView(
    String id,
    @JsonProperty("top_skills") List<String> topSkills,
    @JsonProperty("other_skills") List<String> otherSkills,
    @Nullable SeniorityLevel seniority,
    @JsonProperty("salary_expectation") @Nullable Integer salaryExpectation) {

  static CandidateView from(Candidate candidate) {
    return new CandidateView(
        candidate.id(),
        candidate.topSkills().stream().map(Skill::name).toList(),
        candidate.otherSkills().stream().map(Skill::name).toList(),
        candidate.seniority(),
        candidate.salaryExpectation() == null ? null : candidate.salaryExpectation().value());
  }
}

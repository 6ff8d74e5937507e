package dev.jobmatch.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Source of a document in the candidates collection. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CandidateDocument(
    @JsonProperty("top_skills") List<String> topSkills,
    @JsonProperty("other_skills") List<String> otherSkills,
    @JsonProperty("seniority") @Nullable String seniority,
    @JsonProperty("salary_expectation") @Nullable Integer salaryExpectation) {

  static final String TOP_SKILLS = "top_skills";
  static final String OTHER_SKILLS = "other_skills";
  static final String SENIORITY = "seniority";
  static final String SALARY_EXPECTATION = "salary_expectation";

  public CandidateDocument {
    topSkills = topSkills == null ? List.of() : List.copyOf(topSkills);
    otherSkills = otherSkills == null ? List.of() : List.copyOf(otherSkills);
  }
}

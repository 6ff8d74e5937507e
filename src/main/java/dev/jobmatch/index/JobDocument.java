package dev.jobmatch.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Source of a document in the jobs collection.
 *
 * <p>Values are raw: seniority strings are not validated here, see {@link ProfileDocumentMapper}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobDocument(
    @JsonProperty("top_skills") List<String> topSkills,
    @JsonProperty("other_skills") List<String> otherSkills,
    @JsonProperty("seniorities") List<String> seniorities,
    @JsonProperty("max_salary") @Nullable Integer maxSalary) {

  static final String TOP_SKILLS = "top_skills";
  static final String OTHER_SKILLS = "other_skills";
  static final String SENIORITIES = "seniorities";
  static final String MAX_SALARY = "max_salary";

  public JobDocument {
    topSkills = topSkills == null ? List.of() : List.copyOf(topSkills);
    otherSkills = otherSkills == null ? List.of() : List.copyOf(otherSkills);
    seniorities = seniorities == null ? List.of() : List.copyOf(seniorities);
  }
}

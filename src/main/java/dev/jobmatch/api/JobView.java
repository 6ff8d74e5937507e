package dev.jobmatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobmatch.profile.Job;
import dev.jobmatch.profile.SeniorityLevel;
import dev.jobmatch.profile.Skill;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** JSON view of a job, field names as stored in the index plus the document id. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobView(
    String id,
    @JsonProperty("top_skills") List<String> topSkills,
    @JsonProperty("other_skills") List<String> otherSkills,
    List<SeniorityLevel> seniorities,
    @JsonProperty("max_salary") @Nullable Integer maxSalary) {

  static JobView from(Job job) {
    return new JobView(
        job.id(),
        job.topSkills().stream().map(Skill::name).toList(),
        job.otherSkills().stream().map(Skill::name).toList(),
        job.seniorities(),
        job.maxSalary() == null ? null : job.maxSalary().value());
  }
}

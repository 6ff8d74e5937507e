package dev.jobmatch.fixture;

import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Salary;
import dev.jobmatch.profile.SeniorityLevel;
import dev.jobmatch.profile.Skill;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for {@link Candidate}.
 *
 * <pre>{@code
 * Candidate candidate = new CandidateBuilder().seniority(SeniorityLevel.JUNIOR).build();
 * }</pre>
 */
public final class CandidateBuilder {

  private String id = "cand-1";
  private List<Skill> topSkills = JobBuilder.skills("Python", "AWS", "TypeScript");
  private List<Skill> otherSkills = List.of();
  private @Nullable SeniorityLevel seniority = SeniorityLevel.SENIOR;
  private @Nullable Salary salaryExpectation = new Salary(80_000);

  public CandidateBuilder id(String id) {
    this.id = id;
    return this;
  }

  public CandidateBuilder topSkills(String... names) {
    this.topSkills = JobBuilder.skills(names);
    return this;
  }

  public CandidateBuilder otherSkills(String... names) {
    this.otherSkills = JobBuilder.skills(names);
    return this;
  }

  public CandidateBuilder seniority(@Nullable SeniorityLevel seniority) {
    this.seniority = seniority;
    return this;
  }

  public CandidateBuilder salaryExpectation(@Nullable Integer salaryExpectation) {
    this.salaryExpectation = salaryExpectation == null ? null : new Salary(salaryExpectation);
    return this;
  }

  public Candidate build() {
    return new Candidate(id, topSkills, otherSkills, seniority, salaryExpectation);
  }
}

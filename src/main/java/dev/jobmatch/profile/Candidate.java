package dev.jobmatch.profile;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A candidate profile as seen by the matching engine.
 *
 * @param id opaque document id
 * @param topSkills the candidate's strongest skills
 * @param otherSkills additional skills; count towards the candidate's matchable pool
 * @param seniority the candidate's seniority, or null if unknown
 * @param salaryExpectation the expected salary, or null if not given
 */
public record Candidate(
    String id,
    List<Skill> topSkills,
    List<Skill> otherSkills,
    @Nullable SeniorityLevel seniority,
    @Nullable Salary salaryExpectation) {

  public Candidate {
    if (id == null || id.isBlank()) {
      throw new ValidationException("Candidate id must not be blank");
    }
    topSkills = Job.distinct(topSkills);
    otherSkills = Job.distinct(otherSkills);
  }

  /** Top skills followed by other skills. */
  public List<Skill> allSkills() {
    List<Skill> all = new ArrayList<>(topSkills);
    all.addAll(otherSkills);
    return all;
  }

  /** Returns {@code true} if the job's maximum salary covers this candidate's expectation. */
  public boolean matchesSalary(@Nullable Salary jobMaxSalary) {
    return salaryExpectation != null && jobMaxSalary != null && jobMaxSalary.covers(salaryExpectation);
  }

  /** Returns {@code true} if this candidate's seniority is among the job's accepted levels. */
  public boolean matchesSeniority(List<SeniorityLevel> jobSeniorities) {
    return seniority != null && jobSeniorities.contains(seniority);
  }

  /**
   * Share of the job's top skills this candidate holds. Unlike {@link Job#skillMatchScore}, the
   * candidate's whole pool (top and other skills) is credited.
   */
  public double skillMatchScore(List<Skill> jobTopSkills) {
    if (topSkills.isEmpty()) {
      return 0.0;
    }
    return SkillOverlap.score(jobTopSkills, allSkills());
  }
}

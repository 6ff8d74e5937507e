package dev.jobmatch.profile;

import java.util.LinkedHashSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A job posting as seen by the matching engine.
 *
 * <p>Top skills are the job's hard requirements and the denominator of every skill score. Other
 * skills are informational and carry no matching weight. Duplicate entries (skills compared
 * ignoring case) collapse to their first occurrence.
 *
 * @param id opaque document id
 * @param topSkills required skills, in priority order; may be empty
 * @param otherSkills nice-to-have skills
 * @param seniorities the seniority levels the job accepts
 * @param maxSalary the maximum salary offered, or null if not published
 */
public record Job(
    String id,
    List<Skill> topSkills,
    List<Skill> otherSkills,
    List<SeniorityLevel> seniorities,
    @Nullable Salary maxSalary) {

  public Job {
    if (id == null || id.isBlank()) {
      throw new ValidationException("Job id must not be blank");
    }
    topSkills = distinct(topSkills);
    otherSkills = distinct(otherSkills);
    seniorities = distinct(seniorities);
  }

  /**
   * Returns {@code true} if the job's budget covers the candidate's expectation. Absent salaries on
   * either side never match.
   */
  public boolean matchesSalary(@Nullable Salary expectation) {
    return maxSalary != null && expectation != null && maxSalary.covers(expectation);
  }

  /**
   * Returns {@code true} if the given level is one the job accepts. An absent level or an empty
   * acceptance list never matches.
   */
  public boolean matchesSeniority(@Nullable SeniorityLevel level) {
    return level != null && seniorities.contains(level);
  }

  /** Share of this job's top skills found among {@code candidateSkills}. */
  public double skillMatchScore(List<Skill> candidateSkills) {
    return SkillOverlap.score(topSkills, candidateSkills);
  }

  static <T> List<T> distinct(@Nullable List<T> values) {
    if (values == null) {
      return List.of();
    }
    return List.copyOf(new LinkedHashSet<>(values));
  }
}

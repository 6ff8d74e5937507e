package dev.jobmatch.matching;

import jakarta.annotation.PostConstruct;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for matching.
 *
 * <p>Properties are bound from {@code jobmatch.matching.*} in application.yml.
 *
 * <ul>
 *   <li>{@code min-matching-skills} - floor on how many top skills must overlap for the skill
 *       clause to match (default 2; lowered to the source's skill count when it has fewer)
 *   <li>{@code max-results} - page size of the index query (default 100, bounded [1, 10000])
 *   <li>{@code weights.*} - per-filter weights used both as query boosts and in the weighted
 *       average (defaults 2.0 skill, 1.5 seniority, 1.0 salary)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "jobmatch.matching")
public class MatchingProperties {

  private int minMatchingSkills = 2;
  private int maxResults = 100;
  private Weights weights = new Weights();

  @PostConstruct
  void validate() {
    if (minMatchingSkills < 1) {
      throw new IllegalStateException(
          "jobmatch.matching.min-matching-skills must be >= 1, got: " + minMatchingSkills);
    }
    if (maxResults < 1 || maxResults > 10_000) {
      throw new IllegalStateException(
          "jobmatch.matching.max-results must be in [1, 10000], got: " + maxResults);
    }
    for (MatchFilter filter : MatchFilter.values()) {
      if (weightOf(filter) <= 0.0) {
        throw new IllegalStateException(
            "jobmatch.matching.weights."
                + filter.name().toLowerCase(Locale.ROOT)
                + " must be > 0, got: "
                + weightOf(filter));
      }
    }
  }

  /** Configured weight of the given filter. */
  public double weightOf(MatchFilter filter) {
    return switch (filter) {
      case SKILL -> weights.getSkill();
      case SENIORITY -> weights.getSeniority();
      case SALARY -> weights.getSalary();
    };
  }

  public int getMinMatchingSkills() {
    return minMatchingSkills;
  }

  public void setMinMatchingSkills(int minMatchingSkills) {
    this.minMatchingSkills = minMatchingSkills;
  }

  public int getMaxResults() {
    return maxResults;
  }

  public void setMaxResults(int maxResults) {
    this.maxResults = maxResults;
  }

  public Weights getWeights() {
    return weights;
  }

  public void setWeights(Weights weights) {
    this.weights = weights;
  }

  public static class Weights {

    private double skill = MatchFilter.SKILL.defaultWeight();
    private double seniority = MatchFilter.SENIORITY.defaultWeight();
    private double salary = MatchFilter.SALARY.defaultWeight();

    public double getSkill() {
      return skill;
    }

    public void setSkill(double skill) {
      this.skill = skill;
    }

    public double getSeniority() {
      return seniority;
    }

    public void setSeniority(double seniority) {
      this.seniority = seniority;
    }

    public double getSalary() {
      return salary;
    }

    public void setSalary(double salary) {
      this.salary = salary;
    }
  }
}

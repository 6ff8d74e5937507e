package dev.jobmatch.matching;

import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Job;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Combines the enabled criteria of a job/candidate pair into one score in [0, 1].
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Skill filter: the skill overlap ratio (0..1) is always a component
 *   <li>Seniority and salary filters: contribute 1.0 when they match; a mismatch omits the
 *       criterion entirely instead of contributing 0
 *   <li>No component at all scores 0
 *   <li>Otherwise {@code Σ(component × weight) / Σ(weight)} over the components present
 * </ol>
 *
 * <p>Omitting a failed boolean criterion keeps a single mismatch from zeroing an otherwise strong
 * skill overlap. Weights come from {@link MatchingProperties}. Stateless and thread-safe.
 */
@Component
public class WeightedMatchScorer {

  private final MatchingProperties properties;

  public WeightedMatchScorer(MatchingProperties properties) {
    this.properties = properties;
  }

  /**
   * Scores a candidate from the job's point of view: the job's top skills are the denominator and
   * only the candidate's top skills are credited.
   */
  public double scoreCandidate(Job job, Candidate candidate, MatchFilters filters) {
    Map<MatchFilter, Double> components = new EnumMap<>(MatchFilter.class);
    if (filters.isEnabled(MatchFilter.SKILL)) {
      components.put(MatchFilter.SKILL, job.skillMatchScore(candidate.topSkills()));
    }
    if (filters.isEnabled(MatchFilter.SENIORITY) && job.matchesSeniority(candidate.seniority())) {
      components.put(MatchFilter.SENIORITY, 1.0);
    }
    if (filters.isEnabled(MatchFilter.SALARY)
        && job.matchesSalary(candidate.salaryExpectation())) {
      components.put(MatchFilter.SALARY, 1.0);
    }
    return weightedAverage(components);
  }

  /**
   * Scores a job from the candidate's point of view: the job's top skills are still the
   * denominator, but the candidate's whole skill pool is credited.
   */
  public double scoreJob(Candidate candidate, Job job, MatchFilters filters) {
    Map<MatchFilter, Double> components = new EnumMap<>(MatchFilter.class);
    if (filters.isEnabled(MatchFilter.SKILL)) {
      components.put(MatchFilter.SKILL, candidate.skillMatchScore(job.topSkills()));
    }
    if (filters.isEnabled(MatchFilter.SENIORITY)
        && candidate.matchesSeniority(job.seniorities())) {
      components.put(MatchFilter.SENIORITY, 1.0);
    }
    if (filters.isEnabled(MatchFilter.SALARY) && candidate.matchesSalary(job.maxSalary())) {
      components.put(MatchFilter.SALARY, 1.0);
    }
    return weightedAverage(components);
  }

  private double weightedAverage(Map<MatchFilter, Double> components) {
    if (components.isEmpty()) {
      return 0.0;
    }
    double weightedSum = 0.0;
    double totalWeight = 0.0;
    for (Map.Entry<MatchFilter, Double> entry : components.entrySet()) {
      double weight = properties.weightOf(entry.getKey());
      weightedSum += entry.getValue() * weight;
      totalWeight += weight;
    }
    return weightedSum / totalWeight;
  }
}

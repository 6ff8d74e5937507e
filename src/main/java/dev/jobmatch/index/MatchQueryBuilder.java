package dev.jobmatch.index;

import dev.jobmatch.matching.MatchFilter;
import dev.jobmatch.matching.MatchFilters;
import dev.jobmatch.matching.MatchingProperties;
import dev.jobmatch.matching.MissingFieldException;
import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Job;
import dev.jobmatch.profile.Salary;
import dev.jobmatch.profile.SeniorityLevel;
import dev.jobmatch.profile.Skill;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Translates a source document and its enabled filters into a disjunctive {@link MatchQuery}
 * against the counterpart collection.
 *
 * <p>One clause per enabled filter:
 *
 * <ul>
 *   <li>salary - range on the counterpart's salary field ({@code <=} budget when searching
 *       candidates, {@code >=} expectation when searching jobs)
 *   <li>skill - the counterpart's top skills must contain at least {@code min(|source top skills|,
 *       min-matching-skills)} of the source's top skills, boosted by the skill weight
 *   <li>seniority - the counterpart's seniority is among the job's accepted levels, boosted by the
 *       seniority weight
 * </ul>
 *
 * <p>A field an enabled filter needs but the source lacks fails with {@link MissingFieldException};
 * the clause is never silently skipped.
 */
@Component
public class MatchQueryBuilder {

  private static final Logger log = LoggerFactory.getLogger(MatchQueryBuilder.class);

  private final MatchingProperties properties;

  public MatchQueryBuilder(MatchingProperties properties) {
    this.properties = properties;
  }

  /** Query over the candidates collection for candidates matching {@code job}. */
  public MatchQuery forJob(Job job, MatchFilters filters) {
    return build(
        MatchDirection.JOB_TO_CANDIDATES,
        job.topSkills(),
        job.seniorities(),
        job.maxSalary(),
        filters);
  }

  /** Query over the jobs collection for jobs matching {@code candidate}. */
  public MatchQuery forCandidate(Candidate candidate, MatchFilters filters) {
    List<SeniorityLevel> seniority =
        candidate.seniority() == null ? List.of() : List.of(candidate.seniority());
    return build(
        MatchDirection.CANDIDATE_TO_JOBS,
        candidate.topSkills(),
        seniority,
        candidate.salaryExpectation(),
        filters);
  }

  private MatchQuery build(
      MatchDirection direction,
      List<Skill> topSkills,
      List<SeniorityLevel> seniorities,
      @Nullable Salary salary,
      MatchFilters filters) {
    List<QueryClause> clauses = new ArrayList<>();
    for (MatchFilter filter : filters.enabled()) {
      clauses.add(
          switch (filter) {
            case SALARY -> salaryClause(direction, salary);
            case SKILL -> skillClause(direction, topSkills);
            case SENIORITY -> seniorityClause(direction, seniorities);
          });
    }
    MatchQuery query = MatchQuery.anyOf(clauses);
    log.debug("Built {} query against {}: {}", direction, direction.target(), query.toQueryDsl());
    return query;
  }

  private QueryClause salaryClause(MatchDirection direction, @Nullable Salary salary) {
    if (salary == null) {
      throw new MissingFieldException(direction.sourceSalaryField(), MatchFilter.SALARY);
    }
    return new RangeClause(direction.targetSalaryField(), direction.salaryBound(), salary.value());
  }

  private QueryClause skillClause(MatchDirection direction, List<Skill> topSkills) {
    if (topSkills.isEmpty()) {
      throw new MissingFieldException(JobDocument.TOP_SKILLS, MatchFilter.SKILL);
    }
    List<String> names = topSkills.stream().map(Skill::name).toList();
    int minimumShouldMatch = Math.min(names.size(), properties.getMinMatchingSkills());
    return new MinimumMatchTermsClause(
        direction.targetSkillField(),
        names,
        minimumShouldMatch,
        properties.weightOf(MatchFilter.SKILL));
  }

  private QueryClause seniorityClause(MatchDirection direction, List<SeniorityLevel> seniorities) {
    if (seniorities.isEmpty()) {
      throw new MissingFieldException(direction.sourceSeniorityField(), MatchFilter.SENIORITY);
    }
    double boost = properties.weightOf(MatchFilter.SENIORITY);
    if (direction == MatchDirection.CANDIDATE_TO_JOBS) {
      return new TermClause(direction.targetSeniorityField(), seniorities.get(0).value(), boost);
    }
    return new TermsClause(
        direction.targetSeniorityField(),
        seniorities.stream().map(SeniorityLevel::value).toList(),
        boost);
  }
}

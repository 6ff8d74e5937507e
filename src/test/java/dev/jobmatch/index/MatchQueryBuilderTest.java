package dev.jobmatch.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.jobmatch.fixture.CandidateBuilder;
import dev.jobmatch.fixture.JobBuilder;
import dev.jobmatch.matching.MatchFilter;
import dev.jobmatch.matching.MatchFilters;
import dev.jobmatch.matching.MatchingProperties;
import dev.jobmatch.matching.MissingFieldException;
import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Job;
import dev.jobmatch.profile.SeniorityLevel;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MatchQueryBuilderTest {

  private final MatchingProperties properties = new MatchingProperties();
  private final MatchQueryBuilder builder = new MatchQueryBuilder(properties);

  // --- job -> candidates ---

  @Test
  void jobQueryHasOneClausePerEnabledFilter() {
    MatchQuery query = builder.forJob(new JobBuilder().build(), MatchFilters.all());

    assertThat(query.minimumShouldMatch()).isEqualTo(1);
    assertThat(query.should())
        .hasSize(3)
        .hasExactlyElementsOfTypes(
            MinimumMatchTermsClause.class, TermsClause.class, RangeClause.class);
  }

  @Test
  void jobSalaryClauseBoundsCandidateExpectationFromAbove() {
    Job job = new JobBuilder().maxSalary(85_000).build();

    MatchQuery query = builder.forJob(job, MatchFilters.of(MatchFilter.SALARY));

    assertThat(query.should())
        .containsExactly(new RangeClause("salary_expectation", RangeClause.Bound.LTE, 85_000));
    assertThat(query.should().get(0).toQueryDsl())
        .isEqualTo(Map.of("range", Map.of("salary_expectation", Map.of("lte", 85_000L))));
  }

  @Test
  void jobSeniorityClauseMatchesAnyAcceptedLevel() {
    Job job = new JobBuilder().seniorities(SeniorityLevel.MIDLEVEL, SeniorityLevel.SENIOR).build();

    MatchQuery query = builder.forJob(job, MatchFilters.of(MatchFilter.SENIORITY));

    assertThat(query.should())
        .containsExactly(new TermsClause("seniority", List.of("midlevel", "senior"), 1.5));
  }

  @Test
  void jobSeniorityClauseRendersCaseInsensitiveTerms() {
    TermsClause clause = new TermsClause("seniority", List.of("midlevel", "senior"), 1.5);

    assertThat(clause.toQueryDsl())
        .isEqualTo(
            Map.of(
                "bool",
                Map.of(
                    "should",
                    List.of(
                        Map.of(
                            "term",
                            Map.of("seniority", Map.of("value", "midlevel", "case_insensitive", true))),
                        Map.of(
                            "term",
                            Map.of("seniority", Map.of("value", "senior", "case_insensitive", true)))),
                    "minimum_should_match",
                    1,
                    "boost",
                    1.5)));
  }

  @Test
  void skillTermsIgnoreCase() {
    Job job = new JobBuilder().topSkills("python", "aws").build();
    Candidate candidate = new CandidateBuilder().topSkills("Python", "AWS").build();

    MatchQuery query = builder.forJob(job, MatchFilters.of(MatchFilter.SKILL));

    assertThat(job.skillMatchScore(candidate.topSkills())).isEqualTo(1.0);
    assertThat(query.should().get(0).toQueryDsl())
        .isEqualTo(
            Map.of(
                "bool",
                Map.of(
                    "should",
                    List.of(
                        TermClause.caseInsensitiveTerm("top_skills", "python"),
                        TermClause.caseInsensitiveTerm("top_skills", "aws")),
                    "minimum_should_match",
                    2,
                    "boost",
                    2.0)));
  }

  @Test
  void skillClauseRequiresConfiguredMinimumOverlap() {
    Job job = new JobBuilder().topSkills("Python", "AWS", "ML").build();

    MatchQuery query = builder.forJob(job, MatchFilters.of(MatchFilter.SKILL));

    assertThat(query.should())
        .containsExactly(
            new MinimumMatchTermsClause("top_skills", List.of("Python", "AWS", "ML"), 2, 2.0));
  }

  @Test
  void skillMinimumIsLoweredToSourceSkillCount() {
    Job job = new JobBuilder().topSkills("Python").build();

    MatchQuery query = builder.forJob(job, MatchFilters.of(MatchFilter.SKILL));

    MinimumMatchTermsClause clause = (MinimumMatchTermsClause) query.should().get(0);
    assertThat(clause.minimumShouldMatch()).isEqualTo(1);
  }

  @Test
  void skillClauseRendersAsNestedBool() {
    MinimumMatchTermsClause clause =
        new MinimumMatchTermsClause("top_skills", List.of("Python", "AWS"), 2, 2.0);

    assertThat(clause.toQueryDsl())
        .isEqualTo(
            Map.of(
                "bool",
                Map.of(
                    "should",
                    List.of(
                        Map.of(
                            "term",
                            Map.of("top_skills", Map.of("value", "Python", "case_insensitive", true))),
                        Map.of(
                            "term",
                            Map.of("top_skills", Map.of("value", "AWS", "case_insensitive", true)))),
                    "minimum_should_match",
                    2,
                    "boost",
                    2.0)));
  }

  @Test
  void configuredWeightsBecomeBoosts() {
    properties.getWeights().setSkill(3.0);
    properties.getWeights().setSeniority(0.5);

    MatchQuery query =
        builder.forJob(
            new JobBuilder().build(), MatchFilters.of(MatchFilter.SKILL, MatchFilter.SENIORITY));

    assertThat(((MinimumMatchTermsClause) query.should().get(0)).boost()).isEqualTo(3.0);
    assertThat(((TermsClause) query.should().get(1)).boost()).isEqualTo(0.5);
  }

  // --- candidate -> jobs ---

  @Test
  void candidateSalaryClauseBoundsJobBudgetFromBelow() {
    Candidate candidate = new CandidateBuilder().salaryExpectation(80_000).build();

    MatchQuery query = builder.forCandidate(candidate, MatchFilters.of(MatchFilter.SALARY));

    assertThat(query.should())
        .containsExactly(new RangeClause("max_salary", RangeClause.Bound.GTE, 80_000));
  }

  @Test
  void candidateSeniorityClauseIsSingleTermOnJobLevels() {
    Candidate candidate = new CandidateBuilder().seniority(SeniorityLevel.LEAD).build();

    MatchQuery query = builder.forCandidate(candidate, MatchFilters.of(MatchFilter.SENIORITY));

    assertThat(query.should()).containsExactly(new TermClause("seniorities", "lead", 1.5));
    assertThat(query.should().get(0).toQueryDsl())
        .isEqualTo(
            Map.of(
                "term",
                Map.of(
                    "seniorities",
                    Map.of("value", "lead", "case_insensitive", true, "boost", 1.5))));
  }

  // --- missing fields ---

  @Test
  void salaryFilterOnJobWithoutSalaryFails() {
    Job job = new JobBuilder().maxSalary(null).build();

    assertThatThrownBy(() -> builder.forJob(job, MatchFilters.of(MatchFilter.SALARY)))
        .isInstanceOf(MissingFieldException.class)
        .hasMessage("Missing required field 'max_salary' for salary_match");
  }

  @Test
  void seniorityFilterOnCandidateWithoutSeniorityFails() {
    Candidate candidate = new CandidateBuilder().seniority(null).build();

    assertThatThrownBy(
            () -> builder.forCandidate(candidate, MatchFilters.of(MatchFilter.SENIORITY)))
        .isInstanceOfSatisfying(
            MissingFieldException.class, e -> assertThat(e.getField()).isEqualTo("seniority"));
  }

  @Test
  void skillFilterWithoutTopSkillsFails() {
    Candidate candidate = new CandidateBuilder().topSkills().build();

    assertThatThrownBy(() -> builder.forCandidate(candidate, MatchFilters.of(MatchFilter.SKILL)))
        .isInstanceOfSatisfying(
            MissingFieldException.class, e -> assertThat(e.getField()).isEqualTo("top_skills"));
  }

  @Test
  void disabledFilterDoesNotRequireItsField() {
    Job job = new JobBuilder().maxSalary(null).seniorities().build();

    MatchQuery query = builder.forJob(job, MatchFilters.of(MatchFilter.SKILL));

    assertThat(query.should()).hasSize(1);
  }

  @Test
  void wholeQueryIsDisjunction() {
    MatchQuery query = builder.forJob(new JobBuilder().build(), MatchFilters.of(MatchFilter.SALARY));

    assertThat(query.toQueryDsl())
        .isEqualTo(
            Map.of(
                "bool",
                Map.of(
                    "should",
                    List.of(Map.of("range", Map.of("salary_expectation", Map.of("lte", 85_000L)))),
                    "minimum_should_match",
                    1)));
  }
}

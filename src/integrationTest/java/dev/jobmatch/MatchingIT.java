package dev.jobmatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.jobmatch.matching.DocumentNotFoundException;
import dev.jobmatch.matching.Match;
import dev.jobmatch.matching.MatchFilter;
import dev.jobmatch.matching.MatchFilters;
import dev.jobmatch.matching.MatchingService;
import dev.jobmatch.matching.MissingFieldException;
import dev.jobmatch.matching.ScoringMode;
import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.DocumentType;
import dev.jobmatch.profile.Job;
import dev.jobmatch.profile.Salary;
import dev.jobmatch.profile.SeniorityLevel;
import dev.jobmatch.profile.Skill;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

@TestPropertySource(
    properties = {
      "jobmatch.elasticsearch.jobs-index=it-matching-jobs",
      "jobmatch.elasticsearch.candidates-index=it-matching-candidates"
    })
class MatchingIT extends BaseElasticsearchIT {

  @Autowired private MatchingService matchingService;

  private final Job backendJob =
      new Job(
          "job-backend",
          skills("Python", "AWS", "ML"),
          List.of(),
          List.of(SeniorityLevel.MIDLEVEL, SeniorityLevel.SENIOR),
          new Salary(85_000));

  @BeforeEach
  void seed() {
    index(backendJob);
    index(
        new Job(
            "job-frontend",
            skills("TypeScript", "React"),
            List.of(),
            List.of(SeniorityLevel.JUNIOR),
            new Salary(60_000)));
    index(
        new Candidate(
            "cand-strong",
            skills("Python", "AWS", "TypeScript"),
            List.of(),
            SeniorityLevel.SENIOR,
            new Salary(80_000)));
    index(
        new Candidate(
            "cand-pricey",
            skills("Python", "AWS"),
            List.of(),
            SeniorityLevel.LEAD,
            new Salary(120_000)));
    index(
        new Candidate(
            "cand-unrelated",
            skills("Cobol"),
            List.of(),
            SeniorityLevel.JUNIOR,
            new Salary(200_000)));
  }

  @Test
  void jobFindsCandidatesMatchingAnyFilter() {
    List<Match> matches =
        matchingService.findMatches("job-backend", DocumentType.JOB, MatchFilters.all());

    assertThat(matches).extracting(Match::id).containsExactly("cand-strong", "cand-pricey");
    assertThat(matches.get(0).score()).isGreaterThan(matches.get(1).score());
  }

  @Test
  void weightedScoringReportsBoundedScores() {
    List<Match> matches =
        matchingService.findMatches(
            "job-backend", DocumentType.JOB, MatchFilters.all(), ScoringMode.WEIGHTED);

    assertThat(matches.get(0).id()).isEqualTo("cand-strong");
    assertThat(matches.get(0).score()).isCloseTo(0.852, within(0.001));
    assertThat(matches).allSatisfy(m -> assertThat(m.score()).isBetween(0.0, 1.0));
  }

  @Test
  void candidateFindsJobsWithinBudget() {
    List<Match> matches =
        matchingService.findMatches(
            "cand-strong", DocumentType.CANDIDATE, MatchFilters.of(MatchFilter.SALARY));

    assertThat(matches).extracting(Match::id).containsExactly("job-backend");
  }

  @Test
  void candidateSeniorityMatchesJobLevels() {
    List<Match> matches =
        matchingService.findMatches(
            "cand-strong", DocumentType.CANDIDATE, MatchFilters.of(MatchFilter.SENIORITY));

    assertThat(matches).extracting(Match::id).containsExactly("job-backend");
  }

  @Test
  void skillsMatchRegardlessOfStoredCase() {
    index(new Job("job-lowercase", skills("python", "aws"), List.of(), List.of(), null));

    List<Match> candidates =
        matchingService.findMatches(
            "job-lowercase", DocumentType.JOB, MatchFilters.of(MatchFilter.SKILL));
    List<Match> jobs =
        matchingService.findMatches(
            "cand-strong", DocumentType.CANDIDATE, MatchFilters.of(MatchFilter.SKILL));

    assertThat(candidates).extracting(Match::id).containsExactlyInAnyOrder("cand-strong", "cand-pricey");
    assertThat(jobs).extracting(Match::id).contains("job-backend", "job-lowercase");
  }

  @Test
  void unknownSourceIsNotFound() {
    assertThatThrownBy(
            () -> matchingService.findMatches("nobody", DocumentType.CANDIDATE, MatchFilters.all()))
        .isInstanceOf(DocumentNotFoundException.class);
  }

  @Test
  void salaryFilterNeedsSourceSalary() {
    index(new Job("job-no-salary", skills("Go"), List.of(), List.of(), null));

    assertThatThrownBy(
            () ->
                matchingService.findMatches(
                    "job-no-salary", DocumentType.JOB, MatchFilters.of(MatchFilter.SALARY)))
        .isInstanceOf(MissingFieldException.class);
  }

  private static List<Skill> skills(String... names) {
    return Stream.of(names).map(Skill::of).toList();
  }
}

package dev.jobmatch.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.jobmatch.fixture.CandidateBuilder;
import dev.jobmatch.matching.Match;
import dev.jobmatch.matching.MatchFilter;
import dev.jobmatch.matching.MatchFilters;
import dev.jobmatch.matching.MatchingProperties;
import dev.jobmatch.profile.Job;
import dev.jobmatch.profile.SeniorityLevel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IndexJobRepositoryTest {

  @Mock SearchIndex searchIndex;

  @Captor ArgumentCaptor<MatchQuery> queryCaptor;

  IndexJobRepository repository;

  @BeforeEach
  void setUp() {
    MatchingProperties properties = new MatchingProperties();
    properties.setMaxResults(50);
    repository =
        new IndexJobRepository(searchIndex, new MatchQueryBuilder(properties), properties);
  }

  @Test
  void findByIdMapsDocumentToJob() {
    when(searchIndex.getDocument(IndexCollection.JOBS, "job-1", JobDocument.class))
        .thenReturn(
            Optional.of(new JobDocument(List.of("Python"), List.of(), List.of("senior"), 90_000)));

    Job job = repository.findById("job-1").orElseThrow();

    assertThat(job.id()).isEqualTo("job-1");
    assertThat(job.seniorities()).containsExactly(SeniorityLevel.SENIOR);
    assertThat(job.maxSalary().value()).isEqualTo(90_000);
  }

  @Test
  void findByIdOfMissingJobIsEmpty() {
    when(searchIndex.getDocument(IndexCollection.JOBS, "x", JobDocument.class))
        .thenReturn(Optional.empty());

    assertThat(repository.findById("x")).isEmpty();
  }

  @Test
  void findAllByIdKeepsIndexOrder() {
    Map<String, JobDocument> documents = new LinkedHashMap<>();
    documents.put("j2", new JobDocument(List.of("Go"), null, null, null));
    documents.put("j1", new JobDocument(List.of("Java"), null, null, null));
    when(searchIndex.getDocuments(IndexCollection.JOBS, List.of("j2", "j1"), JobDocument.class))
        .thenReturn(documents);

    assertThat(repository.findAllById(List.of("j2", "j1")))
        .extracting(Job::id)
        .containsExactly("j2", "j1");
  }

  @Test
  void findMatchesSearchesJobsCollectionWithConfiguredPageSize() {
    when(searchIndex.search(eq(IndexCollection.JOBS), any(), eq(50)))
        .thenReturn(List.of(new IndexHit("j1", 3.5)));

    List<Match> matches =
        repository.findMatchesForCandidate(
            new CandidateBuilder().build(), MatchFilters.of(MatchFilter.SALARY));

    assertThat(matches).containsExactly(new Match("j1", 3.5));
    verify(searchIndex).search(eq(IndexCollection.JOBS), queryCaptor.capture(), eq(50));
    assertThat(queryCaptor.getValue().should())
        .containsExactly(new RangeClause("max_salary", RangeClause.Bound.GTE, 80_000));
  }
}

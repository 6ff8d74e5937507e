package dev.jobmatch.index;

import dev.jobmatch.matching.JobRepository;
import dev.jobmatch.matching.Match;
import dev.jobmatch.matching.MatchFilters;
import dev.jobmatch.matching.MatchingProperties;
import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Job;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/** {@link JobRepository} backed by the jobs collection of the search index. */
@Repository
public class IndexJobRepository implements JobRepository {

  private final SearchIndex searchIndex;
  private final MatchQueryBuilder queryBuilder;
  private final MatchingProperties properties;

  public IndexJobRepository(
      SearchIndex searchIndex, MatchQueryBuilder queryBuilder, MatchingProperties properties) {
    this.searchIndex = searchIndex;
    this.queryBuilder = queryBuilder;
    this.properties = properties;
  }

  @Override
  public Optional<Job> findById(String id) {
    return searchIndex
        .getDocument(IndexCollection.JOBS, id, JobDocument.class)
        .map(document -> ProfileDocumentMapper.toJob(id, document));
  }

  @Override
  public List<Job> findAllById(Collection<String> ids) {
    return searchIndex.getDocuments(IndexCollection.JOBS, ids, JobDocument.class).entrySet().stream()
        .map(entry -> ProfileDocumentMapper.toJob(entry.getKey(), entry.getValue()))
        .toList();
  }

  @Override
  public List<Match> findMatchesForCandidate(Candidate candidate, MatchFilters filters) {
    MatchQuery query = queryBuilder.forCandidate(candidate, filters);
    return searchIndex.search(IndexCollection.JOBS, query, properties.getMaxResults()).stream()
        .map(IndexHit::toMatch)
        .toList();
  }
}

package dev.jobmatch.index;

import dev.jobmatch.matching.CandidateRepository;
import dev.jobmatch.matching.Match;
import dev.jobmatch.matching.MatchFilters;
import dev.jobmatch.matching.MatchingProperties;
import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Job;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/** {@link CandidateRepository} backed by the candidates collection of the search index. */
@Repository
public class IndexCandidateRepository implements CandidateRepository {

  private final SearchIndex searchIndex;
  private final MatchQueryBuilder queryBuilder;
  private final MatchingProperties properties;

  public IndexCandidateRepository(
      SearchIndex searchIndex, MatchQueryBuilder queryBuilder, MatchingProperties properties) {
    this.searchIndex = searchIndex;
    this.queryBuilder = queryBuilder;
    this.properties = properties;
  }

  @Override
  public Optional<Candidate> findById(String id) {
    return searchIndex
        .getDocument(IndexCollection.CANDIDATES, id, CandidateDocument.class)
        .map(document -> ProfileDocumentMapper.toCandidate(id, document));
  }

  @Override
  public List<Candidate> findAllById(Collection<String> ids) {
    return searchIndex
        .getDocuments(IndexCollection.CANDIDATES, ids, CandidateDocument.class)
        .entrySet()
        .stream()
        .map(entry -> ProfileDocumentMapper.toCandidate(entry.getKey(), entry.getValue()))
        .toList();
  }

  @Override
  public List<Match> findMatchesForJob(Job job, MatchFilters filters) {
    MatchQuery query = queryBuilder.forJob(job, filters);
    return searchIndex.search(IndexCollection.CANDIDATES, query, properties.getMaxResults()).stream()
        .map(IndexHit::toMatch)
        .toList();
  }
}

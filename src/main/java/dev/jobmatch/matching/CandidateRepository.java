package dev.jobmatch.matching;

import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Job;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Read access to candidate profiles and candidate-side match search. */
public interface CandidateRepository {

  Optional<Candidate> findById(String id);

  /**
   * Loads the candidates with the given ids. Ids without a document are skipped.
   *
   * @return the candidates found, in no particular order
   */
  List<Candidate> findAllById(Collection<String> ids);

  /**
   * Searches candidates compatible with the job under the enabled filters.
   *
   * @return matches in the order the index ranked them, scored with index relevance
   * @throws MissingFieldException if the job lacks a field an enabled filter needs
   */
  List<Match> findMatchesForJob(Job job, MatchFilters filters);
}

package dev.jobmatch.matching;

import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Job;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Read access to job postings and job-side match search. */
public interface JobRepository {

  Optional<Job> findById(String id);

  /**
   * Loads the jobs with the given ids. Ids without a document are skipped.
   *
   * @return the jobs found, in no particular order
   */
  List<Job> findAllById(Collection<String> ids);

  /**
   * Searches jobs compatible with the candidate under the enabled filters.
   *
   * @return matches in the order the index ranked them, scored with index relevance
   * @throws MissingFieldException if the candidate lacks a field an enabled filter needs
   */
  List<Match> findMatchesForCandidate(Candidate candidate, MatchFilters filters);
}

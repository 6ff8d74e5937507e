package dev.jobmatch.matching;

import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.DocumentType;
import dev.jobmatch.profile.Job;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates match requests: fetch the source document, let the counterpart repository search
 * the index, then report either the index score or the weighted score.
 *
 * <p>Pipeline: load source by id (404 if absent) -> build and run the disjunctive index query via
 * the counterpart repository -> in {@link ScoringMode#WEIGHTED} mode, load the hit documents and
 * re-score each pair with {@link WeightedMatchScorer}.
 *
 * <p>Holds no mutable state; safe to call from any number of request threads.
 */
@Service
public class MatchingService {

  private static final Logger log = LoggerFactory.getLogger(MatchingService.class);

  private final DocumentService documentService;
  private final JobRepository jobRepository;
  private final CandidateRepository candidateRepository;
  private final WeightedMatchScorer scorer;

  public MatchingService(
      DocumentService documentService,
      JobRepository jobRepository,
      CandidateRepository candidateRepository,
      WeightedMatchScorer scorer) {
    this.documentService = documentService;
    this.jobRepository = jobRepository;
    this.candidateRepository = candidateRepository;
    this.scorer = scorer;
  }

  /**
   * Finds counterparts of a job or candidate, reporting index relevance scores.
   *
   * @see #findMatches(String, DocumentType, MatchFilters, ScoringMode)
   */
  public List<Match> findMatches(String id, DocumentType type, MatchFilters filters) {
    return findMatches(id, type, filters, ScoringMode.INDEX_RELEVANCE);
  }

  /**
   * Finds counterparts of a job (candidates) or of a candidate (jobs).
   *
   * @param id id of the source document
   * @param type whether {@code id} names a job or a candidate
   * @param filters the enabled criteria
   * @param mode which score to report
   * @return matches in index order for {@link ScoringMode#INDEX_RELEVANCE}, by descending weighted
   *     score for {@link ScoringMode#WEIGHTED}
   * @throws DocumentNotFoundException if the source document does not exist
   * @throws MissingFieldException if the source lacks a field an enabled filter needs
   */
  public List<Match> findMatches(
      String id, DocumentType type, MatchFilters filters, ScoringMode mode) {
    List<Match> matches =
        switch (type) {
          case JOB -> findCandidatesForJob(id, filters, mode);
          case CANDIDATE -> findJobsForCandidate(id, filters, mode);
        };
    log.info(
        "Matched {} {} with {} ({} scoring): {} results",
        type.value(),
        id,
        filters.enabled(),
        mode.value(),
        matches.size());
    return matches;
  }

  public List<Match> findCandidatesForJob(String jobId, MatchFilters filters, ScoringMode mode) {
    Job job = documentService.getJob(jobId);
    List<Match> hits = candidateRepository.findMatchesForJob(job, filters);
    if (mode == ScoringMode.INDEX_RELEVANCE || hits.isEmpty()) {
      return hits;
    }
    Map<String, Candidate> candidates =
        candidateRepository.findAllById(ids(hits)).stream()
            .collect(Collectors.toMap(Candidate::id, Function.identity(), (a, b) -> a));
    return rescore(hits, candidates, c -> scorer.scoreCandidate(job, c, filters));
  }

  public List<Match> findJobsForCandidate(
      String candidateId, MatchFilters filters, ScoringMode mode) {
    Candidate candidate = documentService.getCandidate(candidateId);
    List<Match> hits = jobRepository.findMatchesForCandidate(candidate, filters);
    if (mode == ScoringMode.INDEX_RELEVANCE || hits.isEmpty()) {
      return hits;
    }
    Map<String, Job> jobs =
        jobRepository.findAllById(ids(hits)).stream()
            .collect(Collectors.toMap(Job::id, Function.identity(), (a, b) -> a));
    return rescore(hits, jobs, j -> scorer.scoreJob(candidate, j, filters));
  }

  /**
   * Replaces index scores with weighted scores. Hits whose document vanished between search and
   * fetch are dropped. The sort is stable, so ties keep their index order.
   */
  private static <T> List<Match> rescore(
      List<Match> hits, Map<String, T> documents, Function<T, Double> score) {
    List<Match> rescored = new ArrayList<>(hits.size());
    for (Match hit : hits) {
      T document = documents.get(hit.id());
      if (document == null) {
        log.debug("Dropping hit {}: document no longer in index", hit.id());
        continue;
      }
      rescored.add(new Match(hit.id(), score.apply(document)));
    }
    rescored.sort(Comparator.comparingDouble(Match::score).reversed());
    return rescored;
  }

  private static List<String> ids(List<Match> hits) {
    return hits.stream().map(Match::id).toList();
  }
}

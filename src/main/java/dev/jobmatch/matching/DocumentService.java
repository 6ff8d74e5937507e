package dev.jobmatch.matching;

import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.DocumentType;
import dev.jobmatch.profile.Job;
import org.springframework.stereotype.Service;

/** Looks up jobs and candidates by id, failing with {@link DocumentNotFoundException}. */
@Service
public class DocumentService {

  private final JobRepository jobRepository;
  private final CandidateRepository candidateRepository;

  public DocumentService(JobRepository jobRepository, CandidateRepository candidateRepository) {
    this.jobRepository = jobRepository;
    this.candidateRepository = candidateRepository;
  }

  public Job getJob(String id) {
    return jobRepository
        .findById(id)
        .orElseThrow(() -> new DocumentNotFoundException(DocumentType.JOB, id));
  }

  public Candidate getCandidate(String id) {
    return candidateRepository
        .findById(id)
        .orElseThrow(() -> new DocumentNotFoundException(DocumentType.CANDIDATE, id));
  }
}

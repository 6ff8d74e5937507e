package dev.jobmatch.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import dev.jobmatch.fixture.CandidateBuilder;
import dev.jobmatch.fixture.JobBuilder;
import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.DocumentType;
import dev.jobmatch.profile.Job;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocumentServiceTest {

  @Mock JobRepository jobRepository;

  @Mock CandidateRepository candidateRepository;

  @InjectMocks DocumentService documentService;

  @Test
  void returnsExistingJob() {
    Job job = new JobBuilder().id("job-9").build();
    when(jobRepository.findById("job-9")).thenReturn(Optional.of(job));

    assertThat(documentService.getJob("job-9")).isSameAs(job);
  }

  @Test
  void returnsExistingCandidate() {
    Candidate candidate = new CandidateBuilder().id("cand-9").build();
    when(candidateRepository.findById("cand-9")).thenReturn(Optional.of(candidate));

    assertThat(documentService.getCandidate("cand-9")).isSameAs(candidate);
  }

  @Test
  void missingCandidateCarriesTypeAndId() {
    when(candidateRepository.findById("nope")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> documentService.getCandidate("nope"))
        .isInstanceOfSatisfying(
            DocumentNotFoundException.class,
            e -> {
              assertThat(e.getType()).isEqualTo(DocumentType.CANDIDATE);
              assertThat(e.getId()).isEqualTo("nope");
            });
  }
}

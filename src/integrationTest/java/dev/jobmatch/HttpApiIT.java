package dev.jobmatch;

import static org.assertj.core.api.Assertions.assertThat;

import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Job;
import dev.jobmatch.profile.Salary;
import dev.jobmatch.profile.SeniorityLevel;
import dev.jobmatch.profile.Skill;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.TestPropertySource;

@TestPropertySource(
    properties = {
      "jobmatch.elasticsearch.jobs-index=it-http-jobs",
      "jobmatch.elasticsearch.candidates-index=it-http-candidates"
    })
class HttpApiIT extends BaseElasticsearchIT {

  private static final ParameterizedTypeReference<Map<String, Object>> JSON =
      new ParameterizedTypeReference<>() {};

  @Autowired private TestRestTemplate rest;

  @BeforeEach
  void seed() {
    index(
        new Job(
            "job-1",
            List.of(Skill.of("Java"), Skill.of("Kafka")),
            List.of(),
            List.of(SeniorityLevel.SENIOR),
            new Salary(90_000)));
    index(
        new Candidate(
            "cand-1",
            List.of(Skill.of("Java"), Skill.of("Kafka")),
            List.of(Skill.of("SQL")),
            SeniorityLevel.SENIOR,
            new Salary(85_000)));
  }

  @Test
  void healthIsUpAgainstRunningCluster() {
    ResponseEntity<Map<String, Object>> response =
        rest.exchange("/health", HttpMethod.GET, null, JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("status", "healthy");
  }

  @Test
  void documentIsReturnedWithId() {
    ResponseEntity<Map<String, Object>> response =
        rest.exchange("/document?id=cand-1&doc_type=candidate", HttpMethod.GET, null, JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .containsEntry("id", "cand-1")
        .containsEntry("seniority", "senior")
        .containsEntry("salary_expectation", 85_000);
  }

  @Test
  void unknownDocumentIsNotFound() {
    ResponseEntity<Map<String, Object>> response =
        rest.exchange("/document?id=ghost&doc_type=job", HttpMethod.GET, null, JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void matchesEndpointReturnsCounterparts() {
    Map<String, Object> body =
        Map.of(
            "id", "job-1",
            "doc_type", "job",
            "filters", Map.of("top_skill_match", true, "seniority_match", true));

    ResponseEntity<Map<String, Object>> response =
        rest.exchange("/matches", HttpMethod.POST, new HttpEntity<>(body), JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsKey("matches");
    assertThat((List<?>) response.getBody().get("matches")).hasSize(1);
  }

  @Test
  void emptyFiltersAreRejected() {
    Map<String, Object> body =
        Map.of("id", "job-1", "doc_type", "job", "filters", Map.of("salary_match", false));

    ResponseEntity<Map<String, Object>> response =
        rest.exchange("/matches", HttpMethod.POST, new HttpEntity<>(body), JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }
}

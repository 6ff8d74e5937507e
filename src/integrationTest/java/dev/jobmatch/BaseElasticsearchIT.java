package dev.jobmatch;

import dev.jobmatch.index.IndexCollection;
import dev.jobmatch.index.ProfileDocumentMapper;
import dev.jobmatch.index.SearchIndex;
import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Job;
import dev.jobmatch.index.ElasticsearchProperties;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.web.client.RestClient;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Starts one single-node Elasticsearch container per JVM with security disabled, and points
 * {@code jobmatch.elasticsearch.base-url} at it. Each subclass uses its own index names so test
 * data never leaks between classes. Indices are recreated before every test with keyword mappings,
 * since the service itself never manages index mappings.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public abstract class BaseElasticsearchIT {

  static GenericContainer<?> elasticsearch =
      new GenericContainer<>(
              DockerImageName.parse("docker.elastic.co/elasticsearch/elasticsearch:8.15.3"))
          .withExposedPorts(9200)
          .withEnv("discovery.type", "single-node")
          .withEnv("xpack.security.enabled", "false")
          .withEnv("ES_JAVA_OPTS", "-Xms512m -Xmx512m")
          .waitingFor(
              Wait.forHttp("/_cluster/health?wait_for_status=yellow")
                  .forPort(9200)
                  .forStatusCode(200)
                  .withStartupTimeout(Duration.ofSeconds(180)));

  static {
    elasticsearch.start();
  }

  @DynamicPropertySource
  static void overrideProperties(DynamicPropertyRegistry registry) {
    registry.add(
        "jobmatch.elasticsearch.base-url",
        () -> "http://" + elasticsearch.getHost() + ":" + elasticsearch.getMappedPort(9200));
    registry.add("jobmatch.elasticsearch.retry.max-attempts", () -> "2");
    registry.add("jobmatch.elasticsearch.retry.delay-ms", () -> "50");
  }

  private static final Map<String, Object> JOB_MAPPING =
      Map.of(
          "top_skills", Map.of("type", "keyword"),
          "other_skills", Map.of("type", "keyword"),
          "seniorities", Map.of("type", "keyword"),
          "max_salary", Map.of("type", "integer"));

  private static final Map<String, Object> CANDIDATE_MAPPING =
      Map.of(
          "top_skills", Map.of("type", "keyword"),
          "other_skills", Map.of("type", "keyword"),
          "seniority", Map.of("type", "keyword"),
          "salary_expectation", Map.of("type", "integer"));

  @Autowired protected SearchIndex searchIndex;

  @Autowired
  @Qualifier("elasticsearchRestClient")
  private RestClient restClient;

  @Autowired private ElasticsearchProperties properties;

  @BeforeEach
  void recreateIndices() {
    recreate(properties.indexName(IndexCollection.JOBS), JOB_MAPPING);
    recreate(properties.indexName(IndexCollection.CANDIDATES), CANDIDATE_MAPPING);
  }

  private void recreate(String index, Map<String, Object> fields) {
    restClient
        .delete()
        .uri("/{index}", index)
        .retrieve()
        .onStatus(status -> status.value() == 404, (request, response) -> {})
        .toBodilessEntity();
    restClient
        .put()
        .uri("/{index}", index)
        .body(Map.of("mappings", Map.of("properties", fields)))
        .retrieve()
        .toBodilessEntity();
  }

  protected void index(Job job) {
    searchIndex.putDocument(IndexCollection.JOBS, job.id(), ProfileDocumentMapper.toDocument(job));
  }

  protected void index(Candidate candidate) {
    searchIndex.putDocument(
        IndexCollection.CANDIDATES, candidate.id(), ProfileDocumentMapper.toDocument(candidate));
  }
}

package dev.jobmatch.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatch.index.ElasticsearchResponses.GetResult;
import dev.jobmatch.index.ElasticsearchResponses.Hit;
import dev.jobmatch.index.ElasticsearchResponses.MultiGetResult;
import dev.jobmatch.index.ElasticsearchResponses.SearchResult;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link SearchIndex} over the Elasticsearch REST API.
 *
 * <p>Failure mapping: a missing document is an empty result; connection failures, 5xx answers and
 * 429 (cluster overloaded) become {@link SearchIndexUnavailableException} and are retried with
 * exponential backoff; any other 4xx answer becomes {@link SearchIndexException} and is not
 * retried.
 */
@Service
public class ElasticsearchIndexClient implements SearchIndex {

  private static final Logger log = LoggerFactory.getLogger(ElasticsearchIndexClient.class);

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
      new ParameterizedTypeReference<>() {};

  private final RestClient restClient;
  private final ElasticsearchProperties properties;
  private final ObjectMapper objectMapper;

  public ElasticsearchIndexClient(
      @Qualifier("elasticsearchRestClient") RestClient restClient,
      ElasticsearchProperties properties,
      ObjectMapper objectMapper) {
    this.restClient = restClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  @Retryable(
      retryFor = SearchIndexUnavailableException.class,
      maxAttemptsExpression = "${jobmatch.elasticsearch.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${jobmatch.elasticsearch.retry.delay-ms}",
              multiplierExpression = "${jobmatch.elasticsearch.retry.multiplier}"))
  public <T> Optional<T> getDocument(IndexCollection collection, String id, Class<T> type) {
    String index = properties.indexName(collection);
    GetResult result =
        execute(
            "get " + index + "/" + id,
            () -> {
              try {
                return restClient
                    .get()
                    .uri("/{index}/_doc/{id}", index, id)
                    .retrieve()
                    .body(GetResult.class);
              } catch (HttpClientErrorException.NotFound e) {
                return null;
              }
            });
    if (result == null || !result.found() || result.source() == null) {
      log.debug("Document {} not found in index {}", id, index);
      return Optional.empty();
    }
    return Optional.of(objectMapper.convertValue(result.source(), type));
  }

  @Override
  @Retryable(
      retryFor = SearchIndexUnavailableException.class,
      maxAttemptsExpression = "${jobmatch.elasticsearch.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${jobmatch.elasticsearch.retry.delay-ms}",
              multiplierExpression = "${jobmatch.elasticsearch.retry.multiplier}"))
  public <T> Map<String, T> getDocuments(
      IndexCollection collection, Collection<String> ids, Class<T> type) {
    if (ids.isEmpty()) {
      return Map.of();
    }
    String index = properties.indexName(collection);
    MultiGetResult result =
        execute(
            "mget " + index,
            () ->
                restClient
                    .post()
                    .uri("/{index}/_mget", index)
                    .body(Map.of("ids", List.copyOf(ids)))
                    .retrieve()
                    .body(MultiGetResult.class));
    Map<String, T> documents = new LinkedHashMap<>();
    if (result != null) {
      for (GetResult doc : result.docs()) {
        if (doc.found() && doc.source() != null) {
          documents.put(doc.id(), objectMapper.convertValue(doc.source(), type));
        }
      }
    }
    return documents;
  }

  @Override
  @Retryable(
      retryFor = SearchIndexUnavailableException.class,
      maxAttemptsExpression = "${jobmatch.elasticsearch.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${jobmatch.elasticsearch.retry.delay-ms}",
              multiplierExpression = "${jobmatch.elasticsearch.retry.multiplier}"))
  public List<IndexHit> search(IndexCollection collection, MatchQuery query, int maxResults) {
    String index = properties.indexName(collection);
    Map<String, Object> body =
        Map.of("query", query.toQueryDsl(), "size", maxResults, "_source", false);
    log.debug("Searching {} with {}", index, body);

    SearchResult result =
        execute(
            "search " + index,
            () ->
                restClient
                    .post()
                    .uri("/{index}/_search", index)
                    .body(body)
                    .retrieve()
                    .body(SearchResult.class));
    if (result == null || result.hits() == null) {
      return List.of();
    }
    return result.hits().hits().stream().map(ElasticsearchIndexClient::toIndexHit).toList();
  }

  @Override
  @Retryable(
      retryFor = SearchIndexUnavailableException.class,
      maxAttemptsExpression = "${jobmatch.elasticsearch.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${jobmatch.elasticsearch.retry.delay-ms}",
              multiplierExpression = "${jobmatch.elasticsearch.retry.multiplier}"))
  public void putDocument(IndexCollection collection, String id, Object document) {
    String index = properties.indexName(collection);
    execute(
        "put " + index + "/" + id,
        () ->
            restClient
                .put()
                .uri("/{index}/_doc/{id}?refresh=true", index, id)
                .body(document)
                .retrieve()
                .toBodilessEntity());
  }

  @Override
  public IndexHealth health() {
    try {
      Map<String, Object> body =
          restClient.get().uri("/_cluster/health").retrieve().body(JSON_OBJECT);
      if (body == null) {
        return IndexHealth.unreachable("Empty cluster health response");
      }
      return new IndexHealth(String.valueOf(body.get("status")), true, body);
    } catch (RestClientException e) {
      log.warn("Elasticsearch health check failed: {}", e.getMessage());
      return IndexHealth.unreachable(e.getMessage());
    }
  }

  private <R> R execute(String action, Supplier<R> call) {
    try {
      return call.get();
    } catch (HttpClientErrorException.TooManyRequests e) {
      log.warn("Elasticsearch overloaded during {}: {}", action, e.getStatusCode());
      throw new SearchIndexUnavailableException(
          "Elasticsearch overloaded during " + action + ": " + e.getStatusCode(), e);
    } catch (HttpClientErrorException e) {
      log.warn("Elasticsearch rejected {}: {}", action, e.getStatusCode());
      throw new SearchIndexException(
          "Elasticsearch rejected " + action + ": " + e.getStatusCode(), e);
    } catch (RestClientException e) {
      log.warn("Elasticsearch {} failed: {}", action, e.getMessage());
      throw new SearchIndexUnavailableException(
          "Elasticsearch unavailable during " + action + ": " + e.getMessage(), e);
    }
  }

  private static IndexHit toIndexHit(Hit hit) {
    return new IndexHit(hit.id(), hit.score() == null ? 0.0 : hit.score());
  }
}

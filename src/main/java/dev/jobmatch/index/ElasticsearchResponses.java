package dev.jobmatch.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** JSON shapes of the Elasticsearch responses read by {@link ElasticsearchIndexClient}. */
final class ElasticsearchResponses {

  private ElasticsearchResponses() {}

  /** {@code GET /{index}/_doc/{id}} and each entry of an {@code _mget} response. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record GetResult(
      @JsonProperty("_id") String id,
      boolean found,
      @JsonProperty("_source") @Nullable JsonNode source) {}

  /** {@code POST /{index}/_mget}. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record MultiGetResult(List<GetResult> docs) {
    MultiGetResult {
      docs = docs == null ? List.of() : List.copyOf(docs);
    }
  }

  /** {@code POST /{index}/_search}. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record SearchResult(@Nullable Hits hits) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Hits(List<Hit> hits) {
    Hits {
      hits = hits == null ? List.of() : List.copyOf(hits);
    }
  }

  /** A hit without {@code _source}; the score is null when the search sorts by a field. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record Hit(@JsonProperty("_id") String id, @JsonProperty("_score") @Nullable Double score) {}
}

package dev.jobmatch.api;

import dev.jobmatch.index.IndexHealth;
import java.util.Map;

/**
 * Body returned by {@code GET /health}.
 *
 * @param status {@code healthy} or {@code unhealthy}
 * @param elasticsearch connectivity of the search index
 */
public record HealthResponse(String status, Elasticsearch elasticsearch) {

  static final String HEALTHY = "healthy";
  static final String UNHEALTHY = "unhealthy";

  public record Elasticsearch(boolean connected, Map<String, Object> details) {}

  static HealthResponse from(IndexHealth health) {
    return new HealthResponse(
        health.isHealthy() ? HEALTHY : UNHEALTHY,
        new Elasticsearch(health.reachable(), health.details()));
  }

  boolean isHealthy() {
    return HEALTHY.equals(status);
  }
}

package dev.jobmatch.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Cluster health as reported by the search index.
 *
 * @param status the cluster status ({@code green}, {@code yellow}, {@code red}), or {@code
 *     unavailable} when the cluster could not be reached
 * @param reachable whether the health call itself succeeded
 * @param details the raw health payload, or an {@code error} entry when unreachable
 */
public record IndexHealth(String status, boolean reachable, Map<String, Object> details) {

  static final String UNAVAILABLE = "unavailable";

  public IndexHealth {
    details =
        details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  static IndexHealth unreachable(@Nullable String error) {
    return new IndexHealth(UNAVAILABLE, false, Map.of("error", String.valueOf(error)));
  }

  /** Green and yellow clusters serve reads; yellow only lacks replica copies. */
  public boolean isHealthy() {
    return reachable && ("green".equals(status) || "yellow".equals(status));
  }
}

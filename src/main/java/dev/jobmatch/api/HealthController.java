package dev.jobmatch.api;

import dev.jobmatch.index.SearchIndex;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Reports whether the search index can serve requests. */
@RestController
public class HealthController {

  private final SearchIndex searchIndex;

  public HealthController(SearchIndex searchIndex) {
    this.searchIndex = searchIndex;
  }

  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    HealthResponse response = HealthResponse.from(searchIndex.health());
    HttpStatus status = response.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    return ResponseEntity.status(status).body(response);
  }
}

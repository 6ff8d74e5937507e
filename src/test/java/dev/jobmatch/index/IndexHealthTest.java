package dev.jobmatch.index;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class IndexHealthTest {

  @ParameterizedTest
  @CsvSource({"green, true", "yellow, true", "red, false"})
  void healthFollowsClusterStatus(String status, boolean healthy) {
    IndexHealth health = new IndexHealth(status, true, Map.of("status", status));

    assertThat(health.isHealthy()).isEqualTo(healthy);
  }

  @Test
  void unreachableClusterIsUnhealthyAndCarriesError() {
    IndexHealth health = IndexHealth.unreachable("Connection refused");

    assertThat(health.isHealthy()).isFalse();
    assertThat(health.status()).isEqualTo(IndexHealth.UNAVAILABLE);
    assertThat(health.details()).containsEntry("error", "Connection refused");
  }

  @Test
  void nullDetailsBecomeEmpty() {
    assertThat(new IndexHealth("green", true, null).details()).isEmpty();
  }
}

package dev.jobmatch.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SeniorityLevelTest {

  @ParameterizedTest
  @CsvSource({
    "none, NONE",
    "junior, JUNIOR",
    "MidLevel, MIDLEVEL",
    "' senior ', SENIOR",
    "LEAD, LEAD",
    "principal, PRINCIPAL"
  })
  void parsesIgnoringCaseAndWhitespace(String raw, SeniorityLevel expected) {
    assertThat(SeniorityLevel.fromValue(raw)).isEqualTo(expected);
  }

  @Test
  void unknownLevelListsValidOnes() {
    assertThatThrownBy(() -> SeniorityLevel.fromValue("expert"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Invalid seniority level: expert")
        .hasMessageContaining("none, junior, midlevel, senior, lead, principal");
  }

  @Test
  void nullIsRejected() {
    assertThatThrownBy(() -> SeniorityLevel.fromValue(null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void wireValueIsLowercase() {
    assertThat(SeniorityLevel.MIDLEVEL.value()).isEqualTo("midlevel");
  }
}

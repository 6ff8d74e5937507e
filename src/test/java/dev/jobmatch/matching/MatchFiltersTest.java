package dev.jobmatch.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.jobmatch.profile.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class MatchFiltersTest {

  @Test
  void allFlagsFalseIsRejected() {
    assertThatThrownBy(() -> MatchFilters.fromFlags(false, false, false))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("At least one filter must be enabled");
  }

  @Test
  void emptyCollectionIsRejected() {
    assertThatThrownBy(() -> MatchFilters.of(List.of())).isInstanceOf(ValidationException.class);
  }

  @Test
  void flagsMapToFilters() {
    MatchFilters filters = MatchFilters.fromFlags(true, false, true);

    assertThat(filters.isEnabled(MatchFilter.SKILL)).isTrue();
    assertThat(filters.isEnabled(MatchFilter.SENIORITY)).isFalse();
    assertThat(filters.isEnabled(MatchFilter.SALARY)).isTrue();
  }

  @Test
  void enabledIsInDeclarationOrderAndUnmodifiable() {
    MatchFilters filters = MatchFilters.of(MatchFilter.SALARY, MatchFilter.SKILL);

    assertThat(filters.enabled()).containsExactly(MatchFilter.SKILL, MatchFilter.SALARY);
    assertThatThrownBy(() -> filters.enabled().add(MatchFilter.SENIORITY))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void equalSetsAreEqual() {
    assertThat(MatchFilters.all())
        .isEqualTo(MatchFilters.fromFlags(true, true, true))
        .hasSameHashCodeAs(MatchFilters.of(List.of(MatchFilter.values())));
  }
}

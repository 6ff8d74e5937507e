package dev.jobmatch.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SkillTest {

  @Test
  void equalityIgnoresCaseAndSurroundingWhitespace() {
    Skill a = Skill.of("Python");
    Skill b = Skill.of("python");
    Skill c = Skill.of(" Python ");

    assertThat(a).isEqualTo(b).isEqualTo(c);
    assertThat(a.hashCode()).isEqualTo(b.hashCode()).isEqualTo(c.hashCode());
    assertThat(Set.of(a, Skill.of("AWS"))).contains(b);
  }

  @Test
  void keepsOriginalCasingForDisplay() {
    assertThat(Skill.of("  TypeScript ").name()).isEqualTo("TypeScript");
    assertThat(Skill.of("AWS")).hasToString("AWS");
  }

  @ParameterizedTest
  @ValueSource(strings = {"", " ", "\t\n"})
  void blankNameIsRejected(String name) {
    assertThatThrownBy(() -> Skill.of(name))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Skill name cannot be empty");
  }

  @Test
  void nullNameIsRejected() {
    assertThatThrownBy(() -> Skill.of(null)).isInstanceOf(ValidationException.class);
  }

  @Test
  void differentNamesAreNotEqual() {
    assertThat(Skill.of("Java")).isNotEqualTo(Skill.of("JavaScript"));
  }
}

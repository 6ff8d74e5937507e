package dev.jobmatch.profile;

import java.util.Locale;

/**
 * A single professional competency, e.g. {@code "Python"} or {@code "AWS"}.
 *
 * <p>The name is trimmed at construction and keeps its original casing for display. Equality and
 * hashing ignore case, so {@code Skill.of("python")} and {@code Skill.of(" Python ")} are the same
 * skill in every set operation.
 */
public final class Skill {

  private final String name;
  private final String key;

  private Skill(String name) {
    this.name = name;
    this.key = name.toLowerCase(Locale.ROOT);
  }

  /**
   * Creates a skill from a raw name.
   *
   * @param name the skill name; surrounding whitespace is removed
   * @return the skill
   * @throws ValidationException if the name is null, empty or whitespace only
   */
  public static Skill of(String name) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Skill name cannot be empty");
    }
    return new Skill(name.strip());
  }

  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Skill other)) {
      return false;
    }
    return key.equals(other.key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}

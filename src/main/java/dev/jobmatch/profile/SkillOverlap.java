package dev.jobmatch.profile;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Pure static utility computing how much of a required skill set another party covers.
 *
 * <p>Set semantics follow {@link Skill#equals}: names are compared ignoring case.
 */
public final class SkillOverlap {

  private SkillOverlap() {}

  /**
   * Ratio of required skills present in the offered pool.
   *
   * <pre>{@code
   * score = |required ∩ offered| / |required|
   * }</pre>
   *
   * @param required the skills the score is measured against (the denominator)
   * @param offered the skills the other party holds
   * @return a value in [0, 1]; 0 when either side is empty
   */
  public static double score(Collection<Skill> required, Collection<Skill> offered) {
    if (required.isEmpty() || offered.isEmpty()) {
      return 0.0;
    }
    Set<Skill> requiredSet = new HashSet<>(required);
    Set<Skill> offeredSet = new HashSet<>(offered);
    long overlap = requiredSet.stream().filter(offeredSet::contains).count();
    return (double) overlap / requiredSet.size();
  }
}

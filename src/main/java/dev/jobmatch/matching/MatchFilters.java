package dev.jobmatch.matching;

import dev.jobmatch.profile.ValidationException;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The non-empty set of filters enabled for one match request.
 *
 * <p>An empty set is rejected at construction: a match with no criteria is a caller error, not a
 * score of zero.
 */
public final class MatchFilters {

  private final Set<MatchFilter> enabled;

  private MatchFilters(EnumSet<MatchFilter> enabled) {
    if (enabled.isEmpty()) {
      throw new ValidationException("At least one filter must be enabled");
    }
    this.enabled = Collections.unmodifiableSet(enabled);
  }

  public static MatchFilters of(MatchFilter first, MatchFilter... rest) {
    return new MatchFilters(EnumSet.of(first, rest));
  }

  public static MatchFilters of(Collection<MatchFilter> filters) {
    EnumSet<MatchFilter> set = EnumSet.noneOf(MatchFilter.class);
    set.addAll(filters);
    return new MatchFilters(set);
  }

  /** Every filter switched on. */
  public static MatchFilters all() {
    return new MatchFilters(EnumSet.allOf(MatchFilter.class));
  }

  /**
   * Builds the filter set from the three boolean request flags.
   *
   * @throws ValidationException if all three flags are false
   */
  public static MatchFilters fromFlags(boolean skill, boolean seniority, boolean salary) {
    EnumSet<MatchFilter> set = EnumSet.noneOf(MatchFilter.class);
    if (skill) {
      set.add(MatchFilter.SKILL);
    }
    if (seniority) {
      set.add(MatchFilter.SENIORITY);
    }
    if (salary) {
      set.add(MatchFilter.SALARY);
    }
    return new MatchFilters(set);
  }

  public boolean isEnabled(MatchFilter filter) {
    return enabled.contains(filter);
  }

  /** Enabled filters in declaration order. */
  public Set<MatchFilter> enabled() {
    return enabled;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof MatchFilters other && enabled.equals(other.enabled);
  }

  @Override
  public int hashCode() {
    return enabled.hashCode();
  }

  @Override
  public String toString() {
    return "MatchFilters" + enabled;
  }
}

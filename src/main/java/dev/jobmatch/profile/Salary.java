package dev.jobmatch.profile;

/**
 * A yearly salary amount in whole currency units. Used both for a job's maximum offer and for a
 * candidate's expectation.
 *
 * @param value the amount, never negative
 */
public record Salary(int value) {

  public Salary {
    if (value < 0) {
      throw new ValidationException("Salary cannot be negative, got: " + value);
    }
  }

  /** Returns {@code true} if this amount covers (is at least) {@code other}. */
  public boolean covers(Salary other) {
    return value >= other.value;
  }

  @Override
  public String toString() {
    return Integer.toString(value);
  }
}

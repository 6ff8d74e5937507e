package dev.jobmatch.matching;

/**
 * A matching criterion a caller can switch on. Each filter contributes one component to the
 * weighted score and one clause to the index query.
 */
public enum MatchFilter {
  SKILL("top_skill_match", 2.0),
  SENIORITY("seniority_match", 1.5),
  SALARY("salary_match", 1.0);

  private final String requestKey;
  private final double defaultWeight;

  MatchFilter(String requestKey, double defaultWeight) {
    this.requestKey = requestKey;
    this.defaultWeight = defaultWeight;
  }

  /** Name of the boolean flag enabling this filter in a match request. */
  public String requestKey() {
    return requestKey;
  }

  public double defaultWeight() {
    return defaultWeight;
  }
}

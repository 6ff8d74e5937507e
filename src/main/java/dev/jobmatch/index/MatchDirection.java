package dev.jobmatch.index;

import dev.jobmatch.index.RangeClause.Bound;

/**
 * Which side of a match is the source and which collection is searched. Both directions share the
 * clause-building rules of {@link MatchQueryBuilder}; only the field names and the salary
 * comparison are swapped.
 */
enum MatchDirection {
  /** A job looking for candidates: expectation at most the job's budget. */
  JOB_TO_CANDIDATES(
      IndexCollection.CANDIDATES,
      JobDocument.MAX_SALARY,
      JobDocument.SENIORITIES,
      CandidateDocument.SALARY_EXPECTATION,
      Bound.LTE,
      CandidateDocument.SENIORITY,
      CandidateDocument.TOP_SKILLS),
  /** A candidate looking for jobs: budget at least the candidate's expectation. */
  CANDIDATE_TO_JOBS(
      IndexCollection.JOBS,
      CandidateDocument.SALARY_EXPECTATION,
      CandidateDocument.SENIORITY,
      JobDocument.MAX_SALARY,
      Bound.GTE,
      JobDocument.SENIORITIES,
      JobDocument.TOP_SKILLS);

  private final IndexCollection target;
  private final String sourceSalaryField;
  private final String sourceSeniorityField;
  private final String targetSalaryField;
  private final Bound salaryBound;
  private final String targetSeniorityField;
  private final String targetSkillField;

  MatchDirection(
      IndexCollection target,
      String sourceSalaryField,
      String sourceSeniorityField,
      String targetSalaryField,
      Bound salaryBound,
      String targetSeniorityField,
      String targetSkillField) {
    this.target = target;
    this.sourceSalaryField = sourceSalaryField;
    this.sourceSeniorityField = sourceSeniorityField;
    this.targetSalaryField = targetSalaryField;
    this.salaryBound = salaryBound;
    this.targetSeniorityField = targetSeniorityField;
    this.targetSkillField = targetSkillField;
  }

  IndexCollection target() {
    return target;
  }

  String sourceSalaryField() {
    return sourceSalaryField;
  }

  String sourceSeniorityField() {
    return sourceSeniorityField;
  }

  String targetSalaryField() {
    return targetSalaryField;
  }

  Bound salaryBound() {
    return salaryBound;
  }

  String targetSeniorityField() {
    return targetSeniorityField;
  }

  String targetSkillField() {
    return targetSkillField;
  }
}

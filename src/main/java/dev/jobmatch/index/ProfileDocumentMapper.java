package dev.jobmatch.index;

import dev.jobmatch.profile.Candidate;
import dev.jobmatch.profile.Job;
import dev.jobmatch.profile.Salary;
import dev.jobmatch.profile.SeniorityLevel;
import dev.jobmatch.profile.Skill;
import dev.jobmatch.profile.ValidationException;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between index documents and domain entities.
 *
 * <p>Skills and salaries are validated strictly: a blank skill or negative salary fails the whole
 * conversion with {@link CorruptDocumentException}. Seniority strings are decoded leniently: an
 * unrecognised entry is dropped and logged, so one bad value does not make the document unreadable.
 */
public final class ProfileDocumentMapper {

  private static final Logger log = LoggerFactory.getLogger(ProfileDocumentMapper.class);

  private ProfileDocumentMapper() {}

  /**
   * Converts a stored job document.
   *
   * @throws CorruptDocumentException if the stored values fail validation
   */
  public static Job toJob(String id, JobDocument document) {
    try {
      List<SeniorityLevel> seniorities = new ArrayList<>();
      for (String value : document.seniorities()) {
        SeniorityLevel level = parseSeniority(id, value);
        if (level != null) {
          seniorities.add(level);
        }
      }
      return new Job(
          id,
          toSkills(document.topSkills()),
          toSkills(document.otherSkills()),
          seniorities,
          toSalary(document.maxSalary()));
    } catch (ValidationException e) {
      log.warn("Unreadable job document {}: {}", id, e.getMessage());
      throw new CorruptDocumentException(id, e);
    }
  }

  /** Converts a stored candidate document; fails like {@link #toJob}. */
  public static Candidate toCandidate(String id, CandidateDocument document) {
    try {
      SeniorityLevel seniority =
          document.seniority() == null ? null : parseSeniority(id, document.seniority());
      return new Candidate(
          id,
          toSkills(document.topSkills()),
          toSkills(document.otherSkills()),
          seniority,
          toSalary(document.salaryExpectation()));
    } catch (ValidationException e) {
      log.warn("Unreadable candidate document {}: {}", id, e.getMessage());
      throw new CorruptDocumentException(id, e);
    }
  }

  public static JobDocument toDocument(Job job) {
    return new JobDocument(
        names(job.topSkills()),
        names(job.otherSkills()),
        job.seniorities().stream().map(SeniorityLevel::value).toList(),
        job.maxSalary() == null ? null : job.maxSalary().value());
  }

  public static CandidateDocument toDocument(Candidate candidate) {
    return new CandidateDocument(
        names(candidate.topSkills()),
        names(candidate.otherSkills()),
        candidate.seniority() == null ? null : candidate.seniority().value(),
        candidate.salaryExpectation() == null ? null : candidate.salaryExpectation().value());
  }

  private static @Nullable SeniorityLevel parseSeniority(String id, String value) {
    try {
      return SeniorityLevel.fromValue(value);
    } catch (ValidationException e) {
      log.debug("Skipping invalid seniority '{}' on document {}", value, id);
      return null;
    }
  }

  private static List<Skill> toSkills(List<String> names) {
    return names.stream().map(Skill::of).toList();
  }

  private static List<String> names(List<Skill> skills) {
    return skills.stream().map(Skill::name).toList();
  }

  private static @Nullable Salary toSalary(@Nullable Integer value) {
    return value == null ? null : new Salary(value);
  }
}

package dev.jobmatch.index;

/** The two logical document collections of the search index. */
public enum IndexCollection {
  JOBS,
  CANDIDATES
}

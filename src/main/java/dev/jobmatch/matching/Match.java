package dev.jobmatch.matching;

/**
 * A counterpart document found for a match request.
 *
 * @param id id of the matched job or candidate
 * @param score the index relevance score, or the weighted score in [0, 1], depending on the
 *     {@link ScoringMode} of the request
 */
public record Match(String id, double score) {}

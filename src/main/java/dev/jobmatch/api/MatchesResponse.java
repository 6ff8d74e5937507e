package dev.jobmatch.api;

import java.util.List;

/** Body returned by {@code POST /matches}. */
public record MatchesResponse(List<MatchView> matches) {}

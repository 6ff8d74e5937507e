package dev.jobmatch.api;

import dev.jobmatch.matching.Match;
import dev.jobmatch.matching.MatchingService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Finds candidates for a job or jobs for a candidate. */
@RestController
public class MatchController {

  private final MatchingService matchingService;

  public MatchController(MatchingService matchingService) {
    this.matchingService = matchingService;
  }

  @PostMapping("/matches")
  public MatchesResponse findMatches(@Valid @RequestBody MatchRequest request) {
    List<Match> matches =
        matchingService.findMatches(
            request.id(),
            request.docType(),
            request.filters().toMatchFilters(),
            request.scoringOrDefault());
    return new MatchesResponse(matches.stream().map(MatchView::from).toList());
  }
}

package dev.jobmatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobmatch.matching.ScoringMode;
import dev.jobmatch.profile.DocumentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /matches}.
 *
 * @param id id of the source job or candidate
 * @param docType whether {@code id} names a job or a candidate
 * @param filters the enabled filters
 * @param scoring which score to report; {@code index_relevance} when omitted
 */
public record MatchRequest(
    @NotBlank String id,
    @NotNull @JsonProperty("doc_type") DocumentType docType,
    @NotNull @Valid MatchFiltersRequest filters,
    @Nullable ScoringMode scoring) {

  ScoringMode scoringOrDefault() {
    return scoring == null ? ScoringMode.INDEX_RELEVANCE : scoring;
  }
}

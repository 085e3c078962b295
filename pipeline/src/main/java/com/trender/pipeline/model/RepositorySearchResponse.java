package com.trender.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Envelope of GET /search/repositories.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositorySearchResponse(
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("items") List<RepositoryCandidate> items
) {

    public RepositorySearchResponse {
        items = items == null ? List.of() : items;
    }
}

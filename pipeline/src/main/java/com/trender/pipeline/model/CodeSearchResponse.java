package com.trender.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Envelope of GET /search/code. Each hit embeds a reduced repository object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeSearchResponse(
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("items") List<Item> items
) {

    public CodeSearchResponse {
        items = items == null ? List.of() : items;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            @JsonProperty("name") String name,
            @JsonProperty("path") String path,
            @JsonProperty("repository") RepositoryCandidate repository
    ) {}
}

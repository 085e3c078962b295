package com.trender.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object for GET /repos/{owner}/{repo}/contents/{path}.
 * A file response carries base64 {@code content}; a directory listing is an array of
 * entries without it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentEntry(
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("type") String type,
        @JsonProperty("content") String content,
        @JsonProperty("encoding") String encoding
) {

    public boolean isFile() {
        return "file".equals(type);
    }
}

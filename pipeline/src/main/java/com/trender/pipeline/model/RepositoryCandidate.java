package com.trender.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Data transfer object representing a repository as returned by GitHub search
 * and repository endpoints.
 * Maps from: /search/repositories, /repos/{owner}/{repo}, /orgs/{org}/repos, and the
 * {@code repository} object embedded in /search/code results.
 *
 * <p>Counts and timestamps are {@code null} when GitHub omitted them (code search
 * results carry only the identity fields).</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositoryCandidate(
        @JsonProperty("full_name") String fullName,
        @JsonProperty("html_url") String htmlUrl,
        @JsonProperty("language") String language,
        @JsonProperty("description") String description,
        @JsonProperty("stargazers_count") Long stargazersCount,
        @JsonProperty("forks_count") Long forksCount,
        @JsonProperty("open_issues_count") Long openIssuesCount,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("topics") List<String> topics,
        @JsonProperty("owner") Owner owner
) {

    public RepositoryCandidate {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Owner(
            @JsonProperty("login") String login
    ) {}

    /**
     * True when the full name has the {@code owner/name} shape with both parts non-blank.
     */
    public boolean isWellFormed() {
        if (fullName == null) {
            return false;
        }
        int slash = fullName.indexOf('/');
        return slash > 0
                && fullName.indexOf('/', slash + 1) < 0
                && !fullName.substring(0, slash).isBlank()
                && !fullName.substring(slash + 1).isBlank();
    }

    public String ownerLogin() {
        return isWellFormed() ? fullName.substring(0, fullName.indexOf('/')) : null;
    }

    public String repoName() {
        return isWellFormed() ? fullName.substring(fullName.indexOf('/') + 1) : null;
    }

    public long starCount() {
        return stargazersCount != null ? stargazersCount : 0L;
    }

    /**
     * Whether the detail fields that code search omits are still missing.
     */
    public boolean needsBackfill() {
        return stargazersCount == null || createdAt == null || updatedAt == null;
    }

    /**
     * Copy with every field that is missing here taken from {@code details}.
     */
    public RepositoryCandidate backfilledFrom(RepositoryCandidate details) {
        return new RepositoryCandidate(
                fullName,
                htmlUrl != null ? htmlUrl : details.htmlUrl(),
                language != null ? language : details.language(),
                description != null ? description : details.description(),
                stargazersCount != null ? stargazersCount : details.stargazersCount(),
                forksCount != null ? forksCount : details.forksCount(),
                openIssuesCount != null ? openIssuesCount : details.openIssuesCount(),
                createdAt != null ? createdAt : details.createdAt(),
                updatedAt != null ? updatedAt : details.updatedAt(),
                topics.isEmpty() ? details.topics() : topics,
                owner != null ? owner : details.owner());
    }
}

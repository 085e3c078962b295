package com.trender.pipeline.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trender.pipeline.model.ActivityMetrics;
import com.trender.pipeline.model.CodeSearchResponse;
import com.trender.pipeline.model.ContentEntry;
import com.trender.pipeline.model.RepositoryCandidate;
import com.trender.pipeline.model.RepositorySearchResponse;
import com.trender.pipeline.retry.RetryPolicy;
import com.trender.pipeline.retry.Sleeper;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub REST API client with rate-limit gating, exponential backoff retry and
 * status-driven degradation.
 *
 * <p>Expected API failures never escape: 404 means "absent", 403/422 are logged and
 * treated as absent, and transient failures (I/O errors, timeouts, 429, 5xx) are
 * retried up to {@value #MAX_ATTEMPTS} times before degrading to an empty result.
 * Only malformed arguments ({@link IllegalArgumentException}) and interruption
 * propagate.</p>
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper} are
 * thread-safe and the only mutable state lives in the shared {@link RateLimitTracker}.</p>
 */
public class GitHubApiClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubApiClient.class);

    static final String DEFAULT_BASE_URL = "https://api.github.com";
    static final String JSON_MEDIA_TYPE = "application/vnd.github+json";
    static final String RAW_MEDIA_TYPE = "application/vnd.github.raw";
    static final int README_MAX_CHARS = 5_000;
    static final int MAX_ATTEMPTS = 3;
    static final long INITIAL_BACKOFF_MS = 1_000;
    static final long MAX_BACKOFF_MS = 60_000;
    private static final int PER_PAGE = 100;
    private static final int MAX_PAGES = 10;

    static final Pattern LINK_NEXT_PATTERN =
            Pattern.compile("<([^>]+)>;\\s*rel=\"next\"");
    private static final Pattern RATE_LIMIT_MESSAGE =
            Pattern.compile("rate limit", Pattern.CASE_INSENSITIVE);

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String token;
    private final HttpUrl baseUrl;
    private final RateLimitTracker rateLimits;
    private final RetryPolicy retryPolicy;

    public GitHubApiClient(String token, OkHttpClient httpClient) {
        this(token, httpClient, DEFAULT_BASE_URL, new RateLimitTracker(), defaultRetryPolicy(Sleeper.SYSTEM));
    }

    GitHubApiClient(String token, OkHttpClient httpClient, String baseUrl,
                    RateLimitTracker rateLimits, RetryPolicy retryPolicy) {
        this.token = token;
        this.httpClient = httpClient;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.rateLimits = rateLimits;
        this.retryPolicy = retryPolicy;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * HTTP client with 30s timeouts and a bounded idle-connection pool.
     */
    public static OkHttpClient defaultHttpClient(int maxIdleConnections, long keepAliveMinutes) {
        return new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(maxIdleConnections, keepAliveMinutes, TimeUnit.MINUTES))
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Retries I/O failures (network errors, timeouts, 429 and 5xx): 1s, 2s.
     */
    public static RetryPolicy defaultRetryPolicy(Sleeper sleeper) {
        return new RetryPolicy(MAX_ATTEMPTS, INITIAL_BACKOFF_MS, MAX_BACKOFF_MS,
                e -> e instanceof IOException, sleeper);
    }

    public OkHttpClient httpClient() {
        return httpClient;
    }

    public RateLimitTracker rateLimits() {
        return rateLimits;
    }

    // -------------------------------------------------------------------------
    // Search endpoints
    // -------------------------------------------------------------------------

    /**
     * Searches repositories by language.
     * Endpoint: GET /search/repositories?q=language:{language} pushed:>={updatedSince} created:>={createdSince}
     *
     * @param language     language qualifier, required
     * @param sort         {@code stars}, {@code forks} or {@code updated}; defaults to {@code stars}
     * @param updatedSince only repositories pushed on or after this date, may be null
     * @param createdSince only repositories created on or after this date, may be null
     * @return the first page of results, or an empty list on any API failure
     */
    public List<RepositoryCandidate> searchRepositories(String language, String sort,
                                                        LocalDate updatedSince, LocalDate createdSince)
            throws InterruptedException {
        requireText(language, "language");

        StringBuilder query = new StringBuilder("language:").append(language);
        if (updatedSince != null) {
            query.append(" pushed:>=").append(updatedSince);
        }
        if (createdSince != null) {
            query.append(" created:>=").append(createdSince);
        }

        HttpUrl url = endpoint("search", "repositories").newBuilder()
                .addQueryParameter("q", query.toString())
                .addQueryParameter("sort", sort != null ? sort : "stars")
                .addQueryParameter("order", "desc")
                .addQueryParameter("per_page", String.valueOf(PER_PAGE))
                .build();

        return getJson(url, RepositorySearchResponse.class)
                .map(RepositorySearchResponse::items)
                .orElse(List.of());
    }

    /**
     * Searches repositories tagged with a topic.
     * Endpoint: GET /search/repositories?q=topic:{topic}
     */
    public List<RepositoryCandidate> searchByTopic(String topic) throws InterruptedException {
        requireText(topic, "topic");
        HttpUrl url = endpoint("search", "repositories").newBuilder()
                .addQueryParameter("q", "topic:" + topic)
                .addQueryParameter("sort", "stars")
                .addQueryParameter("per_page", String.valueOf(PER_PAGE))
                .build();

        return getJson(url, RepositorySearchResponse.class)
                .map(RepositorySearchResponse::items)
                .orElse(List.of());
    }

    /**
     * Finds repositories containing a file with the given name.
     * Endpoint: GET /search/code?q=filename:{filename}
     *
     * <p>Code search results carry only identity fields, so repositories missing
     * stars or timestamps are backfilled from GET /repos/{owner}/{repo}. The search API
     * cannot filter this query by creation date, so {@code createdSince} is applied
     * here. Results are deduplicated by full name and sorted by stars, descending.</p>
     *
     * @param filename     marker file name, e.g. {@code render.yaml}
     * @param limit        maximum number of repositories returned, must be positive
     * @param createdSince keep only repositories created on or after this date, may be null
     */
    public List<RepositoryCandidate> searchByMarkerFile(String filename, int limit, LocalDate createdSince)
            throws InterruptedException {
        requireText(filename, "filename");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }

        String nextUrl = endpoint("search", "code").newBuilder()
                .addQueryParameter("q", "filename:" + filename)
                .addQueryParameter("per_page", String.valueOf(PER_PAGE))
                .build()
                .toString();

        Map<String, RepositoryCandidate> unique = new LinkedHashMap<>();
        int pages = 0;
        while (nextUrl != null && pages < MAX_PAGES) {
            Optional<PageResult> page = execute(buildRequest(nextUrl, JSON_MEDIA_TYPE));
            if (page.isEmpty()) {
                break;
            }
            pages++;

            Optional<CodeSearchResponse> parsed = parse(page.get().body(), CodeSearchResponse.class, nextUrl);
            if (parsed.isEmpty()) {
                break;
            }
            for (CodeSearchResponse.Item item : parsed.get().items()) {
                RepositoryCandidate repo = item.repository();
                if (repo != null && repo.isWellFormed()) {
                    unique.putIfAbsent(repo.fullName(), repo);
                }
            }
            // Without a date filter every unique hit is kept, so stop once we have enough.
            if (createdSince == null && unique.size() >= limit) {
                break;
            }
            nextUrl = page.get().nextUrl();
        }

        List<RepositoryCandidate> results = new ArrayList<>();
        for (RepositoryCandidate candidate : unique.values()) {
            RepositoryCandidate complete = candidate;
            if (candidate.needsBackfill()) {
                Optional<RepositoryCandidate> details = getRepository(candidate.ownerLogin(), candidate.repoName());
                if (details.isPresent()) {
                    complete = candidate.backfilledFrom(details.get());
                }
            }
            if (createdSince != null && !createdOnOrAfter(complete, createdSince)) {
                continue;
            }
            results.add(complete);
        }

        results.sort(Comparator.comparingLong(RepositoryCandidate::starCount).reversed());
        logger.info("Marker file search for {} found {} unique repositories, {} after filtering",
                filename, unique.size(), results.size());
        return results.size() > limit ? List.copyOf(results.subList(0, limit)) : results;
    }

    // -------------------------------------------------------------------------
    // Repository endpoints
    // -------------------------------------------------------------------------

    /**
     * Fetches full repository metadata.
     * Endpoint: GET /repos/{owner}/{repo}
     */
    public Optional<RepositoryCandidate> getRepository(String owner, String repo) throws InterruptedException {
        requireText(owner, "owner");
        requireText(repo, "repo");
        return getJson(endpoint("repos", owner, repo), RepositoryCandidate.class);
    }

    /**
     * Fetches all repositories of an organization.
     * Endpoint: GET /orgs/{org}/repos?per_page=100
     */
    public List<RepositoryCandidate> getOrganizationRepositories(String org) throws InterruptedException {
        requireText(org, "org");
        HttpUrl url = endpoint("orgs", org, "repos").newBuilder()
                .addQueryParameter("per_page", String.valueOf(PER_PAGE))
                .build();
        return fetchAllPages(url.toString(), new TypeReference<>() {});
    }

    /**
     * Fetches and decodes a file.
     * Endpoint: GET /repos/{owner}/{repo}/contents/{path}
     *
     * @return the decoded text, or empty when the file does not exist (404) or cannot be read
     */
    public Optional<String> getFileContents(String owner, String repo, String path) throws InterruptedException {
        requireText(owner, "owner");
        requireText(repo, "repo");
        requireText(path, "path");
        return getJson(contentsUrl(owner, repo, path), ContentEntry.class)
                .flatMap(entry -> decodeContent(entry, owner + "/" + repo + "/" + path));
    }

    /**
     * Fetches the README, truncated to {@value #README_MAX_CHARS} characters.
     *
     * <p>Lists the repository root and matches file names case-insensitively, so
     * {@code README.md}, {@code readme.rst} and {@code Readme} are all found. The chosen
     * file is downloaded as plain text.</p>
     */
    public Optional<String> fetchReadme(String owner, String repo) throws InterruptedException {
        requireText(owner, "owner");
        requireText(repo, "repo");

        Optional<String> readmePath = getJson(endpoint("repos", owner, repo, "contents"),
                new TypeReference<List<ContentEntry>>() {})
                .flatMap(GitHubApiClient::findReadme);
        if (readmePath.isEmpty()) {
            logger.debug("No README found in {}/{}", owner, repo);
            return Optional.empty();
        }

        return execute(buildRequest(contentsUrl(owner, repo, readmePath.get()).toString(), RAW_MEDIA_TYPE))
                .map(PageResult::body)
                .filter(body -> !body.isBlank())
                .map(GitHubApiClient::truncateReadme);
    }

    /**
     * Counts commits and closed issues since {@code since}, plus contributors.
     * Each count is capped at one page (100); a failed call counts as zero.
     * Endpoints: GET /repos/{owner}/{repo}/commits, /issues?state=closed, /contributors
     */
    public ActivityMetrics getActivityMetrics(String owner, String repo, Instant since)
            throws InterruptedException {
        requireText(owner, "owner");
        requireText(repo, "repo");
        String sinceParam = since.toString();

        int commits = countItems(endpoint("repos", owner, repo, "commits").newBuilder()
                .addQueryParameter("since", sinceParam)
                .addQueryParameter("per_page", String.valueOf(PER_PAGE))
                .build());
        int issuesClosed = countItems(endpoint("repos", owner, repo, "issues").newBuilder()
                .addQueryParameter("state", "closed")
                .addQueryParameter("since", sinceParam)
                .addQueryParameter("per_page", String.valueOf(PER_PAGE))
                .build());
        int contributors = countItems(endpoint("repos", owner, repo, "contributors").newBuilder()
                .addQueryParameter("per_page", String.valueOf(PER_PAGE))
                .build());

        return new ActivityMetrics(commits, issuesClosed, contributors);
    }

    /**
     * Checks the token against GET /rate_limit, which does not consume quota.
     *
     * @return false when GitHub rejects the token or stays unreachable after retries
     */
    public boolean verifyCredentials() throws InterruptedException {
        return execute(buildRequest(endpoint("rate_limit").toString(), JSON_MEDIA_TYPE)).isPresent();
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution with retries, rate-limit gating and status branching
    // -------------------------------------------------------------------------

    /**
     * Fetches pages by following the Link header, up to {@value #MAX_PAGES} pages.
     */
    <T> List<T> fetchAllPages(String initialUrl, TypeReference<List<T>> typeRef) throws InterruptedException {
        List<T> allResults = new ArrayList<>();
        String url = initialUrl;
        int pages = 0;

        while (url != null && pages < MAX_PAGES) {
            Optional<PageResult> result = execute(buildRequest(url, JSON_MEDIA_TYPE));
            if (result.isEmpty()) {
                break;
            }
            pages++;

            Optional<List<T>> page = parse(result.get().body(), typeRef, url);
            if (page.isEmpty()) {
                break;
            }
            allResults.addAll(page.get());
            logger.debug("Fetched page with {} items from {}", page.get().size(), url);

            url = result.get().nextUrl();
        }

        return allResults;
    }

    /**
     * Builds a GET request with bearer authentication and the API version headers.
     */
    Request buildRequest(String url, String accept) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + token)
                .header("Accept", accept)
                .header("X-GitHub-Api-Version", "2022-11-28")
                .build();
    }

    /**
     * Executes a request under the retry policy.
     *
     * @return the successful page, or empty for 404/403/422/other client errors and
     *         for transient failures that outlived every retry
     */
    Optional<PageResult> execute(Request request) throws InterruptedException {
        String url = request.url().toString();
        try {
            return Optional.ofNullable(retryPolicy.execute("GET " + url, () -> executeOnce(request)));
        } catch (InterruptedException e) {
            throw e;
        } catch (IOException e) {
            logger.warn("Giving up on {}: {}", url, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected failure calling " + url, e);
        }
    }

    /**
     * A single attempt. Returns {@code null} for statuses that mean "absent";
     * throws {@link TransientApiException} for statuses worth retrying.
     */
    PageResult executeOnce(Request request) throws IOException, InterruptedException {
        rateLimits.beforeRequest();

        String url = request.url().toString();
        try (Response response = httpClient.newCall(request).execute()) {
            int statusCode = response.code();
            rateLimits.afterResponse(response.headers());
            logResponse(url, statusCode, response);

            ResponseBody body = response.body();
            String bodyString = body != null ? body.string() : "";

            if (statusCode >= 200 && statusCode < 300) {
                return new PageResult(bodyString, parseNextPageUrl(response.header("Link")));
            }
            if (statusCode == 429 || statusCode >= 500) {
                throw new TransientApiException(statusCode, url, getRetryWaitMs(response));
            }

            switch (statusCode) {
                case 404 -> logger.debug("Not found: {}", url);
                case 401 -> logger.warn("GitHub rejected the credentials (401) for {}", url);
                case 403 -> {
                    if (isRateLimited(response, bodyString)) {
                        logger.warn("Rate limit exceeded (403) for {}", url);
                    } else {
                        logger.warn("Access denied (403), token may lack the required scope: {}", url);
                    }
                }
                case 422 -> logger.warn("GitHub rejected the query (422) for {}: {}", url, abbreviate(bodyString));
                default -> logger.warn("Unexpected GitHub status {} for {}", statusCode, url);
            }
            return null;
        }
    }

    /**
     * A 403 is a rate-limit rejection when the quota is spent or the message says so;
     * otherwise it is a permissions problem.
     */
    static boolean isRateLimited(Response response, String body) {
        if ("0".equals(response.header("X-RateLimit-Remaining"))) {
            return true;
        }
        return body != null && RATE_LIMIT_MESSAGE.matcher(body).find();
    }

    /**
     * Wait suggested by a {@code Retry-After} header in milliseconds, or 0 to use backoff.
     */
    static long getRetryWaitMs(Response response) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                return Long.parseLong(retryAfter.trim()) * 1_000;
            } catch (NumberFormatException ignored) {
                // HTTP-date form is not used by GitHub; fall back to backoff
            }
        }
        return 0;
    }

    // -------------------------------------------------------------------------
    // Parsing helpers
    // -------------------------------------------------------------------------

    private <T> Optional<T> getJson(HttpUrl url, Class<T> type) throws InterruptedException {
        String target = url.toString();
        return execute(buildRequest(target, JSON_MEDIA_TYPE))
                .flatMap(page -> parse(page.body(), type, target));
    }

    private <T> Optional<T> getJson(HttpUrl url, TypeReference<T> typeRef) throws InterruptedException {
        String target = url.toString();
        return execute(buildRequest(target, JSON_MEDIA_TYPE))
                .flatMap(page -> parse(page.body(), typeRef, target));
    }

    private <T> Optional<T> parse(String body, Class<T> type, String url) {
        try {
            return Optional.ofNullable(objectMapper.readValue(body, type));
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable response from {}: {}", url, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> parse(String body, TypeReference<T> typeRef, String url) {
        try {
            return Optional.ofNullable(objectMapper.readValue(body, typeRef));
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable response from {}: {}", url, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private int countItems(HttpUrl url) throws InterruptedException {
        Optional<PageResult> page = execute(buildRequest(url.toString(), JSON_MEDIA_TYPE));
        if (page.isEmpty() || page.get().body().isBlank()) {
            return 0;
        }
        try {
            JsonNode node = objectMapper.readTree(page.get().body());
            return node != null && node.isArray() ? node.size() : 0;
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable response from {}: {}", url, e.getOriginalMessage());
            return 0;
        }
    }

    private Optional<String> decodeContent(ContentEntry entry, String location) {
        if (entry.content() == null) {
            return Optional.empty();
        }
        if (entry.encoding() != null && !"base64".equalsIgnoreCase(entry.encoding())) {
            return Optional.of(entry.content());
        }
        try {
            byte[] bytes = Base64.getMimeDecoder().decode(entry.content());
            return Optional.of(new String(bytes, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid base64 content for {}", location);
            return Optional.empty();
        }
    }

    /**
     * Picks the README from a root listing, preferring {@code README.md}.
     */
    static Optional<String> findReadme(List<ContentEntry> entries) {
        return entries.stream()
                .filter(ContentEntry::isFile)
                .filter(e -> e.name() != null && e.name().toLowerCase(Locale.ROOT).startsWith("readme"))
                .min(Comparator.comparingInt(e -> readmePriority(e.name())))
                .map(e -> e.path() != null ? e.path() : e.name());
    }

    private static int readmePriority(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.equals("readme.md")) {
            return 0;
        }
        return lower.startsWith("readme.") ? 1 : 2;
    }

    static String truncateReadme(String content) {
        return content.length() <= README_MAX_CHARS ? content : content.substring(0, README_MAX_CHARS);
    }

    private static boolean createdOnOrAfter(RepositoryCandidate candidate, LocalDate date) {
        Instant createdAt = candidate.createdAt();
        return createdAt != null && !createdAt.isBefore(date.atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    private HttpUrl endpoint(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private HttpUrl contentsUrl(String owner, String repo, String path) {
        return endpoint("repos", owner, repo, "contents").newBuilder()
                .addPathSegments(path)
                .build();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }

    // -------------------------------------------------------------------------
    // Pagination parsing
    // -------------------------------------------------------------------------

    /**
     * Parses the "next" URL from the GitHub Link header.
     *
     * <p>Example header:
     * {@code <https://api.github.com/search/code?page=2>; rel="next", <...>; rel="last"}
     *
     * @return the next page URL, or {@code null} if there is no next page
     */
    static String parseNextPageUrl(String linkHeader) {
        if (linkHeader == null || linkHeader.isEmpty()) {
            return null;
        }
        Matcher matcher = LINK_NEXT_PATTERN.matcher(linkHeader);
        return matcher.find() ? matcher.group(1) : null;
    }

    private void logResponse(String url, int statusCode, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.info("GitHub API {} {} | rate-limit-remaining: {}",
                statusCode, url, remaining != null ? remaining : "n/a");
    }

    record PageResult(String body, String nextUrl) {}
}

package com.trender.pipeline.config;

import com.trender.pipeline.scoring.ScoringPolicy;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Environment variables win over
 * the .env file. Validates required variables on startup and fails with a
 * single message naming every missing or malformed one.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final List<String> TOKEN_PREFIXES = List.of("ghp_", "gho_", "github_pat_");

    private final String githubToken;
    private final String gcpProjectId;
    private final PipelineMode mode;
    private final List<String> targetLanguages;
    private final int reposPerLanguage;
    private final int markerRepoLimit;
    private final int perLanguageRankLimit;
    private final double qualityThreshold;
    private final int batchChunkSize;
    private final int httpMaxIdleConnections;
    private final long httpKeepAliveMinutes;
    private final ScoringPolicy scoringPolicy;
    private final List<String> employeeOrgs;
    private final String datasetPrefix;

    public AppConfig() {
        this(dotenvLookup(Dotenv.configure().ignoreIfMissing().load()));

        logger.info("Configuration loaded: gcpProjectId={}, mode={}, languages={}, datasetPrefix={}",
                gcpProjectId, mode, targetLanguages, datasetPrefix);
    }

    /**
     * Constructor for testing: accepts values directly, keyed by variable name.
     */
    public AppConfig(Map<String, String> values) {
        this(values::get);
    }

    private AppConfig(Function<String, String> lookup) {
        List<String> problems = new ArrayList<>();

        this.githubToken = trimmed(lookup.apply("GITHUB_ACCESS_TOKEN"));
        this.gcpProjectId = trimmed(lookup.apply("GCP_PROJECT_ID"));

        List<String> missing = new ArrayList<>();
        if (githubToken.isEmpty()) missing.add("GITHUB_ACCESS_TOKEN");
        if (gcpProjectId.isEmpty()) missing.add("GCP_PROJECT_ID");
        if (!missing.isEmpty()) {
            problems.add("Missing required environment variables: " + String.join(" ", missing));
        } else if (TOKEN_PREFIXES.stream().noneMatch(githubToken::startsWith)) {
            problems.add("GITHUB_ACCESS_TOKEN must start with one of " + TOKEN_PREFIXES);
        }

        this.mode = PipelineMode.parse(lookup.apply("PIPELINE_MODE"));
        this.targetLanguages = parseList(lookup.apply("TARGET_LANGUAGES"), List.of("Python", "TypeScript", "Go"));
        if (targetLanguages.isEmpty()) {
            problems.add("TARGET_LANGUAGES must name at least one language");
        }
        this.reposPerLanguage = positiveInt(lookup, "REPOS_PER_LANGUAGE", 100, problems);
        this.markerRepoLimit = positiveInt(lookup, "MARKER_REPO_LIMIT", 100, problems);
        this.perLanguageRankLimit = positiveInt(lookup, "PER_LANGUAGE_RANK_LIMIT", 50, problems);
        this.batchChunkSize = positiveInt(lookup, "BATCH_CHUNK_SIZE", 10, problems);
        this.httpMaxIdleConnections = positiveInt(lookup, "HTTP_MAX_IDLE_CONNECTIONS", 10, problems);
        this.httpKeepAliveMinutes = positiveInt(lookup, "HTTP_POOL_KEEP_ALIVE_MINUTES", 5, problems);

        this.qualityThreshold = fraction(lookup, "QUALITY_THRESHOLD", 0.70, problems);
        double recencyWeight = fraction(lookup, "MOMENTUM_RECENCY_WEIGHT", ScoringPolicy.DEFAULT.recencyWeight(), problems);
        double starWeight = fraction(lookup, "MOMENTUM_STAR_WEIGHT", ScoringPolicy.DEFAULT.starWeight(), problems);
        this.scoringPolicy = scoringPolicy(recencyWeight, starWeight, problems);

        this.employeeOrgs = parseList(lookup.apply("RENDER_EMPLOYEE_GITHUB_ORGS"), List.of());
        String prefix = trimmed(lookup.apply("BIGQUERY_DATASET_PREFIX"));
        this.datasetPrefix = prefix.isEmpty() ? "trender" : prefix;

        if (!problems.isEmpty()) {
            throw new IllegalStateException(String.join("; ", problems));
        }
    }

    private static Function<String, String> dotenvLookup(Dotenv dotenv) {
        return key -> {
            String envValue = System.getenv(key);
            if (envValue != null && !envValue.isBlank()) {
                return envValue;
            }
            return dotenv.get(key);
        };
    }

    private static int positiveInt(Function<String, String> lookup, String key, int defaultValue,
                                   List<String> problems) {
        String raw = trimmed(lookup.apply(key));
        if (raw.isEmpty()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw);
            if (value > 0) {
                return value;
            }
        } catch (NumberFormatException e) {
            logger.debug("{} is not an integer: {}", key, raw);
        }
        problems.add(key + " must be a positive integer, got '" + raw + "'");
        return defaultValue;
    }

    private static double fraction(Function<String, String> lookup, String key, double defaultValue,
                                   List<String> problems) {
        String raw = trimmed(lookup.apply(key));
        if (raw.isEmpty()) {
            return defaultValue;
        }
        try {
            double value = Double.parseDouble(raw);
            if (value >= 0.0 && value <= 1.0) {
                return value;
            }
        } catch (NumberFormatException e) {
            logger.debug("{} is not a number: {}", key, raw);
        }
        problems.add(key + " must be a number between 0 and 1, got '" + raw + "'");
        return defaultValue;
    }

    private static ScoringPolicy scoringPolicy(double recencyWeight, double starWeight, List<String> problems) {
        try {
            return new ScoringPolicy(recencyWeight, starWeight);
        } catch (IllegalArgumentException e) {
            problems.add(e.getMessage());
            return ScoringPolicy.DEFAULT;
        }
    }

    private static List<String> parseList(String raw, List<String> defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }

    public String getGithubToken() {
        return githubToken;
    }

    public String getGcpProjectId() {
        return gcpProjectId;
    }

    public PipelineMode getMode() {
        return mode;
    }

    public List<String> getTargetLanguages() {
        return targetLanguages;
    }

    public int getReposPerLanguage() {
        return reposPerLanguage;
    }

    public int getMarkerRepoLimit() {
        return markerRepoLimit;
    }

    public int getPerLanguageRankLimit() {
        return perLanguageRankLimit;
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public int getBatchChunkSize() {
        return batchChunkSize;
    }

    public int getHttpMaxIdleConnections() {
        return httpMaxIdleConnections;
    }

    public long getHttpKeepAliveMinutes() {
        return httpKeepAliveMinutes;
    }

    public ScoringPolicy getScoringPolicy() {
        return scoringPolicy;
    }

    public List<String> getEmployeeOrgs() {
        return employeeOrgs;
    }

    public String getDatasetPrefix() {
        return datasetPrefix;
    }
}

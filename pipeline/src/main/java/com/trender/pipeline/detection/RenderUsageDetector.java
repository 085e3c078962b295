package com.trender.pipeline.detection;

import com.trender.pipeline.client.GitHubApiClient;
import com.trender.pipeline.model.RenderCategory;
import com.trender.pipeline.model.RenderUsage;
import com.trender.pipeline.model.RepositoryCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Detects Render usage from a repository's {@code render.yaml} blueprint and
 * grades how involved the deployment is.
 *
 * <p>Detection never fails the caller: a missing, unreadable or malformed blueprint
 * and any unexpected error all yield {@link RenderUsage#notInUse()}. Only
 * interruption propagates.</p>
 */
public class RenderUsageDetector {

    private static final Logger logger = LoggerFactory.getLogger(RenderUsageDetector.class);

    public static final String MARKER_FILE = "render.yaml";
    /** Language tag under which marker-file projects are staged and ranked. */
    public static final String MARKER_COHORT = "render";
    static final String DOCKERFILE = "Dockerfile";
    static final String DEPLOY_BUTTON_URL = "render.com/deploy";

    static final Set<String> OFFICIAL_ORGS = Set.of("render-examples", "render");
    static final Set<String> BLUEPRINT_TOPICS = Set.of("render-blueprints", "render-blueprint");

    private static final String DEFAULT_SERVICE_TYPE = "unknown";
    private static final String DEFAULT_DATABASE_TYPE = "postgres";

    private static final List<Pattern> DOCKERFILE_PATTERNS = List.of(
            Pattern.compile("render\\.com", Pattern.CASE_INSENSITIVE),
            Pattern.compile("RENDER_.*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("onrender\\.com", Pattern.CASE_INSENSITIVE));

    private final GitHubApiClient client;
    private final Set<String> employeeOrgs;

    /**
     * @param client       API client used to fetch the blueprint and Dockerfile
     * @param employeeOrgs organizations whose projects count as employee projects
     */
    public RenderUsageDetector(GitHubApiClient client, Collection<String> employeeOrgs) {
        this.client = client;
        this.employeeOrgs = employeeOrgs.stream()
                .map(String::trim)
                .filter(org -> !org.isEmpty())
                .map(org -> org.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Probes a repository for {@value #MARKER_FILE}.
     * The deploy-button flag is left false; it depends on the README, see {@link #hasDeployButton}.
     */
    public RenderUsage detect(RepositoryCandidate candidate) throws InterruptedException {
        if (!candidate.isWellFormed()) {
            return RenderUsage.notInUse();
        }
        String owner = candidate.ownerLogin();
        String repo = candidate.repoName();

        try {
            Optional<String> blueprint = client.getFileContents(owner, repo, MARKER_FILE);
            if (blueprint.isEmpty() || blueprint.get().isBlank()) {
                return RenderUsage.notInUse();
            }
            logger.info("Found {} for {}", MARKER_FILE, candidate.fullName());

            BlueprintConfig config = parseBlueprint(blueprint.get());
            DockerfileSignals docker = client.getFileContents(owner, repo, DOCKERFILE)
                    .map(RenderUsageDetector::scanDockerfile)
                    .orElse(DockerfileSignals.NONE);

            return new RenderUsage(
                    true,
                    categorize(candidate),
                    config.services(),
                    config.databases(),
                    config.serviceCount(),
                    complexityScore(config, docker),
                    false);
        } catch (InterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Render detection failed for {}, treating as not in use: {}",
                    candidate.fullName(), e.toString());
            return RenderUsage.notInUse();
        }
    }

    // -------------------------------------------------------------------------
    // Blueprint parsing
    // -------------------------------------------------------------------------

    /**
     * Extracts declared service and database types. Malformed YAML, or YAML that is not a
     * mapping, parses as an empty blueprint.
     */
    static BlueprintConfig parseBlueprint(String content) {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(content);
        } catch (YAMLException e) {
            logger.debug("Malformed {}: {}", MARKER_FILE, e.getMessage());
            return BlueprintConfig.EMPTY;
        }
        if (!(root instanceof Map<?, ?> document)) {
            return BlueprintConfig.EMPTY;
        }
        return new BlueprintConfig(
                typesOf(document.get("services"), DEFAULT_SERVICE_TYPE),
                typesOf(document.get("databases"), DEFAULT_DATABASE_TYPE));
    }

    private static List<String> typesOf(Object section, String defaultType) {
        if (!(section instanceof List<?> entries)) {
            return List.of();
        }
        List<String> types = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            Object type = entry instanceof Map<?, ?> map ? map.get("type") : null;
            types.add(type != null ? type.toString() : defaultType);
        }
        return types;
    }

    // -------------------------------------------------------------------------
    // Dockerfile scan
    // -------------------------------------------------------------------------

    static DockerfileSignals scanDockerfile(String dockerfile) {
        if (dockerfile == null || dockerfile.isEmpty()) {
            return DockerfileSignals.NONE;
        }
        boolean usesRenderEnv = dockerfile.contains("RENDER");
        boolean mentionsRender = DOCKERFILE_PATTERNS.stream()
                .anyMatch(pattern -> pattern.matcher(dockerfile).find());
        return new DockerfileSignals(usesRenderEnv, mentionsRender);
    }

    // -------------------------------------------------------------------------
    // Scores
    // -------------------------------------------------------------------------

    /**
     * 0-10: up to 5 for declared services and databases, up to 3 for distinct service
     * types, 1 each for the two Dockerfile signals.
     */
    static int complexityScore(BlueprintConfig config, DockerfileSignals docker) {
        int score = Math.min(config.serviceCount(), 5);
        score += Math.min(new HashSet<>(config.services()).size(), 3);
        if (docker.usesRenderEnv()) {
            score++;
        }
        if (docker.mentionsRender()) {
            score++;
        }
        return Math.min(score, 10);
    }

    /**
     * Official org first, then blueprint topics, then the employee list; community otherwise.
     */
    RenderCategory categorize(RepositoryCandidate candidate) {
        String owner = Optional.ofNullable(candidate.ownerLogin()).orElse("").toLowerCase(Locale.ROOT);
        if (OFFICIAL_ORGS.contains(owner)) {
            return RenderCategory.OFFICIAL;
        }
        if (candidate.topics().stream().anyMatch(BLUEPRINT_TOPICS::contains)) {
            return RenderCategory.BLUEPRINT;
        }
        if (employeeOrgs.contains(owner)) {
            return RenderCategory.EMPLOYEE;
        }
        return RenderCategory.COMMUNITY;
    }

    public static boolean hasDeployButton(String readme) {
        return readme != null && readme.toLowerCase(Locale.ROOT).contains(DEPLOY_BUTTON_URL);
    }

    /**
     * Blueprint quality, 0-10: 3 for having a blueprint, up to 3 for services,
     * 2 for more than one service type and 2 for complexity of 5 or more.
     */
    public static int blueprintQualityScore(RenderUsage usage) {
        if (!usage.usesRender()) {
            return 0;
        }
        int score = 3;
        score += Math.min(usage.services().size(), 3);
        if (new HashSet<>(usage.services()).size() > 1) {
            score += 2;
        }
        if (usage.complexityScore() >= 5) {
            score += 2;
        }
        return Math.min(score, 10);
    }

    /**
     * Documentation quality, 0-10: description 2, README 3, README mentioning Render 2,
     * deploy button 3.
     */
    public static int documentationScore(String description, String readme, RenderUsage usage) {
        int score = 0;
        if (description != null && !description.isBlank()) {
            score += 2;
        }
        if (readme != null) {
            score += 3;
            if (readme.toLowerCase(Locale.ROOT).contains("render")) {
                score += 2;
            }
        }
        if (usage.hasBlueprintButton()) {
            score += 3;
        }
        return Math.min(score, 10);
    }

    record BlueprintConfig(List<String> services, List<String> databases) {

        static final BlueprintConfig EMPTY = new BlueprintConfig(List.of(), List.of());

        int serviceCount() {
            return services.size() + databases.size();
        }
    }

    record DockerfileSignals(boolean usesRenderEnv, boolean mentionsRender) {

        static final DockerfileSignals NONE = new DockerfileSignals(false, false);
    }
}

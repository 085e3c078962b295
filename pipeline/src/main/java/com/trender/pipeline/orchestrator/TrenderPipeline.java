package com.trender.pipeline.orchestrator;

import com.trender.pipeline.client.GitHubApiClient;
import com.trender.pipeline.config.AppConfig;
import com.trender.pipeline.config.PipelineMode;
import com.trender.pipeline.connection.ConnectionManager;
import com.trender.pipeline.detection.RenderUsageDetector;
import com.trender.pipeline.loader.AnalyticsLoader;
import com.trender.pipeline.loader.BigQueryWarehouse;
import com.trender.pipeline.loader.ExecutionStats;
import com.trender.pipeline.loader.ExecutionStatsStore;
import com.trender.pipeline.loader.LoadResult;
import com.trender.pipeline.loader.RankedRepository;
import com.trender.pipeline.loader.RankingTransformer;
import com.trender.pipeline.loader.RawStore;
import com.trender.pipeline.loader.StagingExtractor;
import com.trender.pipeline.loader.StagingRow;
import com.trender.pipeline.loader.StagingStore;
import com.trender.pipeline.model.RepositoryCandidate;
import com.trender.pipeline.model.RepositorySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One end-to-end run: trending search per language, the Render ecosystem cohort,
 * then extract, rank and load into analytics, then execution stats.
 *
 * <p>Phases run one after another. A phase that throws is logged and marks the run
 * unsuccessful, but later phases still run so whatever reached staging gets ranked.
 * Interruption stops the run.</p>
 */
public class TrenderPipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TrenderPipeline.class);

    static final int UPDATED_WITHIN_DAYS = 30;
    static final int MARKER_CREATED_WITHIN_DAYS = 365;
    static final String OFFICIAL_EXAMPLES_ORG = "render-examples";
    static final String BLUEPRINT_TOPIC = "render-blueprints";

    private final AppConfig config;
    private final GitHubApiClient client;
    private final BatchAnalysisOrchestrator orchestrator;
    private final RawStore rawStore;
    private final StagingExtractor extractor;
    private final RankingTransformer transformer;
    private final AnalyticsLoader analyticsLoader;
    private final ExecutionStatsStore statsStore;
    private final Clock clock;

    // Visible for testing
    TrenderPipeline(AppConfig config, GitHubApiClient client, BatchAnalysisOrchestrator orchestrator,
                    RawStore rawStore, StagingExtractor extractor, RankingTransformer transformer,
                    AnalyticsLoader analyticsLoader, ExecutionStatsStore statsStore, Clock clock) {
        this.config = config;
        this.client = client;
        this.orchestrator = orchestrator;
        this.rawStore = rawStore;
        this.extractor = extractor;
        this.transformer = transformer;
        this.analyticsLoader = analyticsLoader;
        this.statsStore = statsStore;
        this.clock = clock;
    }

    /**
     * Wires every component onto the sessions held by {@code connections}.
     */
    public static TrenderPipeline create(AppConfig config, ConnectionManager connections) {
        GitHubApiClient client = connections.gitHub();
        BigQueryWarehouse warehouse = connections.warehouse();
        RenderUsageDetector detector = new RenderUsageDetector(client, config.getEmployeeOrgs());
        BatchAnalysisOrchestrator orchestrator = new BatchAnalysisOrchestrator(
                client, detector, new StagingStore(warehouse), config.getBatchChunkSize());

        return new TrenderPipeline(config, client, orchestrator,
                new RawStore(warehouse),
                new StagingExtractor(warehouse),
                new RankingTransformer(config.getScoringPolicy()),
                new AnalyticsLoader(warehouse),
                new ExecutionStatsStore(warehouse),
                Clock.systemUTC());
    }

    public PipelineSummary run() {
        Instant start = clock.instant();
        LocalDate today = LocalDate.ofInstant(start, ZoneOffset.UTC);
        PipelineMode mode = config.getMode();
        List<String> languages = mode.languages(config.getTargetLanguages());
        logger.info("Starting Trender pipeline (mode: {}, languages: {})", mode, languages);

        RunTally tally = new RunTally();
        boolean success = true;

        for (String language : languages) {
            success &= runPhase("trending " + language, () -> {
                List<RepositoryCandidate> candidates = cap(
                        client.searchRepositories(language, "stars", today.minusDays(UPDATED_WITHIN_DAYS), null),
                        mode.candidateCap(config.getReposPerLanguage()));
                rawStore.store(candidates, language, RawStore.SourceType.TRENDING);
                tally.add(orchestrator.analyze(candidates, null));
            });
            if (Thread.currentThread().isInterrupted()) {
                return finish(start, tally, languages, false);
            }
        }

        success &= runPhase("render ecosystem", () -> {
            List<RepositoryCandidate> cohort = fetchMarkerCohort(mode, today);
            rawStore.store(cohort, null, RawStore.SourceType.RENDER_ECOSYSTEM);
            tally.add(orchestrator.analyze(cohort, RenderUsageDetector.MARKER_COHORT));
        });
        if (Thread.currentThread().isInterrupted()) {
            return finish(start, tally, languages, false);
        }

        success &= runPhase("aggregate", () -> {
            List<StagingRow> rows = extractor.extract(config.getQualityThreshold(), config.getPerLanguageRankLimit());
            List<RankedRepository> ranked = transformer.transform(rows, clock.instant());
            LoadResult load = analyticsLoader.load(ranked, today);
            if (load.skipped() + load.failed() > 0) {
                logger.warn("{} of {} ranked rows did not reach analytics ({} skipped, {} failed)",
                        load.skipped() + load.failed(), load.total(), load.skipped(), load.failed());
            }
        });

        return finish(start, tally, languages, success);
    }

    /**
     * Marker-file projects created within the last year, the official examples org and the
     * blueprint topic, deduplicated by full name in that order.
     */
    List<RepositoryCandidate> fetchMarkerCohort(PipelineMode mode, LocalDate today) throws InterruptedException {
        int limit = mode.candidateCap(config.getMarkerRepoLimit());
        Map<String, RepositoryCandidate> unique = new LinkedHashMap<>();

        List<List<RepositoryCandidate>> sources = List.of(
                client.searchByMarkerFile(RenderUsageDetector.MARKER_FILE, limit,
                        today.minusDays(MARKER_CREATED_WITHIN_DAYS)),
                cap(client.getOrganizationRepositories(OFFICIAL_EXAMPLES_ORG), limit),
                cap(client.searchByTopic(BLUEPRINT_TOPIC), limit));
        for (List<RepositoryCandidate> source : sources) {
            for (RepositoryCandidate candidate : source) {
                if (candidate.fullName() != null) {
                    unique.putIfAbsent(candidate.fullName(), candidate);
                }
            }
        }

        logger.info("Render ecosystem cohort: {} unique repositories", unique.size());
        return new ArrayList<>(unique.values());
    }

    private boolean runPhase(String name, Phase phase) {
        long phaseStart = clock.millis();
        try {
            phase.run();
            logger.info("Phase '{}' finished in {}ms", name, clock.millis() - phaseStart);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Phase '{}' interrupted, stopping the run", name);
            return false;
        } catch (RuntimeException e) {
            logger.error("Phase '{}' failed", name, e);
            return false;
        }
    }

    private PipelineSummary finish(Instant start, RunTally tally, List<String> languages, boolean success) {
        Instant end = clock.instant();
        double elapsedSeconds = Duration.between(start, end).toMillis() / 1000.0;

        try {
            statsStore.record(new ExecutionStats(end, elapsedSeconds, tally.repositories.size(),
                    tally.executed, tally.succeeded, tally.skipped, tally.failed, languages));
        } catch (RuntimeException e) {
            logger.error("Could not record execution stats", e);
        }

        PipelineSummary summary = new PipelineSummary(tally.repositories.size(), elapsedSeconds, success);
        logger.info("Pipeline {} in {}s: {} repositories processed ({} tasks, {} succeeded, {} skipped, {} failed)",
                success ? "succeeded" : "finished with failures", elapsedSeconds, summary.reposProcessed(),
                tally.executed, tally.succeeded, tally.skipped, tally.failed);
        return summary;
    }

    private static List<RepositoryCandidate> cap(List<RepositoryCandidate> candidates, int limit) {
        return candidates.size() > limit ? candidates.subList(0, limit) : candidates;
    }

    @Override
    public void close() {
        orchestrator.close();
    }

    @FunctionalInterface
    private interface Phase {
        void run() throws InterruptedException;
    }

    private static final class RunTally {
        private final Set<String> repositories = new LinkedHashSet<>();
        private int executed;
        private int succeeded;
        private int skipped;
        private int failed;

        void add(BatchResult result) {
            executed += result.outcomes().size();
            succeeded += result.succeededCount();
            skipped += result.skippedCount();
            failed += result.failedCount();
            for (RepositorySummary summary : result.summaries()) {
                repositories.add(summary.fullName());
            }
        }
    }
}

package com.trender.pipeline.orchestrator;

import com.trender.pipeline.client.GitHubApiClient;
import com.trender.pipeline.detection.RenderUsageDetector;
import com.trender.pipeline.loader.StagingStore;
import com.trender.pipeline.model.ActivityMetrics;
import com.trender.pipeline.model.EnrichedRepository;
import com.trender.pipeline.model.RenderUsage;
import com.trender.pipeline.model.RepositoryCandidate;
import com.trender.pipeline.scoring.DataQualityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Analyzes candidates in fixed-size chunks: every candidate of a chunk runs as its own
 * task, and the next chunk starts only once every task of the current one has settled.
 * This caps in-flight repositories at the chunk size however long the list is.
 *
 * <p>Each task validates its candidate, fetches README, activity and Render usage
 * concurrently, scores the result and upserts it into staging. A task that throws is
 * recorded as failed and never affects its siblings or later chunks.</p>
 *
 * <p>Fetches run on a separate pool from the tasks so a task waiting on its fetches
 * never starves them of threads.</p>
 */
public class BatchAnalysisOrchestrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchAnalysisOrchestrator.class);

    static final Duration ACTIVITY_WINDOW = Duration.ofDays(7);
    private static final int FETCHES_PER_TASK = 3;

    private final GitHubApiClient client;
    private final RenderUsageDetector detector;
    private final StagingStore stagingStore;
    private final int chunkSize;
    private final Clock clock;
    private final ExecutorService taskExecutor;
    private final ExecutorService fetchExecutor;

    public BatchAnalysisOrchestrator(GitHubApiClient client, RenderUsageDetector detector,
                                     StagingStore stagingStore, int chunkSize) {
        this(client, detector, stagingStore, chunkSize, Clock.systemUTC());
    }

    // Visible for testing
    BatchAnalysisOrchestrator(GitHubApiClient client, RenderUsageDetector detector,
                              StagingStore stagingStore, int chunkSize, Clock clock) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        }
        this.client = client;
        this.detector = detector;
        this.stagingStore = stagingStore;
        this.chunkSize = chunkSize;
        this.clock = clock;
        this.taskExecutor = Executors.newFixedThreadPool(chunkSize);
        this.fetchExecutor = Executors.newFixedThreadPool(chunkSize * FETCHES_PER_TASK);
    }

    public BatchResult analyze(List<RepositoryCandidate> candidates, String cohortLanguage)
            throws InterruptedException {
        return analyze(candidates, cohortLanguage, Map.of());
    }

    /**
     * @param candidates        repositories to analyze
     * @param cohortLanguage    language tag to stage every candidate under, or {@code null}
     *                          to use each candidate's own language
     * @param prefetchedReadmes README text by full name; these repositories skip the README fetch
     * @return one outcome per candidate, in input order
     * @throws InterruptedException if the calling thread is interrupted while waiting on a chunk
     */
    public BatchResult analyze(List<RepositoryCandidate> candidates, String cohortLanguage,
                               Map<String, String> prefetchedReadmes) throws InterruptedException {
        List<AnalysisOutcome> outcomes = new ArrayList<>(candidates.size());
        int chunkCount = (candidates.size() + chunkSize - 1) / chunkSize;

        for (int chunk = 0; chunk < chunkCount; chunk++) {
            List<RepositoryCandidate> members = candidates.subList(
                    chunk * chunkSize, Math.min(candidates.size(), (chunk + 1) * chunkSize));

            List<CompletableFuture<AnalysisOutcome>> tasks = new ArrayList<>(members.size());
            for (RepositoryCandidate candidate : members) {
                // malformed names are skipped inside the task; Map.of() rejects a null key
                String readme = candidate.isWellFormed() ? prefetchedReadmes.get(candidate.fullName()) : null;
                tasks.add(CompletableFuture.supplyAsync(
                        () -> analyzeOne(candidate, cohortLanguage, readme), taskExecutor));
            }

            List<AnalysisOutcome> chunkOutcomes = awaitChunk(tasks, members);
            outcomes.addAll(chunkOutcomes);
            logChunk(chunk + 1, chunkCount, new BatchResult(chunkOutcomes));
        }

        BatchResult result = new BatchResult(outcomes);
        logger.info("Batch complete: {} candidates, {} staged, {} skipped, {} failed",
                candidates.size(), result.succeededCount(), result.skippedCount(), result.failedCount());
        return result;
    }

    private List<AnalysisOutcome> awaitChunk(List<CompletableFuture<AnalysisOutcome>> tasks,
                                             List<RepositoryCandidate> members) throws InterruptedException {
        List<AnalysisOutcome> outcomes = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            try {
                outcomes.add(tasks.get(i).get());
            } catch (InterruptedException e) {
                tasks.forEach(task -> task.cancel(true));
                throw e;
            } catch (ExecutionException e) {
                // analyzeOne catches everything it can; this is an Error escaping a task
                outcomes.add(AnalysisOutcome.failed(members.get(i).fullName(), AnalysisState.PENDING,
                        String.valueOf(e.getCause())));
            }
        }
        return outcomes;
    }

    /**
     * Runs the full state machine for one candidate. Never throws.
     */
    AnalysisOutcome analyzeOne(RepositoryCandidate candidate, String cohortLanguage, String prefetchedReadme) {
        String fullName = candidate.fullName();
        String stagedLanguage = cohortLanguage != null ? cohortLanguage : candidate.language();

        String invalid = validate(candidate, stagedLanguage);
        if (invalid != null) {
            logger.debug("Skipping {}: {}", fullName, invalid);
            return AnalysisOutcome.skipped(fullName, invalid);
        }

        AnalysisState step = AnalysisState.FETCHING;
        try {
            Instant now = clock.instant();
            String owner = candidate.ownerLogin();
            String repo = candidate.repoName();

            CompletableFuture<Optional<String>> readmeFetch = prefetchedReadme != null
                    ? CompletableFuture.completedFuture(Optional.of(prefetchedReadme))
                    : fetchAsync(() -> client.fetchReadme(owner, repo));
            CompletableFuture<ActivityMetrics> activityFetch =
                    fetchAsync(() -> client.getActivityMetrics(owner, repo, now.minus(ACTIVITY_WINDOW)));
            CompletableFuture<RenderUsage> usageFetch = fetchAsync(() -> detector.detect(candidate));

            String readme = await(readmeFetch).orElse(null);
            ActivityMetrics activity = await(activityFetch);
            RenderUsage usage = await(usageFetch);

            step = AnalysisState.SCORING;
            usage = usage.withBlueprintButton(RenderUsageDetector.hasDeployButton(readme));
            EnrichedRepository enriched = new EnrichedRepository(candidate, stagedLanguage, readme, activity, usage, 0.0);
            enriched = enriched.withDataQualityScore(DataQualityScorer.score(candidate, enriched.activity(), now));

            step = AnalysisState.PERSISTING;
            stagingStore.upsert(enriched);

            return AnalysisOutcome.succeeded(enriched.toSummary());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AnalysisOutcome.failed(fullName, step, "interrupted");
        } catch (Exception e) {
            logger.warn("Analysis of {} failed while {}: {}", fullName, step, e.toString());
            return AnalysisOutcome.failed(fullName, step, e.toString());
        }
    }

    /**
     * @return why the candidate cannot be analyzed, or {@code null} when it can
     */
    static String validate(RepositoryCandidate candidate, String stagedLanguage) {
        if (!candidate.isWellFormed()) {
            return "malformed full name '" + candidate.fullName() + "'";
        }
        if (stagedLanguage == null || stagedLanguage.isBlank()) {
            return "missing language";
        }
        if (candidate.createdAt() == null || candidate.updatedAt() == null) {
            return "missing created/updated timestamps";
        }
        return null;
    }

    private <T> CompletableFuture<T> fetchAsync(Fetch<T> fetch) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return fetch.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        }, fetchExecutor);
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private void logChunk(int chunk, int chunkCount, BatchResult result) {
        logger.info("Chunk {}/{}: {} staged, {} skipped, {} failed",
                chunk, chunkCount, result.succeededCount(), result.skippedCount(), result.failedCount());
        result.outcomes().stream()
                .filter(o -> o.state() == AnalysisState.FAILED)
                .forEach(o -> logger.warn("  FAILED: {} during {}: {}", o.fullName(), o.failedStep(), o.detail()));
    }

    @Override
    public void close() {
        taskExecutor.shutdownNow();
        fetchExecutor.shutdownNow();
    }

    @FunctionalInterface
    private interface Fetch<T> {
        T get() throws InterruptedException;
    }
}

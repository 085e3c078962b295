package com.trender.pipeline.orchestrator;

import com.trender.pipeline.client.GitHubApiClient;
import com.trender.pipeline.config.AppConfig;
import com.trender.pipeline.loader.*;
import com.trender.pipeline.model.RepositoryCandidate;
import com.trender.pipeline.model.RepositorySummary;
import com.trender.pipeline.scoring.ScoringPolicy;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end test of one pipeline run with every external collaborator mocked.
 * Verifies phase order, the marker-cohort assembly and how phase failures are reported.
 */
@ExtendWith(MockitoExtension.class)
class TrenderPipelineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T06:00:00Z");
    private static final LocalDate TODAY = LocalDate.parse("2025-03-01");

    @Mock
    private GitHubApiClient client;

    @Mock
    private BatchAnalysisOrchestrator orchestrator;

    @Mock
    private RawStore rawStore;

    @Mock
    private StagingExtractor extractor;

    @Mock
    private AnalyticsLoader analyticsLoader;

    @Mock
    private ExecutionStatsStore statsStore;

    private static AppConfig config(String mode, String languages) {
        Map<String, String> values = new HashMap<>();
        values.put("GITHUB_ACCESS_TOKEN", "ghp_test_token");
        values.put("GCP_PROJECT_ID", "test-project");
        values.put("PIPELINE_MODE", mode);
        values.put("TARGET_LANGUAGES", languages);
        return new AppConfig(values);
    }

    private TrenderPipeline pipeline(AppConfig config) {
        return new TrenderPipeline(config, client, orchestrator, rawStore, extractor,
                new RankingTransformer(ScoringPolicy.DEFAULT), analyticsLoader, statsStore,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RepositoryCandidate candidate(String fullName) {
        return new RepositoryCandidate(fullName, "https://github.com/" + fullName, "Go", null, 10L, null, null,
                NOW, NOW, List.of(), null);
    }

    private static List<RepositoryCandidate> candidates(String prefix, int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> candidate(prefix + "/r" + i)).toList();
    }

    private static BatchResult succeeded(String... fullNames) {
        List<AnalysisOutcome> outcomes = new ArrayList<>();
        for (String name : fullNames) {
            outcomes.add(AnalysisOutcome.succeeded(new RepositorySummary(name, "Go", 10)));
        }
        return new BatchResult(outcomes);
    }

    // =========================================================================
    // Full run
    // =========================================================================

    @Test
    @DisplayName("Full run searches each language, assembles the marker cohort, then extracts, ranks and loads")
    @SuppressWarnings("unchecked")
    void run_allPhases() throws Exception {
        List<RepositoryCandidate> go = List.of(candidate("go/a"), candidate("go/b"));
        List<RepositoryCandidate> python = List.of(candidate("py/a"));
        when(client.searchRepositories("Go", "stars", LocalDate.parse("2025-01-30"), null)).thenReturn(go);
        when(client.searchRepositories("Python", "stars", LocalDate.parse("2025-01-30"), null)).thenReturn(python);
        when(orchestrator.analyze(go, null)).thenReturn(succeeded("go/a", "go/b"));
        when(orchestrator.analyze(python, null)).thenReturn(succeeded("py/a"));

        when(client.searchByMarkerFile("render.yaml", 100, LocalDate.parse("2024-03-01")))
                .thenReturn(List.of(candidate("m/one"), candidate("go/a")));
        when(client.getOrganizationRepositories("render-examples"))
                .thenReturn(List.of(candidate("render-examples/flask"), candidate("m/one")));
        when(client.searchByTopic("render-blueprints")).thenReturn(List.of(candidate("t/bp")));
        when(orchestrator.analyze(anyList(), eq("render")))
                .thenReturn(succeeded("m/one", "go/a", "render-examples/flask", "t/bp"));

        when(extractor.extract(0.70, 50)).thenReturn(List.of());
        when(analyticsLoader.load(List.of(), TODAY)).thenReturn(new LoadResult(0, 0, 0, 0));

        PipelineSummary summary = pipeline(config("FULL", "Go,Python")).run();

        assertTrue(summary.success());
        // go/a is counted once even though it was analyzed in two cohorts
        assertEquals(6, summary.reposProcessed());

        ArgumentCaptor<List<RepositoryCandidate>> cohort = ArgumentCaptor.forClass(List.class);
        verify(orchestrator).analyze(cohort.capture(), eq("render"));
        assertEquals(List.of("m/one", "go/a", "render-examples/flask", "t/bp"),
                cohort.getValue().stream().map(RepositoryCandidate::fullName).toList());

        InOrder order = inOrder(rawStore, orchestrator, extractor, analyticsLoader, statsStore);
        order.verify(rawStore).store(go, "Go", RawStore.SourceType.TRENDING);
        order.verify(orchestrator).analyze(go, null);
        order.verify(rawStore).store(python, "Python", RawStore.SourceType.TRENDING);
        order.verify(rawStore).store(anyList(), isNull(), eq(RawStore.SourceType.RENDER_ECOSYSTEM));
        order.verify(extractor).extract(0.70, 50);
        order.verify(analyticsLoader).load(List.of(), TODAY);
        order.verify(statsStore).record(any(ExecutionStats.class));
    }

    @Test
    @DisplayName("Execution stats record tasks, outcomes and languages of the run")
    void run_recordsExecutionStats() throws Exception {
        List<RepositoryCandidate> go = List.of(candidate("go/a"), candidate("go/b"), candidate("go/c"));
        when(client.searchRepositories(eq("Go"), anyString(), any(), isNull())).thenReturn(go);
        when(orchestrator.analyze(go, null)).thenReturn(new BatchResult(List.of(
                AnalysisOutcome.succeeded(new RepositorySummary("go/a", "Go", 10)),
                AnalysisOutcome.skipped("go/b", "missing language"),
                AnalysisOutcome.failed("go/c", AnalysisState.FETCHING, "boom"))));
        when(orchestrator.analyze(anyList(), eq("render"))).thenReturn(new BatchResult(List.of()));
        when(extractor.extract(anyDouble(), anyInt())).thenReturn(List.of());
        when(analyticsLoader.load(anyList(), any())).thenReturn(new LoadResult(0, 0, 0, 0));

        pipeline(config("FULL", "Go")).run();

        ArgumentCaptor<ExecutionStats> stats = ArgumentCaptor.forClass(ExecutionStats.class);
        verify(statsStore).record(stats.capture());
        assertEquals(NOW, stats.getValue().executionDate());
        assertEquals(1, stats.getValue().reposProcessed());
        assertEquals(3, stats.getValue().tasksExecuted());
        assertEquals(1, stats.getValue().tasksSucceeded());
        assertEquals(1, stats.getValue().tasksSkipped());
        assertEquals(1, stats.getValue().tasksFailed());
        assertEquals(List.of("Go"), stats.getValue().languagesProcessed());
    }

    // =========================================================================
    // Failure handling
    // =========================================================================

    @Test
    @DisplayName("A failing phase marks the run unsuccessful but later phases still run")
    void run_phaseFailureContinues() throws Exception {
        when(client.searchRepositories(eq("Go"), anyString(), any(), isNull()))
                .thenThrow(new IllegalStateException("search exploded"));
        when(orchestrator.analyze(anyList(), eq("render"))).thenReturn(succeeded("m/one"));
        when(extractor.extract(anyDouble(), anyInt())).thenReturn(List.of());
        when(analyticsLoader.load(anyList(), any())).thenReturn(new LoadResult(0, 0, 0, 0));

        PipelineSummary summary = pipeline(config("FULL", "Go")).run();

        assertFalse(summary.success());
        assertEquals(1, summary.reposProcessed());
        verify(analyticsLoader).load(anyList(), eq(TODAY));
    }

    @Test
    @DisplayName("A stats write failure is logged and does not fail the run")
    void run_statsFailureIsNotFatal() throws Exception {
        when(client.searchRepositories(anyString(), anyString(), any(), isNull())).thenReturn(List.of());
        when(orchestrator.analyze(anyList(), any())).thenReturn(new BatchResult(List.of()));
        when(extractor.extract(anyDouble(), anyInt())).thenReturn(List.of());
        when(analyticsLoader.load(anyList(), any())).thenReturn(new LoadResult(0, 0, 0, 0));
        when(statsStore.record(any())).thenThrow(new IllegalStateException("insert failed"));

        PipelineSummary summary = pipeline(config("FULL", "Go")).run();

        assertTrue(summary.success());
    }

    @Test
    @DisplayName("Interruption stops the run before later phases")
    void run_interruptedStops() throws Exception {
        when(client.searchRepositories(eq("Go"), anyString(), any(), isNull())).thenReturn(List.of(candidate("go/a")));
        when(orchestrator.analyze(anyList(), isNull())).thenThrow(new InterruptedException("stop"));

        PipelineSummary summary;
        try {
            summary = pipeline(config("FULL", "Go,Python")).run();
        } finally {
            assertTrue(Thread.interrupted(), "interrupt flag should be restored");
        }

        assertFalse(summary.success());
        verify(client, never()).searchRepositories(eq("Python"), anyString(), any(), any());
        verifyNoInteractions(extractor, analyticsLoader);
        verify(statsStore).record(any(ExecutionStats.class));
    }

    // =========================================================================
    // DEV mode
    // =========================================================================

    @Test
    @DisplayName("DEV mode runs only the first language and caps every candidate list at 10")
    @SuppressWarnings("unchecked")
    void run_devModeCaps() throws Exception {
        when(client.searchRepositories(eq("Go"), anyString(), any(), isNull())).thenReturn(candidates("go", 25));
        when(client.searchByMarkerFile("render.yaml", 10, LocalDate.parse("2024-03-01"))).thenReturn(List.of());
        when(client.getOrganizationRepositories("render-examples")).thenReturn(candidates("org", 15));
        when(client.searchByTopic("render-blueprints")).thenReturn(candidates("topic", 12));
        when(orchestrator.analyze(anyList(), any())).thenReturn(new BatchResult(List.of()));
        when(extractor.extract(anyDouble(), anyInt())).thenReturn(List.of());
        when(analyticsLoader.load(anyList(), any())).thenReturn(new LoadResult(0, 0, 0, 0));

        pipeline(config("DEV", "Go,Python,TypeScript")).run();

        ArgumentCaptor<List<RepositoryCandidate>> batches = ArgumentCaptor.forClass(List.class);
        verify(orchestrator, times(2)).analyze(batches.capture(), any());
        assertEquals(10, batches.getAllValues().get(0).size());
        assertEquals(20, batches.getAllValues().get(1).size());
        verify(client, never()).searchRepositories(eq("Python"), anyString(), any(), any());
    }
}

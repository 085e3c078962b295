package com.trender.pipeline.connection;

import com.google.cloud.bigquery.BigQueryException;
import com.trender.pipeline.client.GitHubApiClient;
import com.trender.pipeline.client.RateLimitTracker;
import com.trender.pipeline.loader.BigQueryWarehouse;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ConnectionManager} verification, retry and release behavior.
 */
@ExtendWith(MockitoExtension.class)
class ConnectionManagerTest {

    private static final List<String> DATASETS = List.of("trender_raw", "trender_staging", "trender_analytics");

    @Mock
    private GitHubApiClient gitHub;

    @Mock
    private BigQueryWarehouse warehouse;

    private final List<Long> sleeps = new ArrayList<>();
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        manager = new ConnectionManager(gitHub, warehouse, ConnectionManager.defaultRetryPolicy(sleeps::add));
    }

    @Test
    @DisplayName("connect verifies the token and every dataset")
    void connect_success() throws Exception {
        when(gitHub.verifyCredentials()).thenReturn(true);
        when(gitHub.rateLimits()).thenReturn(new RateLimitTracker());
        when(warehouse.datasets()).thenReturn(DATASETS);
        when(warehouse.datasetExists(anyString())).thenReturn(true);

        manager.connect();

        for (String dataset : DATASETS) {
            verify(warehouse).datasetExists(dataset);
        }
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Rejected GitHub credentials fail before the warehouse is touched")
    void connect_badGitHubToken() throws Exception {
        when(gitHub.verifyCredentials()).thenReturn(false);

        assertThrows(ConnectionException.class, () -> manager.connect());
        verifyNoInteractions(warehouse);
    }

    @Test
    @DisplayName("Transient BigQuery errors are retried with backoff")
    void connect_retriesTransientErrors() throws Exception {
        when(gitHub.verifyCredentials()).thenReturn(true);
        when(gitHub.rateLimits()).thenReturn(new RateLimitTracker());
        when(warehouse.datasets()).thenReturn(DATASETS);
        when(warehouse.datasetExists("trender_raw"))
                .thenThrow(new BigQueryException(503, "backend unavailable"))
                .thenReturn(true);
        when(warehouse.datasetExists("trender_staging")).thenReturn(true);
        when(warehouse.datasetExists("trender_analytics")).thenReturn(true);

        manager.connect();

        assertEquals(List.of(1_000L), sleeps);
    }

    @Test
    @DisplayName("BigQuery authentication failures are not retried")
    void connect_authFailureNotRetried() throws Exception {
        when(gitHub.verifyCredentials()).thenReturn(true);
        when(gitHub.rateLimits()).thenReturn(new RateLimitTracker());
        when(warehouse.datasets()).thenReturn(DATASETS);
        when(warehouse.datasetExists("trender_raw")).thenThrow(new BigQueryException(403, "Access Denied"));

        ConnectionException ex = assertThrows(ConnectionException.class, () -> manager.connect());

        assertTrue(ex.getMessage().contains("rejected the credentials"));
        assertTrue(sleeps.isEmpty());
        verify(warehouse, times(1)).datasetExists("trender_raw");
    }

    @Test
    @DisplayName("Gives up after three transient failures")
    void connect_exhaustsRetries() throws Exception {
        when(gitHub.verifyCredentials()).thenReturn(true);
        when(gitHub.rateLimits()).thenReturn(new RateLimitTracker());
        when(warehouse.datasets()).thenReturn(DATASETS);
        when(warehouse.datasetExists("trender_raw")).thenThrow(new BigQueryException(500, "backend error"));

        assertThrows(ConnectionException.class, () -> manager.connect());
        assertEquals(List.of(1_000L, 2_000L), sleeps);
    }

    @Test
    @DisplayName("A missing dataset is a connection failure")
    void connect_missingDataset() throws Exception {
        when(gitHub.verifyCredentials()).thenReturn(true);
        when(gitHub.rateLimits()).thenReturn(new RateLimitTracker());
        when(warehouse.datasets()).thenReturn(DATASETS);
        when(warehouse.datasetExists("trender_raw")).thenReturn(false);

        ConnectionException ex = assertThrows(ConnectionException.class, () -> manager.connect());

        assertTrue(ex.getMessage().contains("trender_raw"));
    }

    @Test
    @DisplayName("close releases the HTTP client once and is safe to repeat")
    void close_isIdempotent() {
        when(gitHub.httpClient()).thenReturn(new OkHttpClient());

        manager.close();
        manager.close();

        assertTrue(manager.isClosed());
        verify(gitHub, times(1)).httpClient();
    }

    @Test
    @DisplayName("Server errors and I/O causes are transient; auth errors and client bugs are not")
    void isTransient_classification() {
        assertTrue(ConnectionManager.isTransient(new BigQueryException(503, "unavailable")));
        assertTrue(ConnectionManager.isTransient(new BigQueryException(0, "io", new IOException("reset"))));
        assertTrue(ConnectionManager.isTransient(new IOException("timeout")));
        assertFalse(ConnectionManager.isTransient(new BigQueryException(401, "unauthorized")));
        assertFalse(ConnectionManager.isTransient(new BigQueryException(403, "forbidden")));
        assertFalse(ConnectionManager.isTransient(new IllegalStateException("bug")));
    }
}

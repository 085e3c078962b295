package com.trender.pipeline.connection;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.BigQueryOptions;
import com.trender.pipeline.client.GitHubApiClient;
import com.trender.pipeline.config.AppConfig;
import com.trender.pipeline.loader.BigQueryWarehouse;
import com.trender.pipeline.retry.RetryPolicy;
import com.trender.pipeline.retry.Sleeper;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the two external sessions of a run: the GitHub HTTP client (with its
 * connection pool) and the BigQuery warehouse.
 *
 * <p>{@link #connect()} verifies both before any work starts. Rejected credentials
 * and missing datasets fail immediately; transient warehouse errors are retried with
 * exponential backoff. Use with try-with-resources so the HTTP pool is released on
 * every exit path.</p>
 */
public class ConnectionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    static final int CONNECT_ATTEMPTS = 3;
    static final long CONNECT_BACKOFF_MS = 1_000;
    static final long CONNECT_MAX_BACKOFF_MS = 10_000;

    private final GitHubApiClient gitHub;
    private final BigQueryWarehouse warehouse;
    private final RetryPolicy retryPolicy;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ConnectionManager(GitHubApiClient gitHub, BigQueryWarehouse warehouse, RetryPolicy retryPolicy) {
        this.gitHub = gitHub;
        this.warehouse = warehouse;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Builds the sessions from configuration and verifies them.
     */
    public static ConnectionManager open(AppConfig config) throws ConnectionException, InterruptedException {
        OkHttpClient httpClient = GitHubApiClient.defaultHttpClient(
                config.getHttpMaxIdleConnections(), config.getHttpKeepAliveMinutes());
        GitHubApiClient gitHub = new GitHubApiClient(config.getGithubToken(), httpClient);

        BigQuery bigQuery = BigQueryOptions.newBuilder()
                .setProjectId(config.getGcpProjectId())
                .build()
                .getService();
        BigQueryWarehouse warehouse = new BigQueryWarehouse(
                bigQuery, config.getGcpProjectId(), config.getDatasetPrefix());

        ConnectionManager manager = new ConnectionManager(gitHub, warehouse, defaultRetryPolicy(Sleeper.SYSTEM));
        try {
            manager.connect();
        } catch (ConnectionException | InterruptedException | RuntimeException e) {
            manager.close();
            throw e;
        }
        return manager;
    }

    static RetryPolicy defaultRetryPolicy(Sleeper sleeper) {
        return new RetryPolicy(CONNECT_ATTEMPTS, CONNECT_BACKOFF_MS, CONNECT_MAX_BACKOFF_MS,
                ConnectionManager::isTransient, sleeper);
    }

    /**
     * Verifies the GitHub token and that every warehouse dataset exists.
     */
    public void connect() throws ConnectionException, InterruptedException {
        if (!gitHub.verifyCredentials()) {
            throw new ConnectionException("GitHub rejected the access token or could not be reached");
        }
        logger.info("GitHub session ready ({} requests remaining)", gitHub.rateLimits().remaining());

        for (String dataset : warehouse.datasets()) {
            verifyDataset(dataset);
        }
        logger.info("Warehouse ready: {}", warehouse.datasets());
    }

    private void verifyDataset(String dataset) throws ConnectionException, InterruptedException {
        boolean exists;
        try {
            exists = retryPolicy.execute("Check dataset " + dataset, () -> warehouse.datasetExists(dataset));
        } catch (InterruptedException e) {
            throw e;
        } catch (BigQueryException e) {
            if (isAuthFailure(e)) {
                throw new ConnectionException("BigQuery rejected the credentials: " + e.getMessage(), e);
            }
            throw new ConnectionException("BigQuery unavailable while checking dataset " + dataset, e);
        } catch (Exception e) {
            throw new ConnectionException("Unexpected failure checking dataset " + dataset, e);
        }
        if (!exists) {
            throw new ConnectionException("Warehouse dataset " + dataset + " does not exist");
        }
    }

    /**
     * 5xx, retryable BigQuery errors and I/O causes are transient; authentication never is.
     */
    static boolean isTransient(Exception e) {
        if (e instanceof BigQueryException bq) {
            if (isAuthFailure(bq)) {
                return false;
            }
            return bq.getCode() >= 500 || bq.isRetryable() || bq.getCause() instanceof IOException;
        }
        return e instanceof IOException;
    }

    private static boolean isAuthFailure(BigQueryException e) {
        return e.getCode() == 401 || e.getCode() == 403;
    }

    public GitHubApiClient gitHub() {
        return gitHub;
    }

    public BigQueryWarehouse warehouse() {
        return warehouse;
    }

    /**
     * Evicts pooled HTTP connections and stops the dispatcher. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        OkHttpClient httpClient = gitHub.httpClient();
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        logger.info("Connections released");
    }

    public boolean isClosed() {
        return closed.get();
    }
}

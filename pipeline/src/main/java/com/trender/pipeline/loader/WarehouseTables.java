package com.trender.pipeline.loader;

/**
 * Table names of the three warehouse layers. The tables themselves are created
 * out-of-band; every streamed table carries an {@code ingestion_timestamp} column.
 */
public final class WarehouseTables {

    private WarehouseTables() {}

    // =========================================================================
    // Raw layer
    // =========================================================================

    public static final String RAW_GITHUB_REPOS = "raw_github_repos";

    // =========================================================================
    // Staging layer
    // =========================================================================

    public static final String STG_REPOS_VALIDATED = "stg_repos_validated";

    // =========================================================================
    // Analytics layer
    // =========================================================================

    public static final String DIM_REPOSITORIES = "dim_repositories";
    public static final String DIM_LANGUAGES = "dim_languages";
    public static final String DIM_RENDER_SERVICES = "dim_render_services";
    public static final String FACT_REPO_SNAPSHOTS = "fact_repo_snapshots";
    public static final String FACT_RENDER_USAGE = "fact_render_usage";
    public static final String FACT_WORKFLOW_EXECUTIONS = "fact_workflow_executions";
}

package com.trender.pipeline.orchestrator;

import com.trender.pipeline.config.AppConfig;
import com.trender.pipeline.connection.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Trender pipeline. Loads configuration, opens the
 * connections, runs one pipeline execution and exits with 0 on success, 1 otherwise.
 *
 * <p>Usage:
 * <pre>
 *   java -jar trender-pipeline.jar
 *   PIPELINE_MODE=DEV java -jar trender-pipeline.jar   # first language, 10 repos per list
 * </pre>
 */
public class PipelineApp {

    private static final Logger logger = LoggerFactory.getLogger(PipelineApp.class);

    public static void main(String[] args) {
        System.exit(run());
    }

    static int run() {
        try {
            AppConfig config = new AppConfig();
            try (ConnectionManager connections = ConnectionManager.open(config);
                 TrenderPipeline pipeline = TrenderPipeline.create(config, connections)) {

                PipelineSummary summary = pipeline.run();
                printSummary(summary);
                return summary.success() ? 0 : 1;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while connecting");
            return 1;
        } catch (Exception e) {
            logger.error("Fatal error, pipeline not run", e);
            return 1;
        }
    }

    private static void printSummary(PipelineSummary summary) {
        System.out.println();
        System.out.println("=== Trender Pipeline Summary ===");
        System.out.println("Repositories processed: " + summary.reposProcessed());
        System.out.printf("Elapsed:                %.1fs%n", summary.elapsedSeconds());
        System.out.println("Status:                 " + (summary.success() ? "SUCCESS" : "FAILED"));
        System.out.println();
    }
}

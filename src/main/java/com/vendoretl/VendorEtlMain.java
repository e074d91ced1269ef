package com.vendoretl;

import com.vendoretl.model.RunSummary;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point. Exit status: 0 when every city succeeded, 1 when at least one failed,
 * 2 when the configuration is unusable.
 */
@Slf4j
public class VendorEtlMain {

    public static final int EXIT_CONFIG_ERROR = 2;
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    public static void main(String[] args) {
        System.exit(run(System.getenv()));
    }

    static int run(Map<String, String> env) {
        EnvironmentConfig config;
        try {
            config = EnvironmentConfig.load(env);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        log.info("Loaded config: {}", config);

        try (PipelineOrchestrator orchestrator = PipelineOrchestrator.create(config)) {
            return runWithShutdownHook(orchestrator);
        }
    }

    // on SIGTERM the hook cancels the run and gives it a moment to log its summary
    private static int runWithShutdownHook(PipelineOrchestrator orchestrator) {
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            log.warn("Shutdown requested, cancelling run");
            orchestrator.cancel();
            try {
                if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Run did not finish within {} s of cancellation", SHUTDOWN_GRACE_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "vendor-etl-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            RunSummary summary = orchestrator.run();
            return summary.exitCode();
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, hook stays registered");
            }
        }
    }
}

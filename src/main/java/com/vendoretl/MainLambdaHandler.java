package com.vendoretl;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.ScheduledEvent;
import com.vendoretl.error.RunFailedException;
import com.vendoretl.model.RunSummary;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Lambda entry point for scheduled (EventBridge) runs.
 *
 * <p>The city list comes from {@code CITY_IDS}, unless the event's {@code detail.cityIds} names
 * its own. A run with any failed city fails the invocation.
 */
@Slf4j
public class MainLambdaHandler implements RequestHandler<ScheduledEvent, String> {

    // leave time to write the summary before Lambda kills the invocation
    private static final long TIMEOUT_MARGIN_MS = 10_000;

    private final Supplier<EnvironmentConfig> configLoader;
    private final Function<EnvironmentConfig, PipelineOrchestrator> orchestratorFactory;

    public MainLambdaHandler() {
        this(EnvironmentConfig::loadFromSystemEnv, PipelineOrchestrator::create);
    }

    MainLambdaHandler(Supplier<EnvironmentConfig> configLoader,
                      Function<EnvironmentConfig, PipelineOrchestrator> orchestratorFactory) {
        this.configLoader = configLoader;
        this.orchestratorFactory = orchestratorFactory;
    }

    @Override
    public String handleRequest(ScheduledEvent event, Context context) {
        long startTime = System.currentTimeMillis();
        LambdaLogger logger = context != null ? context.getLogger() : null;

        // 1. Load environment config
        EnvironmentConfig config = configLoader.get();
        lambdaLog(logger, "Loaded config: " + config);

        // 2. Pick the cities for this invocation
        List<String> cityIds = citiesFor(event, config);
        lambdaLog(logger, "Starting vendor snapshot for cities " + cityIds);

        // 3. Run the pipeline, cancelling it before the invocation times out
        RunSummary summary;
        try (PipelineOrchestrator orchestrator = orchestratorFactory.apply(config)) {
            CompletableFuture<Void> deadline = null;
            if (context != null && context.getRemainingTimeInMillis() > TIMEOUT_MARGIN_MS) {
                long cancelAfter = context.getRemainingTimeInMillis() - TIMEOUT_MARGIN_MS;
                deadline = CompletableFuture.runAsync(orchestrator::cancel,
                        CompletableFuture.delayedExecutor(cancelAfter, TimeUnit.MILLISECONDS));
            }
            try {
                summary = orchestrator.run(cityIds);
            } finally {
                if (deadline != null) {
                    deadline.cancel(false);
                }
            }
        }

        // 4. Log final summary
        String resultMsg = String.format("Invocation took %d ms. %s",
                System.currentTimeMillis() - startTime, summary.describe());
        lambdaLog(logger, "Lambda Execution Summary: " + resultMsg);
        log.info("Lambda execution completed. {}", resultMsg);

        if (!summary.isAllSucceeded()) {
            throw new RunFailedException(summary);
        }
        return resultMsg;
    }

    static List<String> citiesFor(ScheduledEvent event, EnvironmentConfig config) {
        Map<String, Object> detail = event == null ? null : event.getDetail();
        Object requested = detail == null ? null : detail.get("cityIds");
        if (requested instanceof Collection && !((Collection<?>) requested).isEmpty()) {
            return ((Collection<?>) requested).stream().map(String::valueOf).collect(Collectors.toList());
        }
        if (requested instanceof String && !((String) requested).isBlank()) {
            return EnvironmentConfig.splitList((String) requested, ",");
        }
        return config.getCityIds();
    }

    private static void lambdaLog(LambdaLogger logger, String message) {
        if (logger != null) {
            logger.log(message + "\n");
        }
    }
}

package com.vendoretl;

import com.fasterxml.jackson.databind.JsonNode;
import com.vendoretl.error.ErrorKind;
import com.vendoretl.error.FetchException;
import com.vendoretl.error.PipelineException;
import com.vendoretl.error.TransformException;
import com.vendoretl.model.CityJob;
import com.vendoretl.model.CityJobStatus;
import com.vendoretl.model.ObjectLocation;
import com.vendoretl.model.PartitionKey;
import com.vendoretl.model.RunSummary;
import com.vendoretl.model.VendorPage;
import com.vendoretl.model.VendorRow;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.s3.S3AsyncClient;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Drives every configured city through fetch, transform, optional enrichment, write and upload.
 *
 * <p>Each city is an independent chain of futures. A failing city is marked {@link CityJobStatus#FAILED}
 * and never affects its siblings; {@link #run(List)} returns only after every city has reached a
 * terminal state.
 */
@Slf4j
public class PipelineOrchestrator implements AutoCloseable {

    private final EnvironmentConfig config;
    private final VendorApiClient apiClient;
    private final VendorRecordTransformer transformer;
    private final ParquetVendorWriter writer;
    // null unless enrichment is enabled
    private final VendorEnricher enricher;
    // null in dry-run mode
    private final PartitionedS3Uploader uploader;
    private final ExecutorService workers;
    private final CancellationToken cancellation;
    private final Clock clock;
    private final List<AutoCloseable> resources;

    public PipelineOrchestrator(EnvironmentConfig config,
                                VendorApiClient apiClient,
                                VendorRecordTransformer transformer,
                                ParquetVendorWriter writer,
                                VendorEnricher enricher,
                                PartitionedS3Uploader uploader,
                                ExecutorService workers,
                                CancellationToken cancellation,
                                Clock clock) {
        this(config, apiClient, transformer, writer, enricher, uploader, workers, cancellation, clock, List.of());
    }

    private PipelineOrchestrator(EnvironmentConfig config,
                                 VendorApiClient apiClient,
                                 VendorRecordTransformer transformer,
                                 ParquetVendorWriter writer,
                                 VendorEnricher enricher,
                                 PartitionedS3Uploader uploader,
                                 ExecutorService workers,
                                 CancellationToken cancellation,
                                 Clock clock,
                                 List<AutoCloseable> resources) {
        this.config = config;
        this.apiClient = apiClient;
        this.transformer = transformer;
        this.writer = writer;
        this.enricher = enricher;
        this.uploader = uploader;
        this.workers = workers;
        this.cancellation = cancellation;
        this.clock = clock;
        this.resources = resources;
    }

    /**
     * Wires the production pipeline: JDK HTTP client for the vendor API, Netty-backed async S3
     * client for uploads, one worker pool sized to the concurrency ceiling.
     */
    public static PipelineOrchestrator create(EnvironmentConfig config) {
        config.validate();
        CancellationToken cancellation = new CancellationToken();
        ExecutorService workers = Executors.newFixedThreadPool(config.getMaxConcurrent(), namedDaemon("vendor-etl-worker"));
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(namedDaemon("vendor-etl-limiter"));
        RetryingExecutor retryingExecutor = new RetryingExecutor(BackoffPolicy.from(config), workers, cancellation);

        RateLimiter fetchLimiter = new RateLimiter("fetch", config.getMaxConcurrent(),
                config.getMaxRequestsPerWindow(), config.getRateWindow(), scheduler).bindTo(cancellation);
        VendorApiClient apiClient = new VendorApiClient(VendorApiClient.newHttpClient(config), config,
                fetchLimiter, retryingExecutor, cancellation);

        List<AutoCloseable> resources = new ArrayList<>();
        resources.add(scheduler::shutdownNow);
        PartitionedS3Uploader uploader = null;
        if (!config.isDryRun()) {
            S3AsyncClient s3 = S3ClientProvider.create(config);
            resources.add(s3);
            RateLimiter uploadLimiter = RateLimiter.concurrencyOnly("upload", config.getMaxConcurrent(), scheduler)
                    .bindTo(cancellation);
            uploader = new PartitionedS3Uploader(s3, config, uploadLimiter, retryingExecutor, cancellation);
        }

        Clock clock = Clock.systemUTC();
        VendorEnricher enricher = config.isEnrichVendors() ? new VendorEnricher(apiClient, clock) : null;

        return new PipelineOrchestrator(config, apiClient, new VendorRecordTransformer(),
                new ParquetVendorWriter(Paths.get(config.getScratchDir())), enricher, uploader, workers, cancellation,
                clock, resources);
    }

    public RunSummary run() {
        return run(config.getCityIds());
    }

    public RunSummary run(List<String> cityIds) {
        Instant runStartedAt = clock.instant();
        List<CityJob> jobs = cityIds.stream().map(CityJob::new).collect(Collectors.toList());
        log.info("Starting run at {} for {} cities: {}", runStartedAt, jobs.size(), cityIds);

        if (uploader != null && !bucketReachable(jobs)) {
            return summarize(runStartedAt, jobs);
        }

        List<CompletableFuture<Void>> pipelines = jobs.stream()
                .map(job -> processCity(job, runStartedAt))
                .collect(Collectors.toList());

        // every chain ends in handle(), so this only returns once all cities are terminal
        CompletableFuture.allOf(pipelines.toArray(new CompletableFuture[0])).join();

        return summarize(runStartedAt, jobs);
    }

    /**
     * Cancels the run in progress. In-flight requests are aborted and their cities end as
     * {@link ErrorKind#CANCELLED}.
     */
    public void cancel() {
        cancellation.cancel();
    }

    CompletableFuture<Void> processCity(CityJob job, Instant runStartedAt) {
        String cityId = job.getCityId();
        return CompletableFuture.runAsync(() -> startStage(job, CityJobStatus.FETCHING), workers)
                .thenCompose(ignored -> fetchAllPages(job, null, new ArrayList<>()))
                .thenApplyAsync(pages -> {
                    startStage(job, CityJobStatus.TRANSFORMING);
                    return transformPages(job, pages);
                }, workers)
                .thenCompose(rows -> enrich(job, rows))
                .thenApplyAsync(rows -> {
                    cancellation.throwIfCancelled();
                    Path file = writer.write(cityId, runStartedAt, rows);
                    return new WrittenSnapshot(file, rows.size());
                }, workers)
                .thenCompose(snapshot -> {
                    if (uploader == null) {
                        log.info("Dry run: leaving {} for city={} in place", snapshot.getFile(), cityId);
                        return CompletableFuture.completedFuture(new UploadedSnapshot(snapshot, null));
                    }
                    startStage(job, CityJobStatus.UPLOADING);
                    PartitionKey partition = PartitionKey.of(cityId, runStartedAt);
                    return uploader.upload(snapshot.getFile(), partition, runStartedAt)
                            .thenApply(location -> new UploadedSnapshot(snapshot, location));
                })
                .handle((uploaded, error) -> {
                    if (error != null) {
                        CityJobStatus stage = job.getStatus();
                        PipelineException failure = PipelineException.from(error);
                        job.fail(failure);
                        log.error("City {} failed during {} with {}: {}", cityId, stage, failure.getKind(), failure.getMessage(),
                                failure.getKind() == ErrorKind.INTERNAL ? failure : null);
                    } else {
                        job.complete(uploaded.getSnapshot().getRows(), uploaded.getLocation());
                        log.info("City {} done: {} rows, {} dropped, {} fetch attempts, location={}", cityId,
                                uploaded.getSnapshot().getRows(), job.getDropped(), job.getAttempts(),
                                uploaded.getLocation() == null ? uploaded.getSnapshot().getFile() : uploaded.getLocation().uri());
                    }
                    return null;
                });
    }

    // pages are requested strictly one after another: the cursor of page n comes from page n-1
    private CompletableFuture<List<FetchedPage>> fetchAllPages(CityJob job, String cursor, List<FetchedPage> pages) {
        cancellation.throwIfCancelled();
        return apiClient.fetchCityVendors(job.getCityId(), cursor, attempt -> job.recordAttempt())
                .thenCompose(page -> {
                    pages.add(new FetchedPage(page, clock.instant()));
                    if (!page.hasNext()) {
                        log.info("Fetched {} page(s) for city={}", pages.size(), job.getCityId());
                        return CompletableFuture.completedFuture(pages);
                    }
                    if (Objects.equals(page.getNextCursor(), cursor)) {
                        throw new FetchException(ErrorKind.FETCH_PERMANENT,
                                "Vendor API cursor did not advance past " + cursor + " for city=" + job.getCityId());
                    }
                    return fetchAllPages(job, page.getNextCursor(), pages);
                });
    }

    List<VendorRow> transformPages(CityJob job, List<FetchedPage> pages) {
        List<VendorRow> rows = new ArrayList<>();
        for (FetchedPage fetched : pages) {
            List<JsonNode> vendors = fetched.getPage().getVendors();
            int dropped = 0;
            for (JsonNode raw : vendors) {
                try {
                    rows.add(transformer.transform(raw, job.getCityId(), fetched.getFetchedAt()));
                } catch (TransformException e) {
                    dropped++;
                    log.warn("Dropping vendor record for city={} ({}): {}", job.getCityId(), e.getKind(), e.getMessage());
                }
            }
            job.addDropped(dropped);
            if (!vendors.isEmpty() && dropped > config.getMaxDroppedFraction() * vendors.size()) {
                throw new TransformException(ErrorKind.TRANSFORM_SYSTEMIC, String.format(
                        "Dropped %d of %d records on page cursor=%s for city=%s (limit %.0f%%)", dropped, vendors.size(),
                        fetched.getPage().getCursor(), job.getCityId(), config.getMaxDroppedFraction() * 100));
            }
        }
        return rows;
    }

    private CompletableFuture<List<VendorRow>> enrich(CityJob job, List<VendorRow> rows) {
        if (enricher == null || rows.isEmpty()) {
            return CompletableFuture.completedFuture(rows);
        }
        startStage(job, CityJobStatus.ENRICHING);
        return enricher.enrichAll(job, rows);
    }

    private void startStage(CityJob job, CityJobStatus stage) {
        cancellation.throwIfCancelled();
        job.transitionTo(stage);
    }

    private boolean bucketReachable(List<CityJob> jobs) {
        try {
            uploader.verifyBucket().join();
            return true;
        } catch (CompletionException e) {
            PipelineException failure = PipelineException.from(e);
            log.error("Aborting run before any city was processed: {}", failure.getMessage());
            jobs.forEach(job -> job.fail(failure));
            return false;
        }
    }

    private RunSummary summarize(Instant runStartedAt, List<CityJob> jobs) {
        RunSummary summary = new RunSummary(runStartedAt, Duration.between(runStartedAt, clock.instant()), jobs);
        if (summary.isAllSucceeded()) {
            log.info("Run summary: {}", summary.describe());
        } else {
            log.warn("Run summary: {}", summary.describe());
        }
        return summary;
    }

    @Override
    public void close() {
        workers.shutdown();
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close {}: {}", resource, e.getMessage(), e);
            }
        }
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Value
    static class FetchedPage {
        VendorPage page;
        Instant fetchedAt;
    }

    @Value
    private static class WrittenSnapshot {
        Path file;
        int rows;
    }

    @Value
    private static class UploadedSnapshot {
        WrittenSnapshot snapshot;
        ObjectLocation location;
    }
}

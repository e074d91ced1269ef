package com.vendoretl;

import com.fasterxml.jackson.databind.JsonNode;
import com.vendoretl.error.ErrorKind;
import com.vendoretl.error.PipelineException;
import com.vendoretl.model.CityJob;
import com.vendoretl.model.VendorRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

/**
 * Adds the detail document, ratings distribution and latest reviews to each listed vendor.
 *
 * <p>Vendors of one city are enriched one after another. Details come first: a vendor whose
 * details answer 400 keeps its listing columns and gets no ratings or reviews, while any other
 * details failure fails the city. Ratings and reviews are then fetched together and are best
 * effort, so a failure there only leaves the column empty.
 */
@Slf4j
@RequiredArgsConstructor
public class VendorEnricher {

    private final VendorApiClient apiClient;
    private final Clock clock;

    public CompletableFuture<List<VendorRow>> enrichAll(CityJob job, List<VendorRow> rows) {
        List<VendorRow> enriched = new ArrayList<>(rows.size());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (VendorRow row : rows) {
            chain = chain.thenCompose(ignored -> enrich(job, row)).thenAccept(enriched::add);
        }
        return chain.thenApply(ignored -> {
            log.info("Enriched {} vendor(s) for city={}, {} without details",
                    enriched.size(), job.getCityId(), job.getDetailsSkipped());
            return enriched;
        });
    }

    CompletableFuture<VendorRow> enrich(CityJob job, VendorRow row) {
        String cityId = row.getCityId();
        String code = row.getVendorId();
        Instant startedAt = clock.instant();
        IntConsumer attempts = attempt -> log.trace("vendor={} attempt {}", code, attempt);

        return apiClient.fetchVendorDetails(cityId, code, attempts)
                .thenCompose(details -> {
                    if (details.isEmpty()) {
                        job.recordDetailsSkipped();
                        log.info("No details for vendor {} in city={}, keeping the listing record", code, cityId);
                        return CompletableFuture.completedFuture(row.toBuilder()
                                .extractionStartedAt(startedAt)
                                .extractionCompletedAt(clock.instant())
                                .build());
                    }
                    return bestEffort(apiClient.fetchVendorRatings(cityId, code, attempts), "ratings", code)
                            .thenCombine(bestEffort(apiClient.fetchVendorReviews(cityId, code, attempts), "reviews", code),
                                    (ratings, reviews) -> row.toBuilder()
                                            .details(details.get().toString())
                                            .ratings(ratings)
                                            .reviews(reviews == null ? null : reviews.stream()
                                                    .map(JsonNode::toString)
                                                    .collect(Collectors.toList()))
                                            .extractionStartedAt(startedAt)
                                            .extractionCompletedAt(clock.instant())
                                            .build());
                });
    }

    // a cancelled run still fails the city
    private static <T> CompletableFuture<T> bestEffort(CompletableFuture<T> call, String what, String code) {
        return call.exceptionally(error -> {
            PipelineException failure = PipelineException.from(error);
            if (failure.getKind() == ErrorKind.CANCELLED) {
                throw failure;
            }
            log.warn("Leaving {} of vendor {} empty: {}", what, code, failure.getMessage());
            return null;
        });
    }
}

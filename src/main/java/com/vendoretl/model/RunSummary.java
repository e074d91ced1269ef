package com.vendoretl.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Terminal state of every city job of one run.
 */
@Value
public class RunSummary {
    public static final int EXIT_OK = 0;
    public static final int EXIT_CITY_FAILED = 1;

    Instant startedAt;
    Duration elapsed;
    List<CityJob> jobs;

    public long getSucceeded() {
        return jobs.stream().filter(CityJob::isSucceeded).count();
    }

    public long getFailed() {
        return jobs.size() - getSucceeded();
    }

    public long getDroppedRecords() {
        return jobs.stream().mapToLong(CityJob::getDropped).sum();
    }

    public boolean isAllSucceeded() {
        return getFailed() == 0;
    }

    public int exitCode() {
        return isAllSucceeded() ? EXIT_OK : EXIT_CITY_FAILED;
    }

    public String describe() {
        String header = String.format("Processed %d cities in %d ms. Succeeded=%d, Failed=%d, DroppedRecords=%d",
                jobs.size(), elapsed.toMillis(), getSucceeded(), getFailed(), getDroppedRecords());
        String failures = jobs.stream()
                .filter(job -> !job.isSucceeded())
                .map(job -> String.format("city=%s error=%s: %s", job.getCityId(), job.getLastError(), job.getFailureMessage()))
                .collect(Collectors.joining("; "));
        return failures.isEmpty() ? header : header + ". Failures: " + failures;
    }
}

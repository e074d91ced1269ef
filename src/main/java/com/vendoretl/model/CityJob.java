package com.vendoretl.model;

import com.vendoretl.error.ErrorKind;
import com.vendoretl.error.PipelineException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pipeline state of one city for one run.
 *
 * <p>Only one stage works on a job at a time, but consecutive stages may run on different
 * threads, so every field is either volatile or atomic.
 */
@Slf4j
@Getter
@ToString
public class CityJob {

    private final String cityId;
    private volatile CityJobStatus status = CityJobStatus.PENDING;
    @Getter(AccessLevel.NONE)
    private final AtomicInteger attemptCount = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final AtomicInteger droppedRecords = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final AtomicInteger detailsSkipped = new AtomicInteger();
    private volatile int rowCount;
    private volatile ErrorKind lastError;
    private volatile String failureMessage;
    private volatile ObjectLocation location;

    public CityJob(String cityId) {
        this.cityId = cityId;
    }

    public synchronized void transitionTo(CityJobStatus next) {
        if (status.isTerminal()) {
            throw new IllegalStateException("City " + cityId + " is already " + status + ", cannot move to " + next);
        }
        if (next == CityJobStatus.FAILED) {
            throw new IllegalArgumentException("Use fail() to mark a city job as failed");
        }
        if (next.ordinal() <= status.ordinal()) {
            throw new IllegalStateException("City " + cityId + " cannot go back from " + status + " to " + next);
        }
        log.debug("city={} {} -> {}", cityId, status, next);
        status = next;
    }

    public synchronized void fail(PipelineException error) {
        if (status.isTerminal()) {
            log.warn("Ignoring failure for city={} already in {}: {}", cityId, status, error.getMessage());
            return;
        }
        log.debug("city={} {} -> FAILED ({})", cityId, status, error.getKind());
        lastError = error.getKind();
        failureMessage = error.getMessage();
        status = CityJobStatus.FAILED;
    }

    public void complete(int rows, ObjectLocation uploadedTo) {
        this.rowCount = rows;
        this.location = uploadedTo;
        transitionTo(CityJobStatus.DONE);
    }

    public int recordAttempt() {
        return attemptCount.incrementAndGet();
    }

    public void addDropped(int count) {
        droppedRecords.addAndGet(count);
    }

    public void recordDetailsSkipped() {
        detailsSkipped.incrementAndGet();
    }

    public int getAttempts() {
        return attemptCount.get();
    }

    public int getDropped() {
        return droppedRecords.get();
    }

    /** Vendors whose details answered 400 and that kept only their listing columns. */
    public int getDetailsSkipped() {
        return detailsSkipped.get();
    }

    public boolean isSucceeded() {
        return status == CityJobStatus.DONE;
    }
}

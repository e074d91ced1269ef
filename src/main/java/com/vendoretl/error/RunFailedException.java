package com.vendoretl.error;

import com.vendoretl.model.RunSummary;

/**
 * Thrown by the Lambda entry point when at least one city failed, so the invocation is
 * reported as failed.
 */
public class RunFailedException extends RuntimeException {

    private final transient RunSummary summary;

    public RunFailedException(RunSummary summary) {
        super(summary.describe());
        this.summary = summary;
    }

    public RunSummary getSummary() {
        return summary;
    }
}

package com.vendoretl.model;

public enum CityJobStatus {
    PENDING,
    FETCHING,
    TRANSFORMING,
    ENRICHING,
    UPLOADING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}

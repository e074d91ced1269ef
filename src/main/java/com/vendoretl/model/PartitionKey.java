package com.vendoretl.model;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Hive-style partition of one city's snapshot, keyed by the UTC date the run started on.
 */
@Value
public class PartitionKey {
    private static final String FILE_EXTENSION = "parquet";

    String cityId;
    int year;
    int month;
    int day;

    public static PartitionKey of(String cityId, Instant runStartedAt) {
        LocalDate date = runStartedAt.atZone(ZoneOffset.UTC).toLocalDate();
        return new PartitionKey(cityId, date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /** e.g. {@code city_id=69036/year=2026/month=03/day=07} */
    public String prefix() {
        return String.format("city_id=%s/year=%04d/month=%02d/day=%02d", cityId, year, month, day);
    }

    public String objectKey(Instant runStartedAt) {
        return prefix() + "/" + fileName(runStartedAt);
    }

    public static String fileName(Instant runStartedAt) {
        return "vendors_" + runStartedAt.toEpochMilli() + "." + FILE_EXTENSION;
    }
}

package com.vendoretl.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One vendor in the fixed columnar schema. Identity columns and the timestamps are always
 * present; everything else is nullable. The enrichment columns stay empty unless per-vendor
 * enrichment ran and the vendor had details.
 */
@Value
@Builder(toBuilder = true)
public class VendorRow {
    @NonNull
    String vendorId;
    @NonNull
    String name;
    @NonNull
    String cityId;

    Double rating;
    Double deliveryFee;
    List<String> categories;
    Double latitude;
    Double longitude;

    @NonNull
    Instant fetchedAt;

    // raw JSON of the vendor detail document
    String details;
    RatingsDistribution ratings;
    // raw JSON, one entry per review
    List<String> reviews;

    @NonNull
    Instant extractionStartedAt;
    @NonNull
    Instant extractionCompletedAt;
}

package com.vendoretl;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable run configuration, read once from environment variables before the pipeline starts.
 */
@Value
@Builder(toBuilder = true)
public class EnvironmentConfig {
    public static final String DEFAULT_API_BASE_URL = "https://disco.deliveryhero.io/listing/api/v1/pandora/vendors";
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (X11; Linux x86_64; rv:135.0) Gecko/20100101 Firefox/135.0";
    public static final String DEFAULT_VENDOR_DETAILS_URL = "https://pk.fd-api.com/api/v5/vendors/{code}"
            + "?include=menus,bundles,multiple_discounts&language_id=1&opening_type=delivery&basket_currency=PKR";
    public static final String DEFAULT_VENDOR_RATINGS_URL =
            "https://reviews-api-pk.fd-api.com/ratings-distribution/vendor/{code}?global_entity_id=FP_PK";
    public static final String DEFAULT_VENDOR_REVIEWS_URL = "https://reviews-api-pk.fd-api.com/reviews/vendor/{code}"
            + "?global_entity_id=FP_PK&limit=30&created_at=desc&has_dish=true";
    /** Replaced by the URL-encoded vendor code in the per-vendor URLs. */
    public static final String VENDOR_CODE_PLACEHOLDER = "{code}";
    private static final long MIB = 1024L * 1024L;

    @Singular
    List<String> cityIds;

    // upstream API
    @Builder.Default
    String apiBaseUrl = DEFAULT_API_BASE_URL;
    @Singular
    Map<String, String> apiHeaders;
    @Singular
    Map<String, String> apiQueryParams;
    @Singular
    List<String> userAgents;
    @Builder.Default
    int pageSize = 48;

    // per-vendor enrichment, off unless ENRICH_VENDORS is set
    boolean enrichVendors;
    @Builder.Default
    String vendorDetailsUrl = DEFAULT_VENDOR_DETAILS_URL;
    @Builder.Default
    String vendorRatingsUrl = DEFAULT_VENDOR_RATINGS_URL;
    @Builder.Default
    String vendorReviewsUrl = DEFAULT_VENDOR_REVIEWS_URL;

    // scheduling
    @Builder.Default
    int maxConcurrent = 4;
    @Builder.Default
    int maxRequestsPerWindow = 10;
    @Builder.Default
    Duration rateWindow = Duration.ofSeconds(1);

    // retry
    @Builder.Default
    Duration retryBaseDelay = Duration.ofSeconds(1);
    @Builder.Default
    Duration retryMaxDelay = Duration.ofSeconds(30);
    @Builder.Default
    int maxRetries = 3;
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);

    @Builder.Default
    double maxDroppedFraction = 0.5;

    // object storage
    String s3Endpoint;
    @Builder.Default
    String s3Region = "us-east-1";
    String s3AccessKey;
    String s3SecretKey;
    String s3Bucket;
    @Builder.Default
    boolean s3PathStyle = true;
    @Builder.Default
    long multipartThresholdBytes = 8 * MIB;
    @Builder.Default
    long multipartPartSizeBytes = 8 * MIB;

    @Builder.Default
    String scratchDir = "data";
    boolean dryRun;

    public static EnvironmentConfig loadFromSystemEnv() {
        return load(System.getenv());
    }

    /**
     * Builds a config from an environment-style map.
     *
     * @throws IllegalArgumentException when a required variable is missing or a value does not parse
     */
    public static EnvironmentConfig load(Map<String, String> env) {
        EnvironmentConfigBuilder builder = EnvironmentConfig.builder();

        List<String> cities = splitList(env.get("CITY_IDS"), ",");
        if (cities.isEmpty()) {
            throw new IllegalArgumentException("CITY_IDS must list at least one city id");
        }
        builder.cityIds(cities);

        builder.apiBaseUrl(getenvOrDefault(env, "API_BASE_URL", DEFAULT_API_BASE_URL));
        builder.apiHeaders(splitPairs(env.get("API_HEADERS")));
        builder.apiQueryParams(splitPairs(getenvOrDefault(env, "API_QUERY_PARAMS",
                "country=pk;language_id=1;vertical=restaurants")));
        List<String> agents = splitList(env.get("API_USER_AGENTS"), "\\|");
        builder.userAgents(agents.isEmpty() ? List.of(DEFAULT_USER_AGENT) : agents);
        builder.pageSize(intValue(env, "PAGE_SIZE", 48));

        builder.enrichVendors(Boolean.parseBoolean(env.get("ENRICH_VENDORS")));
        builder.vendorDetailsUrl(getenvOrDefault(env, "VENDOR_DETAILS_URL", DEFAULT_VENDOR_DETAILS_URL));
        builder.vendorRatingsUrl(getenvOrDefault(env, "VENDOR_RATINGS_URL", DEFAULT_VENDOR_RATINGS_URL));
        builder.vendorReviewsUrl(getenvOrDefault(env, "VENDOR_REVIEWS_URL", DEFAULT_VENDOR_REVIEWS_URL));

        builder.maxConcurrent(intValue(env, "MAX_CONCURRENT", 4));
        builder.maxRequestsPerWindow(intValue(env, "MAX_REQUESTS_PER_WINDOW", 10));
        builder.rateWindow(Duration.ofMillis(longValue(env, "RATE_WINDOW_MS", 1000)));

        builder.retryBaseDelay(Duration.ofMillis(longValue(env, "RETRY_BASE_DELAY_MS", 1000)));
        builder.retryMaxDelay(Duration.ofMillis(longValue(env, "RETRY_MAX_DELAY_MS", 30_000)));
        builder.maxRetries(intValue(env, "MAX_RETRIES", 3));
        builder.requestTimeout(Duration.ofMillis(longValue(env, "REQUEST_TIMEOUT_MS", 30_000)));
        builder.maxDroppedFraction(doubleValue(env, "MAX_DROPPED_FRACTION", 0.5));

        builder.s3Endpoint(emptyToNull(env.get("S3_ENDPOINT")));
        builder.s3Region(getenvOrDefault(env, "S3_REGION", "us-east-1"));
        builder.s3AccessKey(emptyToNull(env.get("S3_ACCESS_KEY")));
        builder.s3SecretKey(emptyToNull(env.get("S3_SECRET_KEY")));
        builder.s3Bucket(emptyToNull(env.get("S3_BUCKET")));
        builder.s3PathStyle(Boolean.parseBoolean(getenvOrDefault(env, "S3_PATH_STYLE", "true")));
        builder.multipartThresholdBytes(longValue(env, "MULTIPART_THRESHOLD_BYTES", 8 * MIB));
        builder.multipartPartSizeBytes(longValue(env, "MULTIPART_PART_SIZE_BYTES", 8 * MIB));

        builder.scratchDir(getenvOrDefault(env, "SCRATCH_DIR", "data"));
        builder.dryRun(Boolean.parseBoolean(env.get("DRY_RUN")));

        EnvironmentConfig config = builder.build();
        config.validate();
        return config;
    }

    public void validate() {
        require(!cityIds.isEmpty(), "at least one city id is required");
        require(pageSize > 0, "PAGE_SIZE must be positive");
        require(maxConcurrent > 0, "MAX_CONCURRENT must be positive");
        require(maxRetries >= 1, "MAX_RETRIES must be at least 1 (it counts the first attempt)");
        require(requestTimeout != null && !requestTimeout.isNegative() && !requestTimeout.isZero(),
                "REQUEST_TIMEOUT_MS must be positive");
        require(!retryBaseDelay.isNegative() && !retryMaxDelay.isNegative(), "retry delays must not be negative");
        require(maxDroppedFraction >= 0.0 && maxDroppedFraction <= 1.0, "MAX_DROPPED_FRACTION must be within [0, 1]");
        // S3 requires every part but the last to be at least 5 MiB
        require(multipartPartSizeBytes >= 5 * MIB, "MULTIPART_PART_SIZE_BYTES must be at least 5 MiB");
        require(!enrichVendors || (vendorDetailsUrl.contains(VENDOR_CODE_PLACEHOLDER)
                        && vendorRatingsUrl.contains(VENDOR_CODE_PLACEHOLDER)
                        && vendorReviewsUrl.contains(VENDOR_CODE_PLACEHOLDER)),
                "VENDOR_*_URL must contain " + VENDOR_CODE_PLACEHOLDER);
        require(dryRun || s3Bucket != null, "S3_BUCKET is required unless DRY_RUN is set");
        require((s3AccessKey == null) == (s3SecretKey == null), "S3_ACCESS_KEY and S3_SECRET_KEY must be set together");
    }

    @Override
    public String toString() {
        // credentials stay out of logs
        return "EnvironmentConfig(cities=" + cityIds
                + ", apiBaseUrl=" + apiBaseUrl
                + ", pageSize=" + pageSize
                + ", enrichVendors=" + enrichVendors
                + ", maxConcurrent=" + maxConcurrent
                + ", maxRequestsPerWindow=" + maxRequestsPerWindow + "/" + rateWindow.toMillis() + "ms"
                + ", retries=" + maxRetries + " [" + retryBaseDelay.toMillis() + ".." + retryMaxDelay.toMillis() + "ms]"
                + ", s3=" + (s3Endpoint == null ? "aws" : s3Endpoint) + "/" + s3Bucket
                + ", scratchDir=" + scratchDir
                + ", dryRun=" + dryRun + ")";
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid configuration: " + message);
        }
    }

    private static String getenvOrDefault(Map<String, String> env, String key, String defaultVal) {
        String val = env.get(key);
        return (val != null && !val.isEmpty()) ? val : defaultVal;
    }

    private static String emptyToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }

    private static int intValue(Map<String, String> env, String key, int defaultVal) {
        long val = longValue(env, key, defaultVal);
        if (val < Integer.MIN_VALUE || val > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " is out of range: " + val);
        }
        return (int) val;
    }

    private static long longValue(Map<String, String> env, String key, long defaultVal) {
        String val = env.get(key);
        if (val == null || val.isBlank()) {
            return defaultVal;
        }
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + val, e);
        }
    }

    private static double doubleValue(Map<String, String> env, String key, double defaultVal) {
        String val = env.get(key);
        if (val == null || val.isBlank()) {
            return defaultVal;
        }
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + val, e);
        }
    }

    static List<String> splitList(String value, String separatorRegex) {
        if (value == null || value.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(value.split(separatorRegex))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /** Parses {@code k1=v1;k2=v2}, keeping declaration order. */
    static Map<String, String> splitPairs(String value) {
        Map<String, String> pairs = new LinkedHashMap<>();
        for (String entry : splitList(value, ";")) {
            int eq = entry.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Expected key=value but got: " + entry);
            }
            pairs.put(entry.substring(0, eq).trim(), entry.substring(eq + 1).trim());
        }
        return pairs;
    }
}

package com.vendoretl;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvironmentConfigTest {

    private static Map<String, String> minimalEnv() {
        Map<String, String> env = new HashMap<>();
        env.put("CITY_IDS", "69036, 69037 ,,69038");
        env.put("S3_BUCKET", "vendor-snapshots");
        return env;
    }

    @Test
    void testDefaults() {
        EnvironmentConfig config = EnvironmentConfig.load(minimalEnv());

        assertEquals(List.of("69036", "69037", "69038"), config.getCityIds());
        assertEquals(EnvironmentConfig.DEFAULT_API_BASE_URL, config.getApiBaseUrl());
        assertEquals(Map.of("country", "pk", "language_id", "1", "vertical", "restaurants"), config.getApiQueryParams());
        assertEquals(List.of(EnvironmentConfig.DEFAULT_USER_AGENT), config.getUserAgents());
        assertEquals(48, config.getPageSize());
        assertEquals(4, config.getMaxConcurrent());
        assertEquals(10, config.getMaxRequestsPerWindow());
        assertEquals(Duration.ofSeconds(1), config.getRetryBaseDelay());
        assertEquals(Duration.ofSeconds(30), config.getRetryMaxDelay());
        assertEquals(3, config.getMaxRetries());
        assertEquals(Duration.ofSeconds(30), config.getRequestTimeout());
        assertFalse(config.isEnrichVendors());
        assertEquals(EnvironmentConfig.DEFAULT_VENDOR_DETAILS_URL, config.getVendorDetailsUrl());
        assertEquals("us-east-1", config.getS3Region());
        assertNull(config.getS3Endpoint());
        assertTrue(config.isS3PathStyle());
        assertFalse(config.isDryRun());
        assertEquals("data", config.getScratchDir());
    }

    @Test
    void testOverrides() {
        Map<String, String> env = minimalEnv();
        env.put("API_HEADERS", "X-Disco-Client-Id=web; perseus-client-id=abc");
        env.put("API_USER_AGENTS", "agent-a | agent-b");
        env.put("MAX_CONCURRENT", "8");
        env.put("RETRY_BASE_DELAY_MS", "250");
        env.put("MAX_DROPPED_FRACTION", "0.1");
        env.put("S3_ENDPOINT", "http://localhost:9000");
        env.put("S3_ACCESS_KEY", "minioadmin");
        env.put("S3_SECRET_KEY", "minioadmin-secret");

        EnvironmentConfig config = EnvironmentConfig.load(env);

        assertEquals("web", config.getApiHeaders().get("X-Disco-Client-Id"));
        assertEquals("abc", config.getApiHeaders().get("perseus-client-id"));
        assertEquals(List.of("agent-a", "agent-b"), config.getUserAgents());
        assertEquals(8, config.getMaxConcurrent());
        assertEquals(Duration.ofMillis(250), config.getRetryBaseDelay());
        assertEquals(0.1, config.getMaxDroppedFraction());
        assertEquals("http://localhost:9000", config.getS3Endpoint());
    }

    @Test
    void testEnrichmentSettings() {
        Map<String, String> env = minimalEnv();
        env.put("ENRICH_VENDORS", "true");
        env.put("VENDOR_RATINGS_URL", "http://localhost:8080/ratings/{code}");

        EnvironmentConfig config = EnvironmentConfig.load(env);

        assertTrue(config.isEnrichVendors());
        assertEquals("http://localhost:8080/ratings/{code}", config.getVendorRatingsUrl());
        assertEquals(EnvironmentConfig.DEFAULT_VENDOR_REVIEWS_URL, config.getVendorReviewsUrl());
    }

    @Test
    void testToStringHidesCredentials() {
        Map<String, String> env = minimalEnv();
        env.put("S3_ACCESS_KEY", "AKIAEXAMPLE");
        env.put("S3_SECRET_KEY", "very-secret");

        String text = EnvironmentConfig.load(env).toString();

        assertFalse(text.contains("AKIAEXAMPLE"));
        assertFalse(text.contains("very-secret"));
        assertTrue(text.contains("vendor-snapshots"));
    }

    @Test
    void testMissingCitiesIsRejected() {
        Map<String, String> env = minimalEnv();
        env.put("CITY_IDS", " , ");

        assertThrows(IllegalArgumentException.class, () -> EnvironmentConfig.load(env));
    }

    @Test
    void testBucketRequiredUnlessDryRun() {
        Map<String, String> env = minimalEnv();
        env.remove("S3_BUCKET");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> EnvironmentConfig.load(env));
        assertTrue(e.getMessage().contains("S3_BUCKET"));

        env.put("DRY_RUN", "true");
        assertTrue(EnvironmentConfig.load(env).isDryRun());
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertInvalid("MAX_CONCURRENT", "0");
        assertInvalid("MAX_CONCURRENT", "four");
        assertInvalid("PAGE_SIZE", "-1");
        assertInvalid("MAX_RETRIES", "-1");
        // the budget counts the first attempt, so there must be one
        assertInvalid("MAX_RETRIES", "0");
        assertInvalid("REQUEST_TIMEOUT_MS", "0");
        assertInvalid("REQUEST_TIMEOUT_MS", "-5");
        // would wrap to a negative int
        assertInvalid("MAX_CONCURRENT", "4294967297");
        assertInvalid("PAGE_SIZE", "99999999999");
        assertInvalid("MAX_DROPPED_FRACTION", "1.5");
        assertInvalid("MULTIPART_PART_SIZE_BYTES", "1024");
        assertInvalid("API_HEADERS", "no-equals-sign");
        assertInvalid("S3_ACCESS_KEY", "only-half");
    }

    @Test
    void testEnrichmentUrlsNeedVendorCode() {
        Map<String, String> env = minimalEnv();
        env.put("ENRICH_VENDORS", "true");
        env.put("VENDOR_DETAILS_URL", "http://localhost:8080/vendors/fixed");

        assertThrows(IllegalArgumentException.class, () -> EnvironmentConfig.load(env));

        env.remove("ENRICH_VENDORS");
        assertEquals("http://localhost:8080/vendors/fixed", EnvironmentConfig.load(env).getVendorDetailsUrl());
    }

    @Test
    void testSplitHelpers() {
        assertEquals(List.of("a", "b"), EnvironmentConfig.splitList(" a ,b, ", ","));
        assertTrue(EnvironmentConfig.splitList(null, ",").isEmpty());
        assertEquals(Map.of("k", "v=w"), EnvironmentConfig.splitPairs("k=v=w"));
    }

    private static void assertInvalid(String key, String value) {
        Map<String, String> env = minimalEnv();
        env.put(key, value);
        assertThrows(IllegalArgumentException.class, () -> EnvironmentConfig.load(env), key + "=" + value);
    }
}

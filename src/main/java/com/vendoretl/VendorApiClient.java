package com.vendoretl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vendoretl.error.ErrorKind;
import com.vendoretl.error.FetchException;
import com.vendoretl.error.PipelineException;
import com.vendoretl.model.RatingsDistribution;
import com.vendoretl.model.VendorPage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

/**
 * Reads one city's vendor listing page by page.
 *
 * <p>The listing is offset based; the cursor handed to callers is the decimal offset of the next
 * page. Every attempt takes a permit from the shared {@link RateLimiter} and gives it back as soon
 * as the response (or failure) arrives, so backoff delays never hold a permit.
 *
 * <p>The per-vendor detail, ratings and reviews endpoints go through the same limiter, retry
 * policy and user agent rotation as the listing.
 */
@Slf4j
public class VendorApiClient {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final HttpClient httpClient;
    private final EnvironmentConfig config;
    private final RateLimiter rateLimiter;
    private final RetryingExecutor retryingExecutor;
    private final CancellationToken cancellation;
    private final UserAgentRotation userAgents;

    public VendorApiClient(HttpClient httpClient,
                           EnvironmentConfig config,
                           RateLimiter rateLimiter,
                           RetryingExecutor retryingExecutor,
                           CancellationToken cancellation) {
        this.httpClient = httpClient;
        this.config = config;
        this.rateLimiter = rateLimiter;
        this.retryingExecutor = retryingExecutor;
        this.cancellation = cancellation;
        this.userAgents = new UserAgentRotation(config.getUserAgents().isEmpty()
                ? List.of(EnvironmentConfig.DEFAULT_USER_AGENT)
                : config.getUserAgents());
    }

    public static HttpClient newHttpClient(EnvironmentConfig config) {
        return HttpClient.newBuilder()
                .connectTimeout(config.getRequestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Fetches the page at {@code cursor} ({@code null} for the first page), retrying rate-limited
     * and transient failures.
     *
     * @param attemptListener told about every attempt, retries included
     */
    public CompletableFuture<VendorPage> fetchCityVendors(String cityId, String cursor, IntConsumer attemptListener) {
        String description = "Fetch city=" + cityId + " cursor=" + (cursor == null ? "start" : cursor);
        return retryingExecutor.execute(description,
                () -> rateLimiter.withPermit(cityId, () -> fetchOnce(cityId, cursor)),
                attemptListener);
    }

    /** One attempt, no permit and no retry. */
    CompletableFuture<VendorPage> fetchOnce(String cityId, String cursor) {
        int offset;
        HttpRequest request;
        try {
            offset = parseCursor(cursor);
            request = buildRequest(cityId, offset);
        } catch (PipelineException e) {
            return CompletableFuture.failedFuture(e);
        } catch (IllegalArgumentException e) {
            // e.g. a restricted or malformed configured header
            return CompletableFuture.failedFuture(new FetchException(ErrorKind.FETCH_PERMANENT,
                    "Cannot build request for city=" + cityId + ": " + e.getMessage(), e));
        }
        return send(cityId, request, response -> toPage(cityId, cursor, offset, response));
    }

    /**
     * Fetches the detail document of one vendor. A 400 means the vendor has no usable details and
     * yields an empty result rather than a failure. A 403 is retried like throttling, so the next
     * attempt goes out under another user agent.
     */
    public CompletableFuture<Optional<JsonNode>> fetchVendorDetails(String cityId, String vendorCode,
                                                                    IntConsumer attemptListener) {
        return retryingExecutor.execute("Fetch details of vendor " + vendorCode,
                () -> rateLimiter.withPermit(cityId, () -> getVendorResource(cityId, config.getVendorDetailsUrl(),
                        vendorCode, response -> readDetails(vendorCode, response))),
                attemptListener);
    }

    public CompletableFuture<RatingsDistribution> fetchVendorRatings(String cityId, String vendorCode,
                                                                     IntConsumer attemptListener) {
        return retryingExecutor.execute("Fetch ratings of vendor " + vendorCode,
                () -> rateLimiter.withPermit(cityId, () -> getVendorResource(cityId, config.getVendorRatingsUrl(),
                        vendorCode, response -> readRatings(vendorCode, response))),
                attemptListener);
    }

    /** Latest reviews of one vendor, as raw JSON objects. */
    public CompletableFuture<List<JsonNode>> fetchVendorReviews(String cityId, String vendorCode,
                                                                IntConsumer attemptListener) {
        return retryingExecutor.execute("Fetch reviews of vendor " + vendorCode,
                () -> rateLimiter.withPermit(cityId, () -> getVendorResource(cityId, config.getVendorReviewsUrl(),
                        vendorCode, response -> readReviews(vendorCode, response))),
                attemptListener);
    }

    <T> CompletableFuture<T> getVendorResource(String cityId, String urlTemplate, String vendorCode,
                                               Function<HttpResponse<String>, T> reader) {
        HttpRequest request;
        try {
            URI uri = URI.create(urlTemplate.replace(EnvironmentConfig.VENDOR_CODE_PLACEHOLDER, encodePathSegment(vendorCode)));
            request = newRequest(uri).build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new FetchException(ErrorKind.FETCH_PERMANENT,
                    "Cannot build request for vendor " + vendorCode + ": " + e.getMessage(), e));
        }
        return send(cityId, request, reader);
    }

    private <T> CompletableFuture<T> send(String cityId, HttpRequest request, Function<HttpResponse<String>, T> reader) {
        log.debug("GET {}", request.uri());
        return cancellation.register(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
                .handle((response, error) -> {
                    if (error != null) {
                        throw transportFailure(cityId, error);
                    }
                    return reader.apply(response);
                });
    }

    HttpRequest buildRequest(String cityId, int offset) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("city_id", cityId);
        params.put("offset", Integer.toString(offset));
        params.put("limit", Integer.toString(config.getPageSize()));
        config.getApiQueryParams().forEach(params::putIfAbsent);

        String query = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));

        return newRequest(URI.create(config.getApiBaseUrl() + "?" + query)).build();
    }

    private HttpRequest.Builder newRequest(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(config.getRequestTimeout())
                .header("Accept", "application/json")
                .header("User-Agent", userAgents.next());
        config.getApiHeaders().forEach(builder::header);
        return builder;
    }

    private VendorPage toPage(String cityId, String cursor, int offset, HttpResponse<String> response) {
        int status = response.statusCode();
        log.debug("city={} offset={} status={}", cityId, offset, status);

        ErrorKind failure = classifyStatus(status);
        if (failure != null) {
            throw new FetchException(failure,
                    "Vendor API returned " + status + " for city=" + cityId + " offset=" + offset, status, null);
        }
        return parsePage(cityId, cursor, offset, response.body());
    }

    VendorPage parsePage(String cityId, String cursor, int offset, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new FetchException(ErrorKind.FETCH_PERMANENT, "Unparseable vendor page for city=" + cityId, e);
        }
        JsonNode data = root == null ? null : root.path("data");
        JsonNode items = data == null ? null : data.path("items");
        if (items == null || !items.isArray()) {
            throw new FetchException(ErrorKind.FETCH_PERMANENT, "Vendor page for city=" + cityId + " has no data.items array");
        }

        List<JsonNode> vendors = new ArrayList<>(items.size());
        items.forEach(vendors::add);

        int available = data.path("available_count").asInt(-1);
        String next = null;
        if (!vendors.isEmpty()) {
            int nextOffset = offset + vendors.size();
            boolean more = available >= 0 ? nextOffset < available : vendors.size() >= config.getPageSize();
            if (more) {
                next = Integer.toString(nextOffset);
            }
        }
        log.debug("city={} offset={} returned={} available={} next={}", cityId, offset, vendors.size(), available, next);
        return new VendorPage(cityId, cursor, vendors, next);
    }

    private Optional<JsonNode> readDetails(String vendorCode, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 400) {
            log.debug("Vendor {} has no details (400)", vendorCode);
            return Optional.empty();
        }
        String what = "details of vendor " + vendorCode;
        requireSuccess(status == 403 ? ErrorKind.FETCH_RATE_LIMITED : classifyStatus(status), status, what);
        JsonNode data = readJson(response.body(), what).path("data");
        if (!data.isObject()) {
            throw new FetchException(ErrorKind.FETCH_PERMANENT, "Response with " + what + " has no data object");
        }
        return Optional.of(data);
    }

    private RatingsDistribution readRatings(String vendorCode, HttpResponse<String> response) {
        String what = "ratings of vendor " + vendorCode;
        requireSuccess(classifyStatus(response.statusCode()), response.statusCode(), what);
        return parseRatings(what, readJson(response.body(), what));
    }

    private List<JsonNode> readReviews(String vendorCode, HttpResponse<String> response) {
        String what = "reviews of vendor " + vendorCode;
        requireSuccess(classifyStatus(response.statusCode()), response.statusCode(), what);
        JsonNode data = readJson(response.body(), what).path("data");
        if (!data.isArray()) {
            throw new FetchException(ErrorKind.FETCH_PERMANENT, "Response with " + what + " has no data array");
        }
        List<JsonNode> reviews = new ArrayList<>(data.size());
        data.forEach(reviews::add);
        return reviews;
    }

    static RatingsDistribution parseRatings(String what, JsonNode root) {
        JsonNode total = root.get("totalCount");
        if (total == null || !total.canConvertToInt()) {
            throw new FetchException(ErrorKind.FETCH_PERMANENT, "Response with " + what + " has no totalCount");
        }
        RatingsDistribution.RatingsDistributionBuilder builder = RatingsDistribution.builder()
                .totalCount(total.asInt())
                .createdAt(root.path("createdAt").textValue())
                .updatedAt(root.path("updatedAt").textValue());
        for (JsonNode score : root.path("ratings")) {
            builder.score(new RatingsDistribution.Score(
                    score.path("score").asInt(), score.path("count").asInt(), score.path("percentage").asInt()));
        }
        return builder.build();
    }

    private static void requireSuccess(ErrorKind failure, int status, String what) {
        if (failure != null) {
            throw new FetchException(failure, "Vendor API returned " + status + " for " + what, status, null);
        }
    }

    private static JsonNode readJson(String body, String what) {
        try {
            JsonNode root = objectMapper.readTree(body == null ? "" : body);
            if (root == null || !root.isObject()) {
                throw new FetchException(ErrorKind.FETCH_PERMANENT, "Response with " + what + " is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new FetchException(ErrorKind.FETCH_PERMANENT, "Unparseable response with " + what, e);
        }
    }

    /**
     * Maps an HTTP status to a fetch failure kind, or {@code null} for success. Authentication
     * failures are permanent: there is no token refresh flow.
     */
    static ErrorKind classifyStatus(int status) {
        if (status >= 200 && status < 300) {
            return null;
        }
        if (status == 429) {
            return ErrorKind.FETCH_RATE_LIMITED;
        }
        if (status >= 500) {
            return ErrorKind.FETCH_TRANSIENT;
        }
        return ErrorKind.FETCH_PERMANENT;
    }

    private static PipelineException transportFailure(String cityId, Throwable error) {
        Throwable cause = PipelineException.unwrap(error);
        if (cause instanceof PipelineException) {
            return (PipelineException) cause;
        }
        if (cause instanceof CancellationException) {
            return PipelineException.cancelled("Fetch for city=" + cityId + " cancelled");
        }
        if (cause instanceof HttpTimeoutException) {
            return new FetchException(ErrorKind.FETCH_TRANSIENT, "Timed out fetching city=" + cityId, cause);
        }
        if (cause instanceof IOException) {
            return new FetchException(ErrorKind.FETCH_TRANSIENT,
                    "I/O error fetching city=" + cityId + ": " + cause.getMessage(), cause);
        }
        return new FetchException(ErrorKind.FETCH_PERMANENT,
                "Unexpected error fetching city=" + cityId + ": " + cause, cause);
    }

    private static int parseCursor(String cursor) {
        if (cursor == null) {
            return 0;
        }
        try {
            int offset = Integer.parseInt(cursor);
            if (offset < 0) {
                throw new NumberFormatException("negative offset");
            }
            return offset;
        } catch (NumberFormatException e) {
            throw new FetchException(ErrorKind.FETCH_PERMANENT, "Invalid page cursor: " + cursor, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String encodePathSegment(String value) {
        return encode(value).replace("+", "%20");
    }
}

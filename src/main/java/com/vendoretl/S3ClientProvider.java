package com.vendoretl;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.async.SdkAsyncHttpClient;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.time.Duration;

public class S3ClientProvider {

    private S3ClientProvider() {
    }

    /**
     * Builds the async S3 client used for uploads. SDK-level retries are off: the uploader applies
     * the pipeline's own {@link BackoffPolicy} so fetches and uploads share one retry budget shape.
     */
    public static S3AsyncClient create(EnvironmentConfig config) {
        SdkAsyncHttpClient asyncHttpClient = NettyNioAsyncHttpClient.builder()
                .maxConcurrency(Math.max(config.getMaxConcurrent() * 2, 16))
                .connectionAcquisitionTimeout(Duration.ofSeconds(10))
                .connectionTimeToLive(Duration.ofMinutes(2))
                .readTimeout(config.getRequestTimeout())
                .writeTimeout(config.getRequestTimeout())
                .build();

        S3AsyncClientBuilder builder = S3AsyncClient.builder()
                .httpClient(asyncHttpClient)
                .region(Region.of(config.getS3Region()))
                .credentialsProvider(credentials(config))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(config.isS3PathStyle())
                        .build())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.none())
                        .apiCallAttemptTimeout(config.getRequestTimeout())
                        .build());

        if (config.getS3Endpoint() != null) {
            // MinIO and other S3-compatible stores
            builder.endpointOverride(URI.create(config.getS3Endpoint()));
        }
        return builder.build();
    }

    private static AwsCredentialsProvider credentials(EnvironmentConfig config) {
        if (config.getS3AccessKey() != null) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(config.getS3AccessKey(), config.getS3SecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}

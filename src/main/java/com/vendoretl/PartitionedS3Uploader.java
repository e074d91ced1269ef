package com.vendoretl;

import com.vendoretl.error.ErrorKind;
import com.vendoretl.error.PipelineException;
import com.vendoretl.error.UploadException;
import com.vendoretl.model.ObjectLocation;
import com.vendoretl.model.PartitionKey;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Uploads a city's Parquet file to {@code <bucket>/city_id=<id>/year=<yyyy>/month=<MM>/day=<dd>/vendors_<runMillis>.parquet}.
 *
 * <p>An upload only counts once S3 has acknowledged it with an ETag. Transient failures are retried
 * with the shared {@link BackoffPolicy}; the local file is left in place whatever the outcome.
 */
@Slf4j
public class PartitionedS3Uploader {

    static final String CONTENT_TYPE = "application/vnd.apache.parquet";

    private final S3AsyncClient s3;
    private final String bucket;
    private final long multipartThresholdBytes;
    private final long partSizeBytes;
    private final RateLimiter uploadLimiter;
    private final RetryingExecutor retryingExecutor;
    private final CancellationToken cancellation;

    public PartitionedS3Uploader(S3AsyncClient s3,
                                 EnvironmentConfig config,
                                 RateLimiter uploadLimiter,
                                 RetryingExecutor retryingExecutor,
                                 CancellationToken cancellation) {
        this.s3 = s3;
        this.bucket = config.getS3Bucket();
        this.multipartThresholdBytes = config.getMultipartThresholdBytes();
        this.partSizeBytes = config.getMultipartPartSizeBytes();
        this.uploadLimiter = uploadLimiter;
        this.retryingExecutor = retryingExecutor;
        this.cancellation = cancellation;
    }

    public CompletableFuture<ObjectLocation> upload(Path file, PartitionKey partition, Instant runStartedAt) {
        String key = partition.objectKey(runStartedAt);
        return retryingExecutor.execute("Upload s3://" + bucket + "/" + key,
                () -> uploadLimiter.withPermit(partition.getCityId(), () -> uploadOnce(file, key)),
                attempt -> log.debug("Uploading {} to {} (attempt {})", file, key, attempt));
    }

    /**
     * Checks that the bucket exists and is reachable with the configured credentials. Throttling,
     * 5xx and connection failures are retried like any upload; a missing bucket or denied access
     * fails at once.
     */
    public CompletableFuture<Void> verifyBucket() {
        return retryingExecutor.execute("Check bucket '" + bucket + "'",
                () -> cancellation.register(s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build()))
                        .handle((response, error) -> {
                            if (error != null) {
                                PipelineException failure = classify(error);
                                throw new UploadException(failure.getKind(),
                                        "Cannot access bucket '" + bucket + "': " + failure.getMessage(), failure);
                            }
                            log.info("Bucket '{}' is accessible", bucket);
                            return null;
                        }),
                attempt -> log.debug("Checking bucket {} (attempt {})", bucket, attempt));
    }

    CompletableFuture<ObjectLocation> uploadOnce(Path file, String key) {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UploadException(ErrorKind.UPLOAD_PERMANENT,
                    "Local file " + file + " is not readable", e));
        }

        CompletableFuture<ObjectLocation> attempt = size >= multipartThresholdBytes
                ? multipartUpload(file, key, size)
                : singleUpload(file, key, size);

        return attempt.handle((location, error) -> {
            if (error != null) {
                throw classify(error);
            }
            log.info("Uploaded {} ({} bytes) to {}", file.getFileName(), size, location.uri());
            return location;
        });
    }

    private CompletableFuture<ObjectLocation> singleUpload(Path file, String key, long size) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(CONTENT_TYPE)
                .contentLength(size)
                .build();
        return cancellation.register(s3.putObject(request, AsyncRequestBody.fromFile(file)))
                .thenApply(response -> acknowledged(key, response.eTag(), response.versionId()));
    }

    private CompletableFuture<ObjectLocation> multipartUpload(Path file, String key, long size) {
        log.info("Using multipart upload for {} ({} bytes, {} byte parts)", key, size, partSizeBytes);
        CreateMultipartUploadRequest create = CreateMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(CONTENT_TYPE)
                .build();

        return cancellation.register(s3.createMultipartUpload(create))
                .thenCompose(created -> {
                    String uploadId = created.uploadId();
                    return uploadParts(file, key, uploadId, size, 1, 0L, new ArrayList<>())
                            .thenCompose(parts -> cancellation.register(s3.completeMultipartUpload(
                                    CompleteMultipartUploadRequest.builder()
                                            .bucket(bucket)
                                            .key(key)
                                            .uploadId(uploadId)
                                            .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
                                            .build())))
                            .thenApply(response -> acknowledged(key, response.eTag(), response.versionId()))
                            .whenComplete((location, error) -> {
                                if (error != null) {
                                    abort(key, uploadId);
                                }
                            });
                });
    }

    // parts go up one after another; each is read from disk only when it is sent
    private CompletableFuture<List<CompletedPart>> uploadParts(Path file, String key, String uploadId, long size,
                                                               int partNumber, long offset, List<CompletedPart> parts) {
        if (offset >= size) {
            return CompletableFuture.completedFuture(parts);
        }
        int length = (int) Math.min(partSizeBytes, size - offset);
        byte[] chunk;
        try {
            chunk = readChunk(file, offset, length);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UploadException(ErrorKind.UPLOAD_PERMANENT,
                    "Failed to read part " + partNumber + " of " + file, e));
        }

        UploadPartRequest request = UploadPartRequest.builder()
                .bucket(bucket)
                .key(key)
                .uploadId(uploadId)
                .partNumber(partNumber)
                .contentLength((long) length)
                .build();

        return cancellation.register(s3.uploadPart(request, AsyncRequestBody.fromBytes(chunk)))
                .thenCompose(response -> {
                    if (response.eTag() == null || response.eTag().isBlank()) {
                        throw new UploadException(ErrorKind.UPLOAD_UNACKNOWLEDGED,
                                "Part " + partNumber + " of " + key + " was not acknowledged");
                    }
                    parts.add(CompletedPart.builder().partNumber(partNumber).eTag(response.eTag()).build());
                    log.debug("Uploaded part {} of {} ({} bytes)", partNumber, key, length);
                    return uploadParts(file, key, uploadId, size, partNumber + 1, offset + length, parts);
                });
    }

    private void abort(String key, String uploadId) {
        s3.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .uploadId(uploadId)
                        .build())
                .whenComplete((response, error) -> {
                    if (error != null) {
                        log.warn("Failed to abort multipart upload {} for {}: {}", uploadId, key, error.getMessage());
                    } else {
                        log.info("Aborted multipart upload {} for {}", uploadId, key);
                    }
                });
    }

    private ObjectLocation acknowledged(String key, String eTag, String versionId) {
        if (eTag == null || eTag.isBlank()) {
            throw new UploadException(ErrorKind.UPLOAD_UNACKNOWLEDGED, "Storage did not acknowledge " + key);
        }
        return ObjectLocation.builder()
                .bucket(bucket)
                .key(key)
                .eTag(eTag)
                .versionId(versionId)
                .build();
    }

    private static byte[] readChunk(Path file, long offset, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            while (buffer.hasRemaining()) {
                if (channel.read(buffer, offset + buffer.position()) < 0) {
                    throw new IOException("Unexpected end of " + file + " at " + (offset + buffer.position()));
                }
            }
        }
        return buffer.array();
    }

    static PipelineException classify(Throwable error) {
        Throwable cause = PipelineException.unwrap(error);
        if (cause instanceof PipelineException) {
            return (PipelineException) cause;
        }
        if (cause instanceof CancellationException) {
            return PipelineException.cancelled("Upload cancelled");
        }
        if (cause instanceof AwsServiceException) {
            AwsServiceException service = (AwsServiceException) cause;
            int status = service.statusCode();
            boolean transientFailure = status >= 500 || status == 429 || service.isThrottlingException();
            return new UploadException(transientFailure ? ErrorKind.UPLOAD_TRANSIENT : ErrorKind.UPLOAD_PERMANENT,
                    "S3 returned " + status + ": " + service.getMessage(), service);
        }
        if (cause instanceof SdkClientException) {
            // network failures and attempt timeouts
            return new UploadException(ErrorKind.UPLOAD_TRANSIENT, "S3 client error: " + cause.getMessage(), cause);
        }
        if (cause instanceof IOException) {
            return new UploadException(ErrorKind.UPLOAD_TRANSIENT, "I/O error during upload: " + cause.getMessage(), cause);
        }
        return new UploadException(ErrorKind.UPLOAD_PERMANENT, "Upload failed: " + cause, cause);
    }
}

package com.vendoretl;

import com.vendoretl.error.ErrorKind;
import com.vendoretl.error.PipelineException;
import com.vendoretl.error.UploadException;
import com.vendoretl.model.ObjectLocation;
import com.vendoretl.model.PartitionKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PartitionedS3UploaderTest {

    private static final Instant RUN_START = Instant.parse("2026-03-07T10:15:30.123Z");
    private static final String KEY = "city_id=69036/year=2026/month=03/day=07/vendors_1772878530123.parquet";

    @TempDir
    Path tempDir;

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final CancellationToken cancellation = new CancellationToken();
    private S3AsyncClient s3;
    private RateLimiter limiter;
    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        s3 = mock(S3AsyncClient.class);
        file = Files.write(tempDir.resolve("vendors.parquet"), "PAR1-0123456789".getBytes(StandardCharsets.US_ASCII));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PartitionedS3Uploader uploader(long multipartThreshold, long partSize) {
        EnvironmentConfig config = TestUtils.testConfig()
                .cityId("69036")
                .maxRetries(3)
                .multipartThresholdBytes(multipartThreshold)
                .multipartPartSizeBytes(partSize)
                .build();
        limiter = RateLimiter.concurrencyOnly("upload", 2, mock(ScheduledExecutorService.class));
        return new PartitionedS3Uploader(s3, config, limiter,
                new RetryingExecutor(BackoffPolicy.from(config), executor, cancellation), cancellation);
    }

    private PartitionedS3Uploader uploader() {
        return uploader(8 * 1024 * 1024, 8 * 1024 * 1024);
    }

    private ObjectLocation upload(PartitionedS3Uploader uploader) throws Exception {
        return uploader.upload(file, PartitionKey.of("69036", RUN_START), RUN_START).get(5, TimeUnit.SECONDS);
    }

    private PipelineException uploadFailure(PartitionedS3Uploader uploader) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> upload(uploader));
        return assertInstanceOf(PipelineException.class, e.getCause());
    }

    private static CompletableFuture<PutObjectResponse> putAck(String eTag) {
        return CompletableFuture.completedFuture(PutObjectResponse.builder().eTag(eTag).build());
    }

    private static S3Exception s3Error(int status) {
        return (S3Exception) S3Exception.builder().statusCode(status).message("status " + status).build();
    }

    @Test
    void testSinglePutUsesPartitionKey() throws Exception {
        when(s3.putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class))).thenReturn(putAck("\"abc\""));

        ObjectLocation location = upload(uploader());

        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3).putObject(request.capture(), any(AsyncRequestBody.class));
        assertEquals("vendor-snapshots", request.getValue().bucket());
        assertEquals(KEY, request.getValue().key());
        assertEquals(PartitionedS3Uploader.CONTENT_TYPE, request.getValue().contentType());
        assertEquals(Files.size(file), request.getValue().contentLength());
        assertEquals("s3://vendor-snapshots/" + KEY, location.uri());
        assertEquals("\"abc\"", location.getETag());
    }

    @Test
    void testTransientErrorIsRetried() throws Exception {
        when(s3.putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class)))
                .thenReturn(CompletableFuture.failedFuture(s3Error(503)))
                .thenReturn(CompletableFuture.failedFuture(SdkClientException.create("Connection reset")))
                .thenReturn(putAck("\"abc\""));

        ObjectLocation location = upload(uploader());

        assertEquals(KEY, location.getKey());
        verify(s3, times(3)).putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class));
    }

    @Test
    void testPermanentErrorIsNotRetried() {
        when(s3.putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class)))
                .thenReturn(CompletableFuture.failedFuture(s3Error(403)));

        PipelineException failure = uploadFailure(uploader());

        assertEquals(ErrorKind.UPLOAD_PERMANENT, failure.getKind());
        verify(s3, times(1)).putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class));
    }

    @Test
    void testMissingAcknowledgementFailsAfterRetries() {
        when(s3.putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class))).thenReturn(putAck(null));

        PipelineException failure = uploadFailure(uploader());

        assertEquals(ErrorKind.UPLOAD_UNACKNOWLEDGED, failure.getKind());
        verify(s3, times(3)).putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class));
    }

    @Test
    void testPermitIsReleasedWhenClientThrows() {
        // Arrange
        when(s3.putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class)))
                .thenThrow(new IllegalStateException("Connection pool shut down"));
        PartitionedS3Uploader uploader = uploader();

        // Act
        PipelineException failure = uploadFailure(uploader);

        // Assert
        assertEquals(ErrorKind.INTERNAL, failure.getKind());
        assertEquals(0, limiter.inFlight());
        assertEquals(1, limiter.peakInFlight());
    }

    @Test
    void testMissingLocalFileIsPermanent() throws Exception {
        Files.delete(file);

        PipelineException failure = uploadFailure(uploader());

        assertEquals(ErrorKind.UPLOAD_PERMANENT, failure.getKind());
        verify(s3, never()).putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class));
    }

    @Test
    void testMultipartUploadSendsPartsInOrder() throws Exception {
        stubMultipart();
        when(s3.uploadPart(any(UploadPartRequest.class), any(AsyncRequestBody.class)))
                .thenReturn(CompletableFuture.completedFuture(UploadPartResponse.builder().eTag("\"p1\"").build()))
                .thenReturn(CompletableFuture.completedFuture(UploadPartResponse.builder().eTag("\"p2\"").build()))
                .thenReturn(CompletableFuture.completedFuture(UploadPartResponse.builder().eTag("\"p3\"").build()))
                .thenReturn(CompletableFuture.completedFuture(UploadPartResponse.builder().eTag("\"p4\"").build()));

        // 15 bytes in 4 byte parts
        ObjectLocation location = upload(uploader(10, 4));

        assertEquals("\"multi-4\"", location.getETag());
        ArgumentCaptor<UploadPartRequest> parts = ArgumentCaptor.forClass(UploadPartRequest.class);
        verify(s3, times(4)).uploadPart(parts.capture(), any(AsyncRequestBody.class));
        assertEquals(List.of(1, 2, 3, 4), parts.getAllValues().stream().map(UploadPartRequest::partNumber).collect(Collectors.toList()));
        assertEquals(List.of(4L, 4L, 4L, 3L), parts.getAllValues().stream().map(UploadPartRequest::contentLength).collect(Collectors.toList()));
        parts.getAllValues().forEach(part -> assertEquals("upload-1", part.uploadId()));

        ArgumentCaptor<CompleteMultipartUploadRequest> complete = ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);
        verify(s3).completeMultipartUpload(complete.capture());
        assertEquals(List.of("\"p1\"", "\"p2\"", "\"p3\"", "\"p4\""), complete.getValue().multipartUpload().parts().stream()
                .map(p -> p.eTag())
                .collect(Collectors.toList()));
        verify(s3, never()).abortMultipartUpload(any(AbortMultipartUploadRequest.class));
        verify(s3, never()).putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class));
    }

    @Test
    void testFailedPartAbortsMultipartUpload() {
        stubMultipart();
        when(s3.uploadPart(any(UploadPartRequest.class), any(AsyncRequestBody.class)))
                .thenReturn(CompletableFuture.completedFuture(UploadPartResponse.builder().eTag("\"p1\"").build()))
                .thenReturn(CompletableFuture.failedFuture(s3Error(400)));

        PipelineException failure = uploadFailure(uploader(10, 4));

        assertEquals(ErrorKind.UPLOAD_PERMANENT, failure.getKind());
        ArgumentCaptor<AbortMultipartUploadRequest> abort = ArgumentCaptor.forClass(AbortMultipartUploadRequest.class);
        verify(s3).abortMultipartUpload(abort.capture());
        assertEquals("upload-1", abort.getValue().uploadId());
        assertEquals(KEY, abort.getValue().key());
        verify(s3, never()).completeMultipartUpload(any(CompleteMultipartUploadRequest.class));
    }

    @Test
    void testVerifyBucketFailureIsPermanent() {
        when(s3.headBucket(any(HeadBucketRequest.class))).thenReturn(CompletableFuture.failedFuture(s3Error(403)));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> uploader().verifyBucket().get(5, TimeUnit.SECONDS));

        UploadException failure = assertInstanceOf(UploadException.class, e.getCause());
        assertEquals(ErrorKind.UPLOAD_PERMANENT, failure.getKind());
        verify(s3, times(1)).headBucket(any(HeadBucketRequest.class));
    }

    @Test
    void testVerifyBucketRetriesTransientFailure() throws Exception {
        // Arrange
        when(s3.headBucket(any(HeadBucketRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(SdkClientException.create("connection reset")))
                .thenReturn(CompletableFuture.completedFuture(HeadBucketResponse.builder().build()));

        // Act
        uploader().verifyBucket().get(5, TimeUnit.SECONDS);

        // Assert
        verify(s3, times(2)).headBucket(any(HeadBucketRequest.class));
    }

    @Test
    void testVerifyBucketKeepsTransientKindOnceBudgetIsSpent() {
        when(s3.headBucket(any(HeadBucketRequest.class))).thenReturn(CompletableFuture.failedFuture(s3Error(503)));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> uploader().verifyBucket().get(5, TimeUnit.SECONDS));

        UploadException failure = assertInstanceOf(UploadException.class, e.getCause());
        assertEquals(ErrorKind.UPLOAD_TRANSIENT, failure.getKind());
        verify(s3, times(3)).headBucket(any(HeadBucketRequest.class));
    }

    @Test
    void testClassify() {
        assertEquals(ErrorKind.UPLOAD_TRANSIENT, PartitionedS3Uploader.classify(s3Error(500)).getKind());
        assertEquals(ErrorKind.UPLOAD_TRANSIENT, PartitionedS3Uploader.classify(s3Error(429)).getKind());
        assertEquals(ErrorKind.UPLOAD_PERMANENT, PartitionedS3Uploader.classify(s3Error(404)).getKind());
        assertEquals(ErrorKind.UPLOAD_TRANSIENT, PartitionedS3Uploader.classify(new IOException("broken pipe")).getKind());
        assertEquals(ErrorKind.CANCELLED, PartitionedS3Uploader.classify(new CancellationException()).getKind());
        assertEquals(ErrorKind.UPLOAD_PERMANENT, PartitionedS3Uploader.classify(new IllegalStateException("?")).getKind());
    }

    private void stubMultipart() {
        when(s3.createMultipartUpload(any(CreateMultipartUploadRequest.class))).thenReturn(CompletableFuture.completedFuture(
                CreateMultipartUploadResponse.builder().uploadId("upload-1").build()));
        when(s3.completeMultipartUpload(any(CompleteMultipartUploadRequest.class))).thenReturn(CompletableFuture.completedFuture(
                CompleteMultipartUploadResponse.builder().eTag("\"multi-4\"").build()));
        when(s3.abortMultipartUpload(any(AbortMultipartUploadRequest.class))).thenReturn(CompletableFuture.completedFuture(
                AbortMultipartUploadResponse.builder().build()));
    }
}

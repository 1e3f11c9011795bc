package vn.com.fecredit.fileportal.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.ChecksumAlgorithm;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.ListMultipartUploadsRequest;
import software.amazon.awssdk.services.s3.model.ListMultipartUploadsResponse;
import software.amazon.awssdk.services.s3.model.ListPartsRequest;
import software.amazon.awssdk.services.s3.model.ListPartsResponse;
import software.amazon.awssdk.services.s3.model.MultipartUpload;
import software.amazon.awssdk.services.s3.model.NoSuchUploadException;
import software.amazon.awssdk.services.s3.model.Part;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;
import vn.com.fecredit.fileportal.exception.ChunkConflictException;
import vn.com.fecredit.fileportal.exception.StorageBackendException;
import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.util.ChecksumUtil;

import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RemoteStorageBackendTest {

    private static final String BUCKET = "portal-bucket";

    @Mock
    private S3Client s3Client;
    @Mock
    private S3Presigner presigner;

    private RemoteStorageBackend backend;

    @BeforeEach
    void setUp() {
        backend = new RemoteStorageBackend(s3Client, presigner, BUCKET, "uploads/", Duration.ofHours(1));
    }

    @Test
    void reportsRemoteLimits() {
        assertEquals(StorageMode.REMOTE, backend.mode());
        assertEquals(5L * 1024 * 1024, backend.minimumChunkSize());
        assertEquals(10_000, backend.maximumChunkCount());
        assertEquals("uploads/s1", backend.objectKey("s1"));
    }

    @Test
    void openStagingAreaCreatesMultipartUploadWithSha256Checksums() {
        when(s3Client.listMultipartUploads(any(ListMultipartUploadsRequest.class)))
                .thenReturn(ListMultipartUploadsResponse.builder().build());
        when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CreateMultipartUploadResponse.builder().uploadId("mpu-1").build());

        StagingHandle handle = backend.openStagingArea("s1");

        assertEquals("mpu-1", handle.getLocation());
        ArgumentCaptor<CreateMultipartUploadRequest> captor = ArgumentCaptor.forClass(CreateMultipartUploadRequest.class);
        verify(s3Client).createMultipartUpload(captor.capture());
        assertEquals(BUCKET, captor.getValue().bucket());
        assertEquals("uploads/s1", captor.getValue().key());
        assertEquals(ChecksumAlgorithm.SHA256, captor.getValue().checksumAlgorithm());
    }

    @Test
    void openStagingAreaReusesInProgressUpload() {
        when(s3Client.listMultipartUploads(any(ListMultipartUploadsRequest.class)))
                .thenReturn(ListMultipartUploadsResponse.builder()
                        .uploads(MultipartUpload.builder().key("uploads/s10").uploadId("other").build(),
                                MultipartUpload.builder().key("uploads/s1").uploadId("mpu-1").build())
                        .build());

        StagingHandle handle = backend.openStagingArea("s1");

        assertEquals("mpu-1", handle.getLocation());
        verify(s3Client, never()).createMultipartUpload(any(CreateMultipartUploadRequest.class));
    }

    @Test
    void writeChunkUploadsPartWithChecksum() {
        byte[] data = "chunk-zero".getBytes(StandardCharsets.UTF_8);
        when(s3Client.listParts(any(ListPartsRequest.class))).thenReturn(ListPartsResponse.builder().build());
        when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
                .thenReturn(UploadPartResponse.builder().eTag("\"etag-1\"").build());

        ChunkRef ref = backend.writeChunk(new StagingHandle("s1", "mpu-1"), 0, data);

        assertEquals("\"etag-1\"", ref.getRef());
        assertEquals(ChecksumUtil.sha256Hex(data), ref.getDigest());
        ArgumentCaptor<UploadPartRequest> captor = ArgumentCaptor.forClass(UploadPartRequest.class);
        verify(s3Client).uploadPart(captor.capture(), any(RequestBody.class));
        UploadPartRequest request = captor.getValue();
        assertEquals(1, request.partNumber());
        assertEquals("mpu-1", request.uploadId());
        assertEquals(ChecksumUtil.hexToBase64(ChecksumUtil.sha256Hex(data)), request.checksumSHA256());
        assertEquals(Long.valueOf(data.length), request.contentLength());
    }

    @Test
    void writeChunkWithIdenticalStoredPartSkipsUpload() {
        byte[] data = "chunk-one".getBytes(StandardCharsets.UTF_8);
        String checksum = ChecksumUtil.hexToBase64(ChecksumUtil.sha256Hex(data));
        when(s3Client.listParts(any(ListPartsRequest.class))).thenReturn(ListPartsResponse.builder()
                .parts(Part.builder().partNumber(2).eTag("\"etag-2\"").checksumSHA256(checksum).build())
                .build());

        ChunkRef ref = backend.writeChunk(new StagingHandle("s1", "mpu-1"), 1, data);

        assertEquals("\"etag-2\"", ref.getRef());
        verify(s3Client, never()).uploadPart(any(UploadPartRequest.class), any(RequestBody.class));
    }

    @Test
    void writeChunkWithDifferentStoredPartConflicts() {
        when(s3Client.listParts(any(ListPartsRequest.class))).thenReturn(ListPartsResponse.builder()
                .parts(Part.builder().partNumber(2).eTag("\"etag-2\"")
                        .checksumSHA256(ChecksumUtil.hexToBase64(ChecksumUtil.sha256Hex(new byte[]{1}))).build())
                .build());

        assertThrows(ChunkConflictException.class,
                () -> backend.writeChunk(new StagingHandle("s1", "mpu-1"), 1, new byte[]{2}));
        verify(s3Client, never()).uploadPart(any(UploadPartRequest.class), any(RequestBody.class));
    }

    @Test
    void sdkFailuresSurfaceAsBackendErrors() {
        when(s3Client.listParts(any(ListPartsRequest.class))).thenThrow(SdkClientException.create("connection reset"));

        StorageBackendException e = assertThrows(StorageBackendException.class,
                () -> backend.writeChunk(new StagingHandle("s1", "mpu-1"), 0, new byte[]{1}));
        assertEquals("writeChunk", e.getOperation());
    }

    @Test
    void finalizeCompletesPartsInIndexOrder() {
        when(s3Client.completeMultipartUpload(any(CompleteMultipartUploadRequest.class)))
                .thenReturn(CompleteMultipartUploadResponse.builder().build());
        String d0 = ChecksumUtil.sha256Hex(new byte[]{0});
        String d1 = ChecksumUtil.sha256Hex(new byte[]{1});

        StoredObject stored = backend.finalizeUpload(new StagingHandle("s1", "mpu-1"),
                List.of(new ChunkRef(0, "e0", d0, 5_242_880), new ChunkRef(1, "e1", d1, 100)));

        assertEquals("uploads/s1", stored.getLocation());
        assertEquals(5_242_980, stored.getSize());
        assertNull(stored.getContentHash());
        ArgumentCaptor<CompleteMultipartUploadRequest> captor = ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);
        verify(s3Client).completeMultipartUpload(captor.capture());
        List<CompletedPart> parts = captor.getValue().multipartUpload().parts();
        assertEquals(2, parts.size());
        assertEquals(1, parts.get(0).partNumber());
        assertEquals("e0", parts.get(0).eTag());
        assertEquals(2, parts.get(1).partNumber());
        assertEquals(ChecksumUtil.hexToBase64(d1), parts.get(1).checksumSHA256());
    }

    @Test
    void computeContentHashIsUnavailable() {
        assertTrue(backend.computeContentHash(new StagingHandle("s1", "mpu-1"), List.of()).isEmpty());
    }

    @Test
    void abortToleratesMissingUpload() {
        when(s3Client.abortMultipartUpload(any(AbortMultipartUploadRequest.class)))
                .thenThrow(NoSuchUploadException.builder().message("gone").build());

        assertDoesNotThrow(() -> backend.abort(new StagingHandle("s1", "mpu-1")));
    }

    @Test
    void stagingExistsFalseOnceUploadIsGone() {
        when(s3Client.listParts(any(ListPartsRequest.class)))
                .thenThrow(NoSuchUploadException.builder().message("gone").build());

        assertFalse(backend.stagingExists(new StagingHandle("s1", "mpu-1")));
    }

    @Test
    void readFinalReturnsTimeLimitedUrl() throws Exception {
        PresignedGetObjectRequest presigned = mock(PresignedGetObjectRequest.class);
        URL url = new URL("https://portal-bucket.s3.amazonaws.com/uploads/s1?X-Amz-Signature=abc");
        Instant expiry = Instant.parse("2026-01-01T01:00:00Z");
        when(presigned.url()).thenReturn(url);
        when(presigned.expiration()).thenReturn(expiry);
        when(presigner.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presigned);

        DownloadReference download = backend.readFinal("uploads/s1");

        assertTrue(download.isRedirect());
        assertEquals(url, download.getUrl());
        assertEquals(expiry, download.getExpiresAt());
        ArgumentCaptor<GetObjectPresignRequest> captor = ArgumentCaptor.forClass(GetObjectPresignRequest.class);
        verify(presigner).presignGetObject(captor.capture());
        assertEquals(Duration.ofHours(1), captor.getValue().signatureDuration());
        assertEquals("uploads/s1", captor.getValue().getObjectRequest().key());
    }
}

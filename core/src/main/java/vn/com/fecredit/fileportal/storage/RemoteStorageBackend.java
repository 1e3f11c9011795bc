package vn.com.fecredit.fileportal.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.ChecksumAlgorithm;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListMultipartUploadsRequest;
import software.amazon.awssdk.services.s3.model.ListMultipartUploadsResponse;
import software.amazon.awssdk.services.s3.model.ListPartsRequest;
import software.amazon.awssdk.services.s3.model.ListPartsResponse;
import software.amazon.awssdk.services.s3.model.MultipartUpload;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.NoSuchUploadException;
import software.amazon.awssdk.services.s3.model.Part;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;
import vn.com.fecredit.fileportal.exception.ChunkConflictException;
import vn.com.fecredit.fileportal.exception.StorageBackendException;
import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.util.ChecksumUtil;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * S3 multipart-upload backend. A session is one multipart upload on key
 * {@code <keyPrefix>/<sessionId>}; chunk {@code i} is part {@code i + 1}, uploaded with a
 * SHA-256 checksum that the store verifies on receipt.
 */
public class RemoteStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(RemoteStorageBackend.class);

    /** S3 rejects non-final multipart parts below 5 MiB. */
    public static final long MIN_PART_SIZE = 5L * 1024 * 1024;
    public static final int MAX_PARTS = 10_000;

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final String bucket;
    private final String keyPrefix;
    private final Duration signedUrlTtl;

    public RemoteStorageBackend(S3Client s3Client, S3Presigner presigner, String bucket, String keyPrefix, Duration signedUrlTtl) {
        this.s3Client = s3Client;
        this.presigner = presigner;
        this.bucket = bucket;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix.replaceAll("/+$", "");
        this.signedUrlTtl = signedUrlTtl;
    }

    @Override
    public StorageMode mode() {
        return StorageMode.REMOTE;
    }

    @Override
    public long minimumChunkSize() {
        return MIN_PART_SIZE;
    }

    @Override
    public int maximumChunkCount() {
        return MAX_PARTS;
    }

    @Override
    public StagingHandle openStagingArea(String sessionId) {
        String key = objectKey(sessionId);
        try {
            Optional<String> existing = findInProgressUpload(key);
            if (existing.isPresent()) {
                log.debug("Reusing multipart upload {} for session {}", existing.get(), sessionId);
                return new StagingHandle(sessionId, existing.get());
            }
            CreateMultipartUploadResponse response = s3Client.createMultipartUpload(CreateMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .checksumAlgorithm(ChecksumAlgorithm.SHA256)
                    .build());
            log.debug("Created multipart upload {} for session {}", response.uploadId(), sessionId);
            return new StagingHandle(sessionId, response.uploadId());
        } catch (SdkException e) {
            throw new StorageBackendException("openStagingArea", sessionId, "Cannot initiate multipart upload", e);
        }
    }

    @Override
    public ChunkRef writeChunk(StagingHandle handle, int index, byte[] data) {
        String sessionId = handle.getSessionId();
        int partNumber = index + 1;
        String digest = ChecksumUtil.sha256Hex(data);
        String checksum = ChecksumUtil.hexToBase64(digest);
        try {
            Optional<Part> stored = findPart(handle, partNumber);
            if (stored.isPresent()) {
                Part part = stored.get();
                if (!checksum.equals(part.checksumSHA256())) {
                    throw new ChunkConflictException(sessionId, index);
                }
                log.debug("Part {} of session {} already uploaded with identical content", partNumber, sessionId);
                return new ChunkRef(index, part.eTag(), digest, data.length);
            }
            UploadPartResponse response = s3Client.uploadPart(UploadPartRequest.builder()
                            .bucket(bucket)
                            .key(objectKey(sessionId))
                            .uploadId(handle.getLocation())
                            .partNumber(partNumber)
                            .checksumSHA256(checksum)
                            .contentLength((long) data.length)
                            .build(),
                    RequestBody.fromBytes(data));
            return new ChunkRef(index, response.eTag(), digest, data.length);
        } catch (SdkException e) {
            throw new StorageBackendException("writeChunk", sessionId, "Cannot upload part " + partNumber, e);
        }
    }

    /**
     * Always empty: the bytes are never read back. Integrity rests on the per-part checksums.
     */
    @Override
    public Optional<String> computeContentHash(StagingHandle handle, List<ChunkRef> orderedRefs) {
        return Optional.empty();
    }

    @Override
    public StoredObject finalizeUpload(StagingHandle handle, List<ChunkRef> orderedRefs) {
        String sessionId = handle.getSessionId();
        String key = objectKey(sessionId);
        List<CompletedPart> parts = new ArrayList<>(orderedRefs.size());
        long size = 0;
        for (ChunkRef ref : orderedRefs) {
            parts.add(CompletedPart.builder()
                    .partNumber(ref.getIndex() + 1)
                    .eTag(ref.getRef())
                    .checksumSHA256(ChecksumUtil.hexToBase64(ref.getDigest()))
                    .build());
            size += ref.getSize();
        }
        try {
            s3Client.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .uploadId(handle.getLocation())
                    .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
                    .build());
        } catch (SdkException e) {
            throw new StorageBackendException("finalizeUpload", sessionId, "Cannot complete multipart upload", e);
        }
        log.info("Completed multipart upload for session {} ({} parts, {} bytes)", sessionId, parts.size(), size);
        return new StoredObject(key, size, null);
    }

    @Override
    public void abort(StagingHandle handle) {
        try {
            s3Client.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(objectKey(handle.getSessionId()))
                    .uploadId(handle.getLocation())
                    .build());
            log.debug("Aborted multipart upload {} for session {}", handle.getLocation(), handle.getSessionId());
        } catch (NoSuchUploadException e) {
            log.debug("Multipart upload {} already gone", handle.getLocation());
        } catch (SdkException e) {
            throw new StorageBackendException("abort", handle.getSessionId(), "Cannot abort multipart upload", e);
        }
    }

    @Override
    public boolean stagingExists(StagingHandle handle) {
        try {
            s3Client.listParts(ListPartsRequest.builder()
                    .bucket(bucket)
                    .key(objectKey(handle.getSessionId()))
                    .uploadId(handle.getLocation())
                    .maxParts(1)
                    .build());
            return true;
        } catch (NoSuchUploadException e) {
            return false;
        } catch (SdkException e) {
            throw new StorageBackendException("stagingExists", handle.getSessionId(), "Cannot list parts", e);
        }
    }

    @Override
    public DownloadReference readFinal(String location) {
        try {
            PresignedGetObjectRequest presigned = presigner.presignGetObject(GetObjectPresignRequest.builder()
                    .signatureDuration(signedUrlTtl)
                    .getObjectRequest(r -> r.bucket(bucket).key(location))
                    .build());
            return DownloadReference.ofSignedUrl(presigned.url(), presigned.expiration());
        } catch (SdkException e) {
            throw new StorageBackendException("readFinal", null, "Cannot presign object " + location, e);
        }
    }

    @Override
    public void deleteFinal(String location) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(location).build());
        } catch (SdkException e) {
            throw new StorageBackendException("deleteFinal", null, "Cannot delete object " + location, e);
        }
    }

    @Override
    public boolean objectExists(String location) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(location).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new StorageBackendException("objectExists", null, "Cannot stat object " + location, e);
        } catch (SdkException e) {
            throw new StorageBackendException("objectExists", null, "Cannot stat object " + location, e);
        }
    }

    String objectKey(String sessionId) {
        return keyPrefix.isEmpty() ? sessionId : keyPrefix + "/" + sessionId;
    }

    private Optional<String> findInProgressUpload(String key) {
        ListMultipartUploadsResponse response = s3Client.listMultipartUploads(ListMultipartUploadsRequest.builder()
                .bucket(bucket)
                .prefix(key)
                .build());
        return response.uploads().stream()
                .filter(u -> key.equals(u.key()))
                .map(MultipartUpload::uploadId)
                .findFirst();
    }

    private Optional<Part> findPart(StagingHandle handle, int partNumber) {
        ListPartsResponse response = s3Client.listParts(ListPartsRequest.builder()
                .bucket(bucket)
                .key(objectKey(handle.getSessionId()))
                .uploadId(handle.getLocation())
                .partNumberMarker(partNumber - 1)
                .maxParts(1)
                .build());
        return response.parts().stream()
                .filter(p -> p.partNumber() != null && p.partNumber() == partNumber)
                .findFirst();
    }
}

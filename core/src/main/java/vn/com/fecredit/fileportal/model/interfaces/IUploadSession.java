package vn.com.fecredit.fileportal.model.interfaces;

import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.UploadStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Persistent state of one resumable upload. Adapters supply the storage (JPA entity,
 * in-memory bean); the engine only talks to this interface.
 */
public interface IUploadSession {

    String getSessionId();

    void setSessionId(String sessionId);

    String getOwnerId();

    void setOwnerId(String ownerId);

    String getFilename();

    void setFilename(String filename);

    String getContentType();

    void setContentType(String contentType);

    long getTotalSize();

    void setTotalSize(long totalSize);

    int getChunkSize();

    void setChunkSize(int chunkSize);

    int getTotalChunks();

    void setTotalChunks(int totalChunks);

    /**
     * Arrival bitset, one bit per chunk index, padding bits set.
     */
    byte[] getChunkBitset();

    void setChunkBitset(byte[] chunkBitset);

    /**
     * SHA-256 hex of the bytes accepted for each index.
     */
    Map<Integer, String> getChunkDigests();

    void setChunkDigests(Map<Integer, String> chunkDigests);

    /**
     * Backend reference per index: a chunk file name locally, a part ETag remotely.
     */
    Map<Integer, String> getChunkRefs();

    void setChunkRefs(Map<Integer, String> chunkRefs);

    String getDeclaredHash();

    void setDeclaredHash(String declaredHash);

    String getContentHash();

    void setContentHash(String contentHash);

    UploadStatus getStatus();

    void setStatus(UploadStatus status);

    StorageMode getStorageMode();

    void setStorageMode(StorageMode storageMode);

    String getTempLocation();

    void setTempLocation(String tempLocation);

    String getFinalLocation();

    void setFinalLocation(String finalLocation);

    String getFailureReason();

    void setFailureReason(String failureReason);

    Instant getCreatedAt();

    void setCreatedAt(Instant createdAt);

    Instant getUpdatedAt();

    void setUpdatedAt(Instant updatedAt);

    Instant getExpiresAt();

    void setExpiresAt(Instant expiresAt);

    Instant getCompletedAt();

    void setCompletedAt(Instant completedAt);
}

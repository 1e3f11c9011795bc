package vn.com.fecredit.fileportal.model.interfaces;

import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.UploadStatus;

import java.time.Instant;

/**
 * Archived record of a session that reached a terminal status.
 */
public interface IUploadSessionHistory {

    String getSessionId();

    String getOwnerId();

    String getFilename();

    UploadStatus getStatus();

    StorageMode getStorageMode();

    long getTotalSize();

    int getChunkSize();

    int getTotalChunks();

    int getUploadedChunks();

    String getContentHash();

    String getFinalLocation();

    String getFailureReason();

    Instant getCreatedAt();

    Instant getExpiresAt();

    Instant getCompletedAt();

    Instant getArchivedAt();
}

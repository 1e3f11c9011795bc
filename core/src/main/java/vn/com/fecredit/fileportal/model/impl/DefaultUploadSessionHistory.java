package vn.com.fecredit.fileportal.model.impl;

import lombok.Data;
import lombok.NoArgsConstructor;
import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.UploadStatus;
import vn.com.fecredit.fileportal.model.interfaces.IUploadSessionHistory;

import java.time.Instant;

@Data
@NoArgsConstructor
public class DefaultUploadSessionHistory implements IUploadSessionHistory {

    private String sessionId;
    private String ownerId;
    private String filename;
    private UploadStatus status;
    private StorageMode storageMode;
    private long totalSize;
    private int chunkSize;
    private int totalChunks;
    private int uploadedChunks;
    private String contentHash;
    private String finalLocation;
    private String failureReason;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant completedAt;
    private Instant archivedAt;
}

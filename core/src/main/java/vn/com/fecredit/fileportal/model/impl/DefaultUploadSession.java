package vn.com.fecredit.fileportal.model.impl;

import lombok.Data;
import lombok.NoArgsConstructor;
import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.UploadStatus;
import vn.com.fecredit.fileportal.model.interfaces.IUploadSession;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
public class DefaultUploadSession implements IUploadSession {

    private String sessionId;
    private String ownerId;
    private String filename;
    private String contentType;
    private long totalSize;
    private int chunkSize;
    private int totalChunks;
    private byte[] chunkBitset;
    private Map<Integer, String> chunkDigests = new HashMap<>();
    private Map<Integer, String> chunkRefs = new HashMap<>();
    private String declaredHash;
    private String contentHash;
    private UploadStatus status;
    private StorageMode storageMode;
    private String tempLocation;
    private String finalLocation;
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;
    private Instant completedAt;
}

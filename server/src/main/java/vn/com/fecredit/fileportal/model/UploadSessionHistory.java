package vn.com.fecredit.fileportal.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import vn.com.fecredit.fileportal.model.interfaces.IUploadSession;
import vn.com.fecredit.fileportal.model.interfaces.IUploadSessionHistory;

import java.time.Instant;

/**
 * Final state of a session that was completed, failed or expired.
 */
@Entity
@Table(name = "upload_session_history")
@Data
@NoArgsConstructor
public class UploadSessionHistory implements IUploadSessionHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, unique = true, length = 36)
    private String sessionId;

    @Column(name = "owner_id", nullable = false, length = 50)
    private String ownerId;

    @Column(nullable = false)
    private String filename;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private UploadStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private StorageMode storageMode;

    private long totalSize;

    private int chunkSize;

    private int totalChunks;

    private int uploadedChunks;

    @Column(length = 64)
    private String declaredHash;

    @Column(length = 64)
    private String contentHash;

    @Column(length = 1024)
    private String finalLocation;

    @Column(length = 1000)
    private String failureReason;

    private Instant createdAt;

    private Instant expiresAt;

    private Instant completedAt;

    @Column(nullable = false)
    private Instant archivedAt;

    /**
     * Creates a history row from a session in a terminal status.
     */
    public static UploadSessionHistory fromSession(IUploadSession session, int uploadedChunks, Instant archivedAt) {
        UploadSessionHistory history = new UploadSessionHistory();
        history.setSessionId(session.getSessionId());
        history.setOwnerId(session.getOwnerId());
        history.setFilename(session.getFilename());
        history.setStatus(session.getStatus());
        history.setStorageMode(session.getStorageMode());
        history.setTotalSize(session.getTotalSize());
        history.setChunkSize(session.getChunkSize());
        history.setTotalChunks(session.getTotalChunks());
        history.setUploadedChunks(uploadedChunks);
        history.setDeclaredHash(session.getDeclaredHash());
        history.setContentHash(session.getContentHash());
        history.setFinalLocation(session.getFinalLocation());
        history.setFailureReason(truncate(session.getFailureReason(), 1000));
        history.setCreatedAt(session.getCreatedAt());
        history.setExpiresAt(session.getExpiresAt());
        history.setCompletedAt(session.getCompletedAt());
        history.setArchivedAt(archivedAt);
        return history;
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}

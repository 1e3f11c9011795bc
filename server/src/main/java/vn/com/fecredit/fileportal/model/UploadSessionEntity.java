package vn.com.fecredit.fileportal.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;
import vn.com.fecredit.fileportal.model.interfaces.IUploadSession;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Live upload session row. Rows are deleted once the session reaches a terminal status;
 * the final state is kept in {@link UploadSessionHistory}.
 */
@Entity
@Table(name = "upload_sessions", indexes = {
        @Index(name = "idx_upload_sessions_owner_hash", columnList = "owner_id, declared_hash"),
        @Index(name = "idx_upload_sessions_status_expiry", columnList = "status, expires_at")
})
@Data
public class UploadSessionEntity implements IUploadSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, unique = true, length = 36)
    private String sessionId;

    @Column(name = "owner_id", nullable = false, length = 50)
    private String ownerId;

    @Column(nullable = false)
    private String filename;

    private String contentType;

    @Column(nullable = false)
    private long totalSize;

    @Column(nullable = false)
    private int chunkSize;

    @Column(nullable = false)
    private int totalChunks;

    @Column(name = "chunk_bitset", nullable = false, length = 1_048_576)
    private byte[] chunkBitset;

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "upload_session_chunk_digests", joinColumns = @JoinColumn(name = "upload_session_id"))
    @MapKeyColumn(name = "chunk_index")
    @Column(name = "digest", nullable = false, length = 64)
    private Map<Integer, String> chunkDigests = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "upload_session_chunk_refs", joinColumns = @JoinColumn(name = "upload_session_id"))
    @MapKeyColumn(name = "chunk_index")
    @Column(name = "ref", nullable = false, length = 1024)
    private Map<Integer, String> chunkRefs = new HashMap<>();

    @Column(name = "declared_hash", length = 64)
    private String declaredHash;

    @Column(length = 64)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private UploadStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private StorageMode storageMode;

    @Column(length = 1024)
    private String tempLocation;

    @Column(length = 1024)
    private String finalLocation;

    @Column(length = 1000)
    private String failureReason;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    private Instant completedAt;
}

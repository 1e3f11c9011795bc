package vn.com.fecredit.fileportal.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Permanent metadata of an uploaded file. Created once per completed session; several
 * records may point at the same deduplicated object.
 */
@Entity
@Table(name = "file_records", indexes =
        @Index(name = "idx_file_records_owner", columnList = "owner_id, deleted, uploaded_at"))
@Data
public class FileRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, unique = true, length = 36)
    private String sessionId;

    @Column(name = "owner_id", nullable = false, length = 50)
    private String ownerId;

    @Column(nullable = false)
    private String filename;

    @Column(nullable = false)
    private String originalFilename;

    private String contentType;

    @Column(nullable = false)
    private long size;

    @Column(length = 64)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private StorageMode storageMode;

    @Column(nullable = false, length = 1024)
    private String finalLocation;

    @Column(length = 1000)
    private String description;

    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;

    private Instant updatedAt;

    private Instant lastAccessedAt;

    @Column(nullable = false)
    private long downloadCount;

    @Column(nullable = false)
    private boolean deleted;

    private Instant deletedAt;
}

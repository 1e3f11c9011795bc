package vn.com.fecredit.fileportal.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Maps a content hash to the object holding those bytes, per storage mode.
 */
@Entity
@Table(name = "dedup_entries", uniqueConstraints =
        @UniqueConstraint(name = "uk_dedup_hash_mode", columnNames = {"content_hash", "storage_mode"}))
@Data
@NoArgsConstructor
public class DedupEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "storage_mode", nullable = false, length = 16)
    private StorageMode storageMode;

    @Column(nullable = false, length = 1024)
    private String location;

    @Column(nullable = false)
    private Instant createdAt;

    public DedupEntry(String contentHash, StorageMode storageMode, String location, Instant createdAt) {
        this.contentHash = contentHash;
        this.storageMode = storageMode;
        this.location = location;
        this.createdAt = createdAt;
    }
}

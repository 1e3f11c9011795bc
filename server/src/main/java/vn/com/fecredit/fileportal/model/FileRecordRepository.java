package vn.com.fecredit.fileportal.model;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface FileRecordRepository extends JpaRepository<FileRecord, Long> {

    Optional<FileRecord> findBySessionId(String sessionId);

    Optional<FileRecord> findByIdAndDeletedFalse(Long id);

    Page<FileRecord> findByOwnerIdAndDeletedFalse(String ownerId, Pageable pageable);

    @Modifying
    @Query("update FileRecord f set f.downloadCount = f.downloadCount + 1, f.lastAccessedAt = :now where f.id = :id")
    int recordDownload(@Param("id") Long id, @Param("now") Instant now);
}

package vn.com.fecredit.fileportal.model;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DedupEntryRepository extends JpaRepository<DedupEntry, Long> {
    Optional<DedupEntry> findByContentHashAndStorageMode(String contentHash, StorageMode storageMode);
}

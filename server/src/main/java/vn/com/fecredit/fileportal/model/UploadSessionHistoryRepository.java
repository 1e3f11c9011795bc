package vn.com.fecredit.fileportal.model;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UploadSessionHistoryRepository extends JpaRepository<UploadSessionHistory, Long> {

    Optional<UploadSessionHistory> findBySessionId(String sessionId);
}

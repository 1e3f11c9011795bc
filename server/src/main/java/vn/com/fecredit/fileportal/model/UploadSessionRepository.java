package vn.com.fecredit.fileportal.model;

import org.springframework.data.jpa.repository.JpaRepository;
import vn.com.fecredit.fileportal.port.interfaces.IUploadSessionPort;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface UploadSessionRepository extends JpaRepository<UploadSessionEntity, Long>, IUploadSessionPort<UploadSessionEntity> {

    @Override
    Optional<UploadSessionEntity> findBySessionId(String sessionId);

    @Override
    Optional<UploadSessionEntity> findFirstByOwnerIdAndDeclaredHashAndTotalSizeAndStatusIn(
            String ownerId, String declaredHash, long totalSize, Collection<UploadStatus> statuses);

    /**
     * Sessions still open whose deadline has passed; input of the expiry sweep.
     */
    @Override
    List<UploadSessionEntity> findByStatusInAndExpiresAtBefore(Collection<UploadStatus> statuses, Instant deadline);
}

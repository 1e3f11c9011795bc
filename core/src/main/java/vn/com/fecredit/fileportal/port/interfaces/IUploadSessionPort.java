package vn.com.fecredit.fileportal.port.interfaces;

import vn.com.fecredit.fileportal.model.UploadStatus;
import vn.com.fecredit.fileportal.model.interfaces.IUploadSession;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for live upload sessions.
 */
public interface IUploadSessionPort<T extends IUploadSession> {

    /**
     * Saves a new or updated session.
     *
     * @return the saved instance, which callers must use from then on
     */
    <S extends T> S save(S session);

    Optional<T> findBySessionId(String sessionId);

    /**
     * Finds a session of the owner for the same declared content and size, used to resume
     * an interrupted upload without the client remembering the session id.
     */
    Optional<T> findFirstByOwnerIdAndDeclaredHashAndTotalSizeAndStatusIn(String ownerId, String declaredHash,
                                                                         long totalSize, Collection<UploadStatus> statuses);

    List<T> findByStatusInAndExpiresAtBefore(Collection<UploadStatus> statuses, Instant deadline);

    void delete(T session);
}

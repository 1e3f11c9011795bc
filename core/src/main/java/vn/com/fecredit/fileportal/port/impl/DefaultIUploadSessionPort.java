package vn.com.fecredit.fileportal.port.impl;

import vn.com.fecredit.fileportal.model.UploadStatus;
import vn.com.fecredit.fileportal.model.impl.DefaultUploadSession;
import vn.com.fecredit.fileportal.port.interfaces.IUploadSessionPort;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory session store. Instances are stored by reference; the engine mutates them only
 * under the session lock.
 */
public class DefaultIUploadSessionPort implements IUploadSessionPort<DefaultUploadSession> {

    private final Map<String, DefaultUploadSession> sessions = new ConcurrentHashMap<>();

    @Override
    public <S extends DefaultUploadSession> S save(S session) {
        if (session == null || session.getSessionId() == null) {
            throw new IllegalArgumentException("Session or sessionId cannot be null");
        }
        sessions.put(session.getSessionId(), session);
        return session;
    }

    @Override
    public Optional<DefaultUploadSession> findBySessionId(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<DefaultUploadSession> findFirstByOwnerIdAndDeclaredHashAndTotalSizeAndStatusIn(
            String ownerId, String declaredHash, long totalSize, Collection<UploadStatus> statuses) {
        return sessions.values().stream()
                .filter(s -> ownerId.equals(s.getOwnerId()))
                .filter(s -> declaredHash.equals(s.getDeclaredHash()))
                .filter(s -> s.getTotalSize() == totalSize)
                .filter(s -> statuses.contains(s.getStatus()))
                .findFirst();
    }

    @Override
    public List<DefaultUploadSession> findByStatusInAndExpiresAtBefore(Collection<UploadStatus> statuses, Instant deadline) {
        return sessions.values().stream()
                .filter(s -> statuses.contains(s.getStatus()))
                .filter(s -> s.getExpiresAt() != null && s.getExpiresAt().isBefore(deadline))
                .collect(Collectors.toList());
    }

    @Override
    public void delete(DefaultUploadSession session) {
        if (session == null || session.getSessionId() == null) return;
        sessions.remove(session.getSessionId());
    }

    public int size() {
        return sessions.size();
    }
}

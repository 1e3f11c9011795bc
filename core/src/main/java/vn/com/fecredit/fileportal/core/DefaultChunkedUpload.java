package vn.com.fecredit.fileportal.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.fileportal.dedup.DedupIndex;
import vn.com.fecredit.fileportal.manager.ChunkTracker;
import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.impl.DefaultUploadSession;
import vn.com.fecredit.fileportal.model.impl.DefaultUploadSessionHistory;
import vn.com.fecredit.fileportal.port.impl.DefaultIUploadSessionPort;
import vn.com.fecredit.fileportal.storage.StorageBackend;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Engine wired to in-memory session and history stores, for embedding without a database.
 */
public class DefaultChunkedUpload extends AbstractChunkedUpload<DefaultUploadSession, DefaultIUploadSessionPort> {

    private static final Logger log = LoggerFactory.getLogger(DefaultChunkedUpload.class);

    private final Map<String, DefaultUploadSessionHistory> history = new ConcurrentHashMap<>();

    public DefaultChunkedUpload(DefaultIUploadSessionPort sessionPort, Collection<? extends StorageBackend> backends,
                                StorageMode defaultMode, DedupIndex dedupIndex, Clock clock, Duration sessionTtl,
                                int defaultChunkSize) {
        super(sessionPort, backends, defaultMode, dedupIndex, clock, sessionTtl, defaultChunkSize);
    }

    @Override
    protected DefaultUploadSession createSession() {
        return new DefaultUploadSession();
    }

    @Override
    protected void moveToHistory(DefaultUploadSession session) {
        DefaultUploadSessionHistory entry = new DefaultUploadSessionHistory();
        entry.setSessionId(session.getSessionId());
        entry.setOwnerId(session.getOwnerId());
        entry.setFilename(session.getFilename());
        entry.setStatus(session.getStatus());
        entry.setStorageMode(session.getStorageMode());
        entry.setTotalSize(session.getTotalSize());
        entry.setChunkSize(session.getChunkSize());
        entry.setTotalChunks(session.getTotalChunks());
        entry.setUploadedChunks(new ChunkTracker(session.getChunkBitset(), session.getTotalChunks()).uploadedCount());
        entry.setContentHash(session.getContentHash());
        entry.setFinalLocation(session.getFinalLocation());
        entry.setFailureReason(session.getFailureReason());
        entry.setCreatedAt(session.getCreatedAt());
        entry.setExpiresAt(session.getExpiresAt());
        entry.setCompletedAt(session.getCompletedAt());
        entry.setArchivedAt(now());
        history.put(entry.getSessionId(), entry);
        log.debug("Archived session {} as {}", entry.getSessionId(), entry.getStatus());
    }

    @Override
    protected Optional<DefaultUploadSessionHistory> findArchivedSession(String sessionId) {
        return Optional.ofNullable(history.get(sessionId));
    }
}

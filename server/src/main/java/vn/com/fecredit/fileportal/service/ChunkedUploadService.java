package vn.com.fecredit.fileportal.service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import vn.com.fecredit.fileportal.config.StorageProperties;
import vn.com.fecredit.fileportal.config.UploadProperties;
import vn.com.fecredit.fileportal.core.AbstractChunkedUpload;
import vn.com.fecredit.fileportal.dedup.DedupIndex;
import vn.com.fecredit.fileportal.manager.ChunkTracker;
import vn.com.fecredit.fileportal.model.UploadSessionEntity;
import vn.com.fecredit.fileportal.model.UploadSessionHistory;
import vn.com.fecredit.fileportal.model.UploadSessionHistoryRepository;
import vn.com.fecredit.fileportal.model.UploadSessionRepository;
import vn.com.fecredit.fileportal.storage.StorageBackend;

/**
 * Upload engine persisted through JPA. Completed uploads become file records via
 * {@link FileRecordService}.
 */
@Service
public class ChunkedUploadService extends AbstractChunkedUpload<UploadSessionEntity, UploadSessionRepository> {
    private static final Logger log = LoggerFactory.getLogger(ChunkedUploadService.class);

    private final UploadSessionHistoryRepository historyRepository;

    public ChunkedUploadService(
            UploadSessionRepository uploadSessionRepository,
            UploadSessionHistoryRepository historyRepository,
            List<StorageBackend> storageBackends,
            DedupIndex dedupIndex,
            FileRecordService fileRecordService,
            UploadProperties uploadProperties,
            StorageProperties storageProperties,
            Clock clock) {
        super(uploadSessionRepository, storageBackends, storageProperties.getMode(), dedupIndex, clock,
                uploadProperties.getSessionTtl(), uploadProperties.getDefaultChunkSize());
        this.historyRepository = historyRepository;
        setCompletionListener(fileRecordService);
        setAllowedExtensions(uploadProperties.getAllowedExtensions());
        log.info("Upload engine ready: mode={}, default chunk size={}, session ttl={}, allowed extensions={}",
                storageProperties.getMode(), uploadProperties.getDefaultChunkSize(), uploadProperties.getSessionTtl(),
                uploadProperties.getAllowedExtensions());
    }

    @Override
    protected UploadSessionEntity createSession() {
        return new UploadSessionEntity();
    }

    @Override
    protected void moveToHistory(UploadSessionEntity session) {
        int uploaded = new ChunkTracker(session.getChunkBitset(), session.getTotalChunks()).uploadedCount();
        UploadSessionHistory history = UploadSessionHistory.fromSession(session, uploaded, now());
        historyRepository.findBySessionId(session.getSessionId()).ifPresent(existing -> history.setId(existing.getId()));
        historyRepository.save(history);
        log.info("Moved upload session to history: uploadId={}, status={}", session.getSessionId(), session.getStatus());
    }

    @Override
    protected Optional<UploadSessionHistory> findArchivedSession(String sessionId) {
        return historyRepository.findBySessionId(sessionId);
    }
}

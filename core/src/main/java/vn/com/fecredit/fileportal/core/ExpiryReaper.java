package vn.com.fecredit.fileportal.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.fileportal.model.interfaces.IUploadSession;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Reclaims sessions left open past their deadline. Each candidate is re-checked under its
 * session lock by {@link AbstractChunkedUpload#expireSession}, so a chunk that is being
 * recorded wins over the sweep.
 */
public class ExpiryReaper {

    private static final Logger log = LoggerFactory.getLogger(ExpiryReaper.class);

    private final AbstractChunkedUpload<?, ?> engine;
    private final Clock clock;

    public ExpiryReaper(AbstractChunkedUpload<?, ?> engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * @return number of sessions expired by this sweep
     */
    public int sweep() {
        Instant now = clock.instant();
        List<? extends IUploadSession> candidates = engine.getSessionPort()
                .findByStatusInAndExpiresAtBefore(AbstractChunkedUpload.REAPABLE_STATUSES, now);
        int expired = 0;
        for (IUploadSession candidate : candidates) {
            try {
                if (engine.expireSession(candidate.getSessionId(), now)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire upload session {}", candidate.getSessionId(), e);
            }
        }
        if (!candidates.isEmpty()) {
            log.info("Expiry sweep at {}: {} candidates, {} expired", now, candidates.size(), expired);
        }
        return expired;
    }
}

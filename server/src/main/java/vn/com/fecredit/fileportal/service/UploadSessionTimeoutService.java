package vn.com.fecredit.fileportal.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import vn.com.fecredit.fileportal.core.ExpiryReaper;

/**
 * Runs the expiry sweep on a fixed delay ({@code fileportal.upload.reaper-interval}).
 */
@Service
public class UploadSessionTimeoutService {

    private static final Logger log = LoggerFactory.getLogger(UploadSessionTimeoutService.class);

    private final ExpiryReaper expiryReaper;

    public UploadSessionTimeoutService(ExpiryReaper expiryReaper) {
        this.expiryReaper = expiryReaper;
    }

    @Scheduled(fixedDelayString = "${fileportal.upload.reaper-interval:PT5M}",
            initialDelayString = "${fileportal.upload.reaper-interval:PT5M}")
    public void cleanupExpiredSessions() {
        log.debug("Starting expiry sweep of upload sessions");
        try {
            int expired = expiryReaper.sweep();
            if (expired > 0) {
                log.info("Expired {} upload sessions", expired);
            }
        } catch (RuntimeException e) {
            log.error("Error during expiry sweep of upload sessions: {}", e.getMessage(), e);
        }
    }
}

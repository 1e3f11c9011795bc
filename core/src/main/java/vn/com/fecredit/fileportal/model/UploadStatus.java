package vn.com.fecredit.fileportal.model;

/**
 * Lifecycle of an upload session.
 *
 * <pre>
 * PENDING -> UPLOADING -> MERGING -> COMPLETED
 *                                 -> FAILED
 * PENDING | UPLOADING | MERGING   -> EXPIRED  (reaper)
 * PENDING | UPLOADING             -> FAILED   (owner abort)
 * </pre>
 */
public enum UploadStatus {
    PENDING,
    UPLOADING,
    MERGING,
    COMPLETED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EXPIRED;
    }

    /**
     * Statuses the expiry reaper may reclaim once the deadline has passed.
     */
    public boolean isReapable() {
        return this == PENDING || this == UPLOADING || this == MERGING;
    }

    public boolean acceptsChunks() {
        return this == PENDING || this == UPLOADING;
    }
}

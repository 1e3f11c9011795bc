package vn.com.fecredit.fileportal.core;

/**
 * Receives completed uploads, e.g. to create the permanent file record. Called while the
 * session lock is held, so implementations must not call back into the engine for the
 * same session.
 */
@FunctionalInterface
public interface UploadCompletionListener {

    /**
     * @return an identifier of whatever the listener created, or {@code null}
     */
    String onUploadCompleted(UploadCompletedEvent event);
}

package vn.com.fecredit.fileportal.exception;

import vn.com.fecredit.fileportal.model.UploadStatus;

public class SessionClosedException extends UploadException {

    private final UploadStatus status;

    public SessionClosedException(String sessionId, UploadStatus status) {
        super(UploadErrorCode.SESSION_CLOSED, sessionId, "Upload session " + sessionId + " is already " + status);
        this.status = status;
    }

    public UploadStatus getStatus() {
        return status;
    }
}

package vn.com.fecredit.fileportal.exception;

public class SessionNotFoundException extends UploadException {

    public SessionNotFoundException(String sessionId) {
        super(UploadErrorCode.SESSION_NOT_FOUND, sessionId, "Upload session not found: " + sessionId);
    }
}

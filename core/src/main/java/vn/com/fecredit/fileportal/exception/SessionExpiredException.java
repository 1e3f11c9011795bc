package vn.com.fecredit.fileportal.exception;

public class SessionExpiredException extends UploadException {

    public SessionExpiredException(String sessionId) {
        super(UploadErrorCode.EXPIRED, sessionId, "Upload session " + sessionId + " has expired");
    }
}

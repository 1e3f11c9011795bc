package vn.com.fecredit.fileportal.exception;

/**
 * The caller is not the owner of the session.
 */
public class ForbiddenUploadException extends UploadException {

    public ForbiddenUploadException(String sessionId) {
        super(UploadErrorCode.FORBIDDEN, sessionId, "Upload session " + sessionId + " belongs to another account");
    }
}

package vn.com.fecredit.fileportal.exception;

/**
 * Base exception for upload engine failures. Carries a stable {@link UploadErrorCode}
 * and the session it concerns, if any.
 */
public class UploadException extends RuntimeException {

    private final UploadErrorCode errorCode;
    private final String sessionId;
    private UploadErrorCode.ClientAction clientAction;

    public UploadException(UploadErrorCode errorCode, String sessionId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.sessionId = sessionId;
        this.clientAction = errorCode.getAction();
    }

    public UploadException(UploadErrorCode errorCode, String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sessionId = sessionId;
        this.clientAction = errorCode.getAction();
    }

    public UploadErrorCode getErrorCode() {
        return errorCode;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Action hint for the client. Defaults to the code's action; a backend error during a
     * merge, for instance, fails the whole session and calls for a restart.
     */
    public UploadErrorCode.ClientAction getClientAction() {
        return clientAction;
    }

    public void setClientAction(UploadErrorCode.ClientAction clientAction) {
        this.clientAction = clientAction;
    }
}

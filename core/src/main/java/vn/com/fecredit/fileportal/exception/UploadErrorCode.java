package vn.com.fecredit.fileportal.exception;

/**
 * Error codes surfaced to clients, each with the action a client should take.
 */
public enum UploadErrorCode {
    SESSION_NOT_FOUND(ClientAction.RESTART_UPLOAD),
    FORBIDDEN(ClientAction.NONE),
    INDEX_OUT_OF_RANGE(ClientAction.NONE),
    INVALID_CHUNK(ClientAction.RETRY_CHUNK),
    CHUNK_CONFLICT(ClientAction.NONE),
    SESSION_CLOSED(ClientAction.RESTART_UPLOAD),
    HASH_MISMATCH(ClientAction.RESTART_UPLOAD),
    BACKEND_IO_ERROR(ClientAction.RETRY_CHUNK),
    EXPIRED(ClientAction.RESTART_UPLOAD);

    public enum ClientAction {
        RETRY_CHUNK,
        RESTART_UPLOAD,
        NONE
    }

    private final ClientAction action;

    UploadErrorCode(ClientAction action) {
        this.action = action;
    }

    public ClientAction getAction() {
        return action;
    }
}

package vn.com.fecredit.fileportal.exception;

/**
 * I/O failure in a storage backend. The message may name paths or buckets, so it is
 * logged but never returned to clients.
 */
public class StorageBackendException extends UploadException {

    private final String operation;

    public StorageBackendException(String operation, String sessionId, String message, Throwable cause) {
        super(UploadErrorCode.BACKEND_IO_ERROR, sessionId,
                String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
    }

    public StorageBackendException(String operation, String sessionId, String message) {
        this(operation, sessionId, message, null);
    }

    public String getOperation() {
        return operation;
    }
}

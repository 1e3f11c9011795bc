package vn.com.fecredit.fileportal.exception;

/**
 * Chunk payload has the wrong length for its index.
 */
public class InvalidChunkException extends UploadException {

    public InvalidChunkException(String sessionId, int index, long expected, long actual) {
        super(UploadErrorCode.INVALID_CHUNK, sessionId,
                "Invalid size for chunk " + index + ": expected " + expected + " bytes, got " + actual);
    }
}

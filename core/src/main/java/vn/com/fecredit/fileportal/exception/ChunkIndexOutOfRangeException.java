package vn.com.fecredit.fileportal.exception;

public class ChunkIndexOutOfRangeException extends UploadException {

    public ChunkIndexOutOfRangeException(String sessionId, int index, int totalChunks) {
        super(UploadErrorCode.INDEX_OUT_OF_RANGE, sessionId,
                "Invalid chunk number: " + index + ", totalChunks: " + totalChunks);
    }
}

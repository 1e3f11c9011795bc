package vn.com.fecredit.fileportal.exception;

/**
 * Different bytes were submitted for an index that already holds data. The stored chunk is kept.
 */
public class ChunkConflictException extends UploadException {

    public ChunkConflictException(String sessionId, int index) {
        super(UploadErrorCode.CHUNK_CONFLICT, sessionId,
                "Chunk " + index + " was already uploaded with different content");
    }
}

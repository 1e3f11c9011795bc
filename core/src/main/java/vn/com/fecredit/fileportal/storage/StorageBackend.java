package vn.com.fecredit.fileportal.storage;

import vn.com.fecredit.fileportal.model.StorageMode;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for chunked uploads.
 *
 * <p>
 * Both variants expose the same contract so the engine never branches on the mode:
 * <ul>
 * <li>chunks are staged independently and in any order</li>
 * <li>finalizing assembles them in index order into one object</li>
 * <li>aborting discards everything staged for the session</li>
 * </ul>
 * All I/O failures are reported as
 * {@link vn.com.fecredit.fileportal.exception.StorageBackendException}.
 */
public interface StorageBackend {

    StorageMode mode();

    /**
     * Smallest size a non-final chunk may have in this backend.
     */
    long minimumChunkSize();

    /**
     * Largest number of chunks one upload may be split into.
     */
    int maximumChunkCount();

    /**
     * Creates the staging area for a session, or returns the existing one.
     */
    StagingHandle openStagingArea(String sessionId);

    /**
     * Stores the bytes of one chunk. Writing identical bytes again returns the same
     * acknowledgement; different bytes for a stored index raise
     * {@link vn.com.fecredit.fileportal.exception.ChunkConflictException}.
     */
    ChunkRef writeChunk(StagingHandle handle, int index, byte[] data);

    /**
     * SHA-256 over the staged chunks in order, if the backend can read them back.
     */
    Optional<String> computeContentHash(StagingHandle handle, List<ChunkRef> orderedRefs);

    /**
     * Assembles the staged chunks, ordered by index, into a durable object and releases
     * the staging area.
     */
    StoredObject finalizeUpload(StagingHandle handle, List<ChunkRef> orderedRefs);

    /**
     * Discards the staging area. Safe to call more than once.
     */
    void abort(StagingHandle handle);

    boolean stagingExists(StagingHandle handle);

    DownloadReference readFinal(String location);

    void deleteFinal(String location);

    boolean objectExists(String location);
}

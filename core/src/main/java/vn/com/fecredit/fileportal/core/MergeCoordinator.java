package vn.com.fecredit.fileportal.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.fileportal.dedup.DedupIndex;
import vn.com.fecredit.fileportal.exception.HashMismatchException;
import vn.com.fecredit.fileportal.manager.ChunkTracker;
import vn.com.fecredit.fileportal.model.interfaces.IUploadSession;
import vn.com.fecredit.fileportal.model.util.ChecksumUtil;
import vn.com.fecredit.fileportal.storage.ChunkRef;
import vn.com.fecredit.fileportal.storage.StagingHandle;
import vn.com.fecredit.fileportal.storage.StorageBackend;
import vn.com.fecredit.fileportal.storage.StoredObject;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns a complete staging area into exactly one durable object.
 *
 * <p>
 * Steps, in order:
 * <ol>
 * <li>establish the dedup key from bytes the engine has seen: the content hash where the
 * backend can compute it, otherwise a digest over the ordered chunk digests</li>
 * <li>reject a mismatch between a computed hash and the declared hash</li>
 * <li>reuse an existing object with the same key and drop the staged chunks</li>
 * <li>otherwise finalize, then register the object in the dedup index; losing a
 * registration race deletes this object in favour of the winner</li>
 * </ol>
 * The declared hash is only ever compared, never used as a key or reported as the content hash.
 * Any failure aborts the staging area and propagates. The caller must hold the session lock.
 */
public class MergeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MergeCoordinator.class);

    private final DedupIndex dedupIndex;

    public MergeCoordinator(DedupIndex dedupIndex) {
        this.dedupIndex = dedupIndex;
    }

    public MergeOutcome finalizeSession(IUploadSession session, StorageBackend backend) {
        String sessionId = session.getSessionId();
        ChunkTracker tracker = new ChunkTracker(session.getChunkBitset(), session.getTotalChunks());
        if (!tracker.isComplete()) {
            throw new IllegalStateException("Session " + sessionId + " is missing chunks " + tracker.missingChunks());
        }
        StagingHandle handle = new StagingHandle(sessionId, session.getTempLocation());
        List<ChunkRef> refs = orderedRefs(session);
        String ownLocation = null;
        try {
            String declared = session.getDeclaredHash() == null ? null : session.getDeclaredHash().toLowerCase(Locale.ROOT);
            String computed = backend.computeContentHash(handle, refs).orElse(null);
            if (computed != null && declared != null && !ChecksumUtil.matches(declared, computed)) {
                throw new HashMismatchException(sessionId, declared, computed);
            }
            String dedupKey = computed != null ? computed : manifestDigest(refs);

            Optional<String> existing = dedupIndex.lookup(dedupKey, backend.mode());
            if (existing.isPresent()) {
                backend.abort(handle);
                log.info("Session {} deduplicated onto existing object {}", sessionId, existing.get());
                return new MergeOutcome(existing.get(), computed, session.getTotalSize(), true);
            }

            StoredObject stored = backend.finalizeUpload(handle, refs);
            ownLocation = stored.getLocation();
            if (computed != null && stored.getContentHash() != null && !ChecksumUtil.matches(computed, stored.getContentHash())) {
                throw new HashMismatchException(sessionId, computed, stored.getContentHash());
            }
            String contentHash = computed != null ? computed : stored.getContentHash();

            String winner = dedupIndex.register(dedupKey, backend.mode(), ownLocation);
            if (!winner.equals(ownLocation)) {
                log.info("Session {} lost dedup race for {}, dropping {} in favour of {}", sessionId, dedupKey, ownLocation, winner);
                backend.deleteFinal(ownLocation);
                return new MergeOutcome(winner, contentHash, stored.getSize(), true);
            }
            return new MergeOutcome(ownLocation, contentHash, stored.getSize(), false);
        } catch (RuntimeException e) {
            cleanUp(backend, handle, ownLocation, e);
            throw e;
        }
    }

    private void cleanUp(StorageBackend backend, StagingHandle handle, String ownLocation, RuntimeException failure) {
        try {
            backend.abort(handle);
        } catch (RuntimeException e) {
            log.warn("Could not abort staging area of session {}: {}", handle.getSessionId(), e.getMessage());
            failure.addSuppressed(e);
        }
        if (ownLocation != null) {
            try {
                backend.deleteFinal(ownLocation);
            } catch (RuntimeException e) {
                log.warn("Could not delete partial object {} of session {}: {}", ownLocation, handle.getSessionId(), e.getMessage());
                failure.addSuppressed(e);
            }
        }
    }

    /**
     * SHA-256 over the raw digests of the chunks in index order. Identical chunk sequences
     * give identical keys without reading the assembled object back.
     */
    static String manifestDigest(List<ChunkRef> orderedRefs) {
        MessageDigest digest = ChecksumUtil.newDigest();
        for (ChunkRef ref : orderedRefs) {
            digest.update(ChecksumUtil.fromHex(ref.getDigest()));
        }
        return ChecksumUtil.toHex(digest.digest());
    }

    static List<ChunkRef> orderedRefs(IUploadSession session) {
        List<ChunkRef> refs = new ArrayList<>(session.getTotalChunks());
        for (int i = 0; i < session.getTotalChunks(); i++) {
            String ref = session.getChunkRefs().get(i);
            String digest = session.getChunkDigests().get(i);
            if (ref == null || digest == null) {
                throw new IllegalStateException("No stored reference for chunk " + i + " of session " + session.getSessionId());
            }
            refs.add(new ChunkRef(i, ref, digest, expectedChunkLength(session, i)));
        }
        return refs;
    }

    static long expectedChunkLength(IUploadSession session, int index) {
        if (index < session.getTotalChunks() - 1) {
            return session.getChunkSize();
        }
        return session.getTotalSize() - (long) session.getChunkSize() * (session.getTotalChunks() - 1);
    }
}

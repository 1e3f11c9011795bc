package vn.com.fecredit.fileportal.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;
import vn.com.fecredit.fileportal.dedup.DedupIndex;
import vn.com.fecredit.fileportal.exception.ChunkConflictException;
import vn.com.fecredit.fileportal.exception.ChunkIndexOutOfRangeException;
import vn.com.fecredit.fileportal.exception.ForbiddenUploadException;
import vn.com.fecredit.fileportal.exception.InvalidChunkException;
import vn.com.fecredit.fileportal.exception.SessionClosedException;
import vn.com.fecredit.fileportal.exception.SessionExpiredException;
import vn.com.fecredit.fileportal.exception.SessionNotFoundException;
import vn.com.fecredit.fileportal.exception.StorageBackendException;
import vn.com.fecredit.fileportal.exception.UploadErrorCode;
import vn.com.fecredit.fileportal.exception.UploadException;
import vn.com.fecredit.fileportal.manager.ChunkTracker;
import vn.com.fecredit.fileportal.model.ChunkResponse;
import vn.com.fecredit.fileportal.model.InitRequest;
import vn.com.fecredit.fileportal.model.InitResponse;
import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.UploadSessionView;
import vn.com.fecredit.fileportal.model.UploadStatus;
import vn.com.fecredit.fileportal.model.interfaces.IUploadSession;
import vn.com.fecredit.fileportal.model.interfaces.IUploadSessionHistory;
import vn.com.fecredit.fileportal.model.util.BitsetUtil;
import vn.com.fecredit.fileportal.model.util.ChecksumUtil;
import vn.com.fecredit.fileportal.port.interfaces.IUploadSessionPort;
import vn.com.fecredit.fileportal.storage.ChunkRef;
import vn.com.fecredit.fileportal.storage.DownloadReference;
import vn.com.fecredit.fileportal.storage.StagingHandle;
import vn.com.fecredit.fileportal.storage.StorageBackend;

/**
 * Resumable chunked-upload engine.
 *
 * <p>
 * Every mutation of a session happens under a per-session {@link ReentrantLock}. Chunk bytes
 * are written to the backend outside that lock so uploads of different chunks of the same
 * session proceed in parallel; an index being written is reserved so a concurrent duplicate
 * is recognised without writing twice. The call that records the last missing chunk moves
 * the session to MERGING and runs the merge before releasing the lock, so exactly one merge
 * happens per session.
 *
 * <p>
 * Sessions reaching COMPLETED, FAILED or EXPIRED are moved to history and removed from the
 * live store; later requests for them are answered from history.
 *
 * @param <T> session type stored by the port
 * @param <P> persistence port
 */
public abstract class AbstractChunkedUpload<T extends IUploadSession, P extends IUploadSessionPort<T>> {

    private static final Logger log = LoggerFactory.getLogger(AbstractChunkedUpload.class);

    static final Set<UploadStatus> RESUMABLE_STATUSES = EnumSet.of(UploadStatus.PENDING, UploadStatus.UPLOADING);
    static final Set<UploadStatus> REAPABLE_STATUSES = EnumSet.of(UploadStatus.PENDING, UploadStatus.UPLOADING, UploadStatus.MERGING);

    @Getter
    private final P sessionPort;
    @Getter
    private final StorageMode defaultMode;
    @Getter
    private final int defaultChunkSize;
    @Getter
    private final Duration sessionTtl;
    private final Map<StorageMode, StorageBackend> backends = new EnumMap<>(StorageMode.class);
    private final MergeCoordinator mergeCoordinator;
    private final Clock clock;
    private volatile UploadCompletionListener completionListener = event -> null;
    // lowercase extensions without the dot; empty accepts any filename
    private volatile Set<String> allowedExtensions = Set.of();

    private final ConcurrentHashMap<String, ReentrantLock> uploadLocks = new ConcurrentHashMap<>();
    // sessionId -> (chunk index -> digest) for chunks currently being written to the backend
    private final ConcurrentHashMap<String, Map<Integer, String>> inFlightChunks = new ConcurrentHashMap<>();

    protected AbstractChunkedUpload(P sessionPort, Collection<? extends StorageBackend> backends, StorageMode defaultMode,
                                    DedupIndex dedupIndex, Clock clock, Duration sessionTtl, int defaultChunkSize) {
        this.sessionPort = sessionPort;
        for (StorageBackend backend : backends) {
            this.backends.put(backend.mode(), backend);
        }
        if (!this.backends.containsKey(defaultMode)) {
            throw new IllegalArgumentException("No storage backend configured for mode " + defaultMode);
        }
        if (defaultChunkSize <= 0) {
            throw new IllegalArgumentException("Default chunk size must be positive: " + defaultChunkSize);
        }
        this.defaultMode = defaultMode;
        this.mergeCoordinator = new MergeCoordinator(dedupIndex);
        this.clock = clock;
        this.sessionTtl = sessionTtl;
        this.defaultChunkSize = defaultChunkSize;
    }

    /**
     * New, empty session instance of the adapter's type.
     */
    protected abstract T createSession();

    /**
     * Copies a terminal session into the history store.
     */
    protected abstract void moveToHistory(T session);

    protected abstract Optional<? extends IUploadSessionHistory> findArchivedSession(String sessionId);

    public void setCompletionListener(UploadCompletionListener completionListener) {
        this.completionListener = completionListener != null ? completionListener : event -> null;
    }

    public void setAllowedExtensions(Collection<String> extensions) {
        this.allowedExtensions = extensions == null ? Set.of() : extensions.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .map(e -> e.startsWith(".") ? e.substring(1) : e)
                .filter(e -> !e.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Creates a session, or re-presents a live session of the same owner when the request
     * names it ({@code brokenUploadId}) or declares the same content hash and size.
     */
    public InitResponse initializeUpload(String ownerId, InitRequest request) {
        if (request.getFilename() == null || request.getFilename().isBlank()) {
            throw new IllegalArgumentException("Filename is required");
        }
        if (!isAllowedFilename(request.getFilename())) {
            throw new IllegalArgumentException("File type not allowed");
        }
        if (request.getFileSize() <= 0) {
            throw new IllegalArgumentException("File size must be positive");
        }
        StorageBackend backend = backendFor(defaultMode);
        int chunkSize = request.getChunkSize() != null ? request.getChunkSize() : defaultChunkSize;
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        long chunkCount = (request.getFileSize() + chunkSize - 1) / chunkSize;
        if (chunkCount > backend.maximumChunkCount()) {
            throw new IllegalArgumentException("File would need " + chunkCount + " chunks, more than the "
                    + backend.maximumChunkCount() + " allowed; use a larger chunk size");
        }
        if (chunkCount > 1 && chunkSize < backend.minimumChunkSize()) {
            throw new IllegalArgumentException("Chunk size must be at least " + backend.minimumChunkSize() + " bytes");
        }
        String declaredHash = request.getChecksum() == null || request.getChecksum().isBlank()
                ? null : request.getChecksum().toLowerCase(Locale.ROOT);

        Optional<T> resumable = findResumable(ownerId, request.getBrokenUploadId(), declaredHash, request.getFileSize());
        if (resumable.isPresent()) {
            T session = resumable.get();
            log.info("Resuming upload session {} for owner {}, {} chunks missing", session.getSessionId(), ownerId,
                    tracker(session).missingChunks().size());
            return toInitResponse(session, true);
        }

        Instant now = now();
        String sessionId = UUID.randomUUID().toString();
        T session = createSession();
        session.setSessionId(sessionId);
        session.setOwnerId(ownerId);
        session.setFilename(request.getFilename());
        session.setContentType(request.getContentType());
        session.setTotalSize(request.getFileSize());
        session.setChunkSize(chunkSize);
        session.setTotalChunks((int) chunkCount);
        session.setChunkBitset(BitsetUtil.newBitset((int) chunkCount));
        session.setDeclaredHash(declaredHash);
        session.setStatus(UploadStatus.PENDING);
        session.setStorageMode(backend.mode());
        session.setCreatedAt(now);
        session.setUpdatedAt(now);
        session.setExpiresAt(now.plus(sessionTtl));

        StagingHandle handle = backend.openStagingArea(sessionId);
        session.setTempLocation(handle.getLocation());
        try {
            session = sessionPort.save(session);
        } catch (RuntimeException e) {
            backend.abort(handle);
            throw e;
        }
        log.info("Created upload session {} for owner {}: {} bytes in {} chunks of {} ({})",
                sessionId, ownerId, session.getTotalSize(), chunkCount, chunkSize, backend.mode());
        return toInitResponse(session, false);
    }

    /**
     * Accepts the bytes of one chunk. Resubmitting identical bytes is a no-op; the call that
     * completes the set of chunks also merges them and returns the terminal status.
     */
    public ChunkResponse acceptChunk(String ownerId, String sessionId, int index, byte[] data) {
        byte[] bytes = data != null ? data : new byte[0];
        String digest = ChecksumUtil.sha256Hex(bytes);
        ReentrantLock lock = lockFor(sessionId);

        T session;
        StorageBackend backend;
        lock.lock();
        try {
            session = loadOpenSession(ownerId, sessionId);
            validateChunk(session, index, bytes.length);
            ChunkTracker tracker = tracker(session);
            if (tracker.isPresent(index)) {
                if (!digest.equals(session.getChunkDigests().get(index))) {
                    throw new ChunkConflictException(sessionId, index);
                }
                log.debug("Duplicate chunk {} for session {} ignored", index, sessionId);
                return toChunkResponse(session, index, tracker, null);
            }
            Map<Integer, String> reserved = inFlightChunks.computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>());
            String pending = reserved.get(index);
            if (pending != null) {
                if (!pending.equals(digest)) {
                    throw new ChunkConflictException(sessionId, index);
                }
                log.debug("Chunk {} for session {} is already being written", index, sessionId);
                return toChunkResponse(session, index, tracker, null);
            }
            reserved.put(index, digest);
            backend = backendFor(session.getStorageMode());
        } finally {
            lock.unlock();
        }

        ChunkRef ref;
        try {
            ref = backend.writeChunk(new StagingHandle(sessionId, session.getTempLocation()), index, bytes);
        } catch (RuntimeException e) {
            releaseReservation(sessionId, index);
            log.warn("Writing chunk {} of session {} failed: {}", index, sessionId, e.getMessage());
            throw e;
        }

        lock.lock();
        try {
            releaseReservation(sessionId, index);
            T current = sessionPort.findBySessionId(sessionId).orElse(null);
            if (current == null || current.getStatus().isTerminal()) {
                // closed (expired or aborted) while the bytes were in transit
                throw closedSessionError(sessionId);
            }
            ChunkTracker tracker = tracker(current);
            tracker.mark(index);
            current.setChunkBitset(tracker.bitset());
            current.getChunkDigests().put(index, digest);
            current.getChunkRefs().put(index, ref.getRef());
            if (current.getStatus() == UploadStatus.PENDING) {
                current.setStatus(UploadStatus.UPLOADING);
            }
            current.setUpdatedAt(now());
            log.debug("Stored chunk {} of session {} ({}%)", index, sessionId, tracker.progressPercent());

            if (!tracker.isComplete() || current.getStatus() != UploadStatus.UPLOADING) {
                current = sessionPort.save(current);
                return toChunkResponse(current, index, tracker, null);
            }

            current.setStatus(UploadStatus.MERGING);
            current = sessionPort.save(current);
            log.info("All {} chunks received for session {}, merging", current.getTotalChunks(), sessionId);
            String fileId = merge(current, backend);
            return toChunkResponse(current, index, tracker, fileId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Status of a live or archived session owned by the caller.
     */
    public UploadSessionView getSessionStatus(String ownerId, String sessionId) {
        Optional<T> live = sessionPort.findBySessionId(sessionId);
        if (live.isPresent()) {
            checkOwner(live.get().getOwnerId(), ownerId, sessionId);
            return toView(live.get());
        }
        IUploadSessionHistory archived = findArchivedSession(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        checkOwner(archived.getOwnerId(), ownerId, sessionId);
        return toView(archived);
    }

    /**
     * Cancels an open session and discards its staged chunks. Aborting a session that is
     * already terminal returns its archived state.
     */
    public UploadSessionView abortUpload(String ownerId, String sessionId) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            T session = sessionPort.findBySessionId(sessionId).orElse(null);
            if (session == null) {
                uploadLocks.remove(sessionId, lock);
                IUploadSessionHistory archived = findArchivedSession(sessionId)
                        .orElseThrow(() -> new SessionNotFoundException(sessionId));
                checkOwner(archived.getOwnerId(), ownerId, sessionId);
                return toView(archived);
            }
            checkOwner(session.getOwnerId(), ownerId, sessionId);
            if (session.getStatus() == UploadStatus.MERGING) {
                throw new SessionClosedException(sessionId, session.getStatus());
            }
            backendFor(session.getStorageMode()).abort(new StagingHandle(sessionId, session.getTempLocation()));
            session.setStatus(UploadStatus.FAILED);
            session.setFailureReason("aborted by owner");
            session.setUpdatedAt(now());
            UploadSessionView view = toView(session);
            archive(session);
            log.info("Upload session {} aborted by {}", sessionId, ownerId);
            return view;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Expires one session if it is still open and past its deadline. Sessions whose lock is
     * held are skipped and picked up by a later sweep.
     *
     * @return {@code true} if the session was expired by this call
     */
    public boolean expireSession(String sessionId, Instant now) {
        ReentrantLock lock = lockFor(sessionId);
        if (!lock.tryLock()) {
            log.debug("Session {} is busy, skipping expiry this round", sessionId);
            return false;
        }
        try {
            T session = sessionPort.findBySessionId(sessionId).orElse(null);
            if (session == null) {
                uploadLocks.remove(sessionId, lock);
                return false;
            }
            if (!REAPABLE_STATUSES.contains(session.getStatus())
                    || session.getExpiresAt() == null || !now.isAfter(session.getExpiresAt())) {
                return false;
            }
            UploadStatus previous = session.getStatus();
            session.setStatus(UploadStatus.EXPIRED);
            session.setFailureReason("expired");
            session.setUpdatedAt(now);
            try {
                backendFor(session.getStorageMode()).abort(new StagingHandle(sessionId, session.getTempLocation()));
            } catch (StorageBackendException e) {
                log.warn("Could not discard staging area of expired session {}", sessionId, e);
            }
            archive(session);
            log.info("Expired upload session {} (was {}, deadline {})", sessionId, previous, session.getExpiresAt());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public DownloadReference openDownload(StorageMode mode, String location) {
        return backendFor(mode).readFinal(location);
    }

    public StorageBackend backendFor(StorageMode mode) {
        StorageBackend backend = backends.get(mode);
        if (backend == null) {
            throw new IllegalStateException("No storage backend configured for mode " + mode);
        }
        return backend;
    }

    protected Instant now() {
        return clock.instant();
    }

    private String merge(T session, StorageBackend backend) {
        String sessionId = session.getSessionId();
        try {
            MergeOutcome outcome = mergeCoordinator.finalizeSession(session, backend);
            String fileId = completionListener.onUploadCompleted(new UploadCompletedEvent(sessionId, session.getOwnerId(),
                    session.getFilename(), session.getContentType(), outcome.getFinalLocation(), outcome.getSize(),
                    outcome.getContentHash(), session.getStorageMode(), outcome.isDeduplicated()));
            Instant now = now();
            session.setStatus(UploadStatus.COMPLETED);
            session.setFinalLocation(outcome.getFinalLocation());
            session.setContentHash(outcome.getContentHash());
            session.setCompletedAt(now);
            session.setUpdatedAt(now);
            archive(session);
            log.info("Upload session {} completed at {}{}", sessionId, outcome.getFinalLocation(),
                    outcome.isDeduplicated() ? " (deduplicated)" : "");
            return fileId;
        } catch (RuntimeException e) {
            log.error("Merge failed for upload session {}", sessionId, e);
            session.setStatus(UploadStatus.FAILED);
            session.setFailureReason(e.getMessage());
            session.setUpdatedAt(now());
            archive(session);
            if (e instanceof UploadException) {
                ((UploadException) e).setClientAction(UploadErrorCode.ClientAction.RESTART_UPLOAD);
            }
            throw e;
        }
    }

    private void archive(T session) {
        String sessionId = session.getSessionId();
        moveToHistory(session);
        sessionPort.delete(session);
        inFlightChunks.remove(sessionId);
        uploadLocks.remove(sessionId);
    }

    private Optional<T> findResumable(String ownerId, String brokenUploadId, String declaredHash, long totalSize) {
        Instant now = now();
        Optional<T> candidate = Optional.empty();
        if (brokenUploadId != null && !brokenUploadId.isBlank()) {
            candidate = sessionPort.findBySessionId(brokenUploadId)
                    .filter(s -> ownerId.equals(s.getOwnerId()) && s.getTotalSize() == totalSize);
            if (candidate.isEmpty()) {
                log.debug("Broken upload {} is not resumable for owner {}", brokenUploadId, ownerId);
            }
        }
        if (candidate.isEmpty() && declaredHash != null) {
            candidate = sessionPort.findFirstByOwnerIdAndDeclaredHashAndTotalSizeAndStatusIn(
                    ownerId, declaredHash, totalSize, RESUMABLE_STATUSES);
        }
        return candidate
                .filter(s -> RESUMABLE_STATUSES.contains(s.getStatus()))
                .filter(s -> s.getExpiresAt() != null && now.isBefore(s.getExpiresAt()))
                .filter(s -> backendFor(s.getStorageMode())
                        .stagingExists(new StagingHandle(s.getSessionId(), s.getTempLocation())));
    }

    private T loadOpenSession(String ownerId, String sessionId) {
        T session = sessionPort.findBySessionId(sessionId).orElse(null);
        if (session == null) {
            // ids are never reused, so a lock for a session that is not live can go
            uploadLocks.remove(sessionId);
            IUploadSessionHistory archived = findArchivedSession(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            checkOwner(archived.getOwnerId(), ownerId, sessionId);
            throw closedError(sessionId, archived.getStatus());
        }
        checkOwner(session.getOwnerId(), ownerId, sessionId);
        if (!session.getStatus().acceptsChunks()) {
            throw closedError(sessionId, session.getStatus());
        }
        if (session.getExpiresAt() != null && now().isAfter(session.getExpiresAt())) {
            throw new SessionExpiredException(sessionId);
        }
        return session;
    }

    private UploadException closedSessionError(String sessionId) {
        UploadStatus status = findArchivedSession(sessionId)
                .map(IUploadSessionHistory::getStatus)
                .orElse(UploadStatus.FAILED);
        return closedError(sessionId, status);
    }

    private static UploadException closedError(String sessionId, UploadStatus status) {
        if (status == UploadStatus.EXPIRED) {
            return new SessionExpiredException(sessionId);
        }
        return new SessionClosedException(sessionId, status);
    }

    private static void checkOwner(String actualOwner, String caller, String sessionId) {
        if (actualOwner == null || !actualOwner.equals(caller)) {
            throw new ForbiddenUploadException(sessionId);
        }
    }

    private static void validateChunk(IUploadSession session, int index, int length) {
        int totalChunks = session.getTotalChunks();
        if (index < 0 || index >= totalChunks) {
            throw new ChunkIndexOutOfRangeException(session.getSessionId(), index, totalChunks);
        }
        long expected = MergeCoordinator.expectedChunkLength(session, index);
        if (length != expected) {
            throw new InvalidChunkException(session.getSessionId(), index, expected, length);
        }
    }

    private void releaseReservation(String sessionId, int index) {
        Map<Integer, String> reserved = inFlightChunks.get(sessionId);
        if (reserved != null) {
            reserved.remove(index);
        }
    }

    private boolean isAllowedFilename(String filename) {
        Set<String> allowed = allowedExtensions;
        if (allowed.isEmpty()) {
            return true;
        }
        int dot = filename.lastIndexOf('.');
        return dot >= 0 && allowed.contains(filename.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    int activeLockCount() {
        return uploadLocks.size();
    }

    private ReentrantLock lockFor(String sessionId) {
        return uploadLocks.computeIfAbsent(sessionId, k -> new ReentrantLock());
    }

    private static ChunkTracker tracker(IUploadSession session) {
        return new ChunkTracker(session.getChunkBitset(), session.getTotalChunks());
    }

    private InitResponse toInitResponse(T session, boolean resumed) {
        InitResponse response = new InitResponse(session.getSessionId(), session.getTotalChunks(), session.getChunkSize(),
                session.getTotalSize(), session.getFilename(), session.getChunkBitset().clone());
        response.setStatus(session.getStatus().name());
        response.setResumed(resumed);
        response.setExpiresAt(session.getExpiresAt());
        response.setChecksum(session.getDeclaredHash());
        response.setMissingChunkNumbers(tracker(session).missingChunks());
        return response;
    }

    private static ChunkResponse toChunkResponse(IUploadSession session, int index, ChunkTracker tracker, String fileId) {
        ChunkResponse response = new ChunkResponse(session.getSessionId(), index, session.getStatus().name(),
                tracker.progressPercent(), tracker.missingChunks());
        response.setFileId(fileId);
        return response;
    }

    private static UploadSessionView toView(IUploadSession session) {
        ChunkTracker tracker = tracker(session);
        UploadSessionView view = baseView(session.getSessionId(), session.getOwnerId(), session.getFilename(),
                session.getStatus(), session.getStorageMode(), session.getTotalSize(), session.getChunkSize(),
                session.getTotalChunks());
        view.setProgressPercent(tracker.progressPercent());
        view.setMissingChunkNumbers(tracker.missingChunks());
        view.setContentHash(session.getContentHash());
        view.setFailureReason(session.getFailureReason());
        view.setCreatedAt(session.getCreatedAt());
        view.setUpdatedAt(session.getUpdatedAt());
        view.setExpiresAt(session.getExpiresAt());
        view.setCompletedAt(session.getCompletedAt());
        return view;
    }

    private static UploadSessionView toView(IUploadSessionHistory archived) {
        UploadSessionView view = baseView(archived.getSessionId(), archived.getOwnerId(), archived.getFilename(),
                archived.getStatus(), archived.getStorageMode(), archived.getTotalSize(), archived.getChunkSize(),
                archived.getTotalChunks());
        int total = Math.max(archived.getTotalChunks(), 1);
        view.setProgressPercent(Math.round(archived.getUploadedChunks() * 10000.0 / total) / 100.0);
        view.setContentHash(archived.getContentHash());
        view.setFailureReason(archived.getFailureReason());
        view.setCreatedAt(archived.getCreatedAt());
        view.setUpdatedAt(archived.getArchivedAt());
        view.setExpiresAt(archived.getExpiresAt());
        view.setCompletedAt(archived.getCompletedAt());
        return view;
    }

    private static UploadSessionView baseView(String sessionId, String ownerId, String filename, UploadStatus status,
                                              StorageMode mode, long totalSize, int chunkSize, int totalChunks) {
        UploadSessionView view = new UploadSessionView();
        view.setUploadId(sessionId);
        view.setOwnerId(ownerId);
        view.setFilename(filename);
        view.setStatus(status.name());
        view.setStorageMode(mode != null ? mode.name() : null);
        view.setFileSize(totalSize);
        view.setChunkSize(chunkSize);
        view.setTotalChunks(totalChunks);
        return view;
    }
}

package vn.com.fecredit.fileportal.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import vn.com.fecredit.fileportal.dedup.InMemoryDedupIndex;
import vn.com.fecredit.fileportal.exception.SessionExpiredException;
import vn.com.fecredit.fileportal.model.ChunkResponse;
import vn.com.fecredit.fileportal.model.InitRequest;
import vn.com.fecredit.fileportal.model.InitResponse;
import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.UploadSessionView;
import vn.com.fecredit.fileportal.model.UploadStatus;
import vn.com.fecredit.fileportal.model.impl.DefaultUploadSession;
import vn.com.fecredit.fileportal.port.impl.DefaultIUploadSessionPort;
import vn.com.fecredit.fileportal.storage.LocalStorageBackend;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExpiryReaperTest {

    private static final String OWNER = "alice";

    @TempDir
    Path tempDir;

    private LocalStorageBackend backend;
    private MutableClock clock;
    private DefaultChunkedUpload chunkedUpload;
    private ExpiryReaper reaper;

    @BeforeEach
    void setUp() {
        backend = new LocalStorageBackend(tempDir.resolve("staging"), tempDir.resolve("objects"));
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
        chunkedUpload = new DefaultChunkedUpload(new DefaultIUploadSessionPort(), List.of(backend), StorageMode.LOCAL,
                new InMemoryDedupIndex(), clock, Duration.ofHours(24), 4);
        reaper = new ExpiryReaper(chunkedUpload, clock);
    }

    @Test
    void expiresOnlyOpenSessionsPastTheirDeadline() {
        InitResponse pending = chunkedUpload.initializeUpload(OWNER, new InitRequest("pending.txt", 8, null, null));
        InitResponse uploading = chunkedUpload.initializeUpload(OWNER, new InitRequest("uploading.txt", 8, null, null));
        chunkedUpload.acceptChunk(OWNER, uploading.getUploadId(), 0, "abcd".getBytes());
        InitResponse completed = chunkedUpload.initializeUpload(OWNER, new InitRequest("done.txt", 4, null, null));
        chunkedUpload.acceptChunk(OWNER, completed.getUploadId(), 0, "wxyz".getBytes());

        clock.advance(Duration.ofHours(1));
        assertEquals(0, reaper.sweep());

        clock.advance(Duration.ofHours(24));
        assertEquals(2, reaper.sweep());

        UploadSessionView expired = chunkedUpload.getSessionStatus(OWNER, uploading.getUploadId());
        assertEquals("EXPIRED", expired.getStatus());
        assertEquals(50.0, expired.getProgressPercent());
        assertEquals("EXPIRED", chunkedUpload.getSessionStatus(OWNER, pending.getUploadId()).getStatus());
        assertEquals("COMPLETED", chunkedUpload.getSessionStatus(OWNER, completed.getUploadId()).getStatus());
        assertFalse(Files.exists(backend.getStagingRoot().resolve(pending.getUploadId())));
        assertFalse(Files.exists(backend.getStagingRoot().resolve(uploading.getUploadId())));

        assertEquals(0, reaper.sweep(), "a second sweep finds nothing left");
    }

    @Test
    void chunksForReapedSessionReportExpiry() {
        InitResponse init = chunkedUpload.initializeUpload(OWNER, new InitRequest("late.txt", 8, null, null));
        clock.advance(Duration.ofHours(25));
        reaper.sweep();

        assertThrows(SessionExpiredException.class,
                () -> chunkedUpload.acceptChunk(OWNER, init.getUploadId(), 0, "abcd".getBytes()));
    }

    @Test
    void sessionAtExactDeadlineIsKept() {
        InitResponse init = chunkedUpload.initializeUpload(OWNER, new InitRequest("edge.txt", 8, null, null));
        clock.advance(Duration.ofHours(24));

        assertEquals(0, reaper.sweep());
        assertFalse(chunkedUpload.expireSession(init.getUploadId(), clock.instant()));
        assertEquals("PENDING", chunkedUpload.getSessionStatus(OWNER, init.getUploadId()).getStatus());
    }

    @Test
    void sessionMergingWhenDeadlinePassesIsNotReaped() throws Exception {
        CountDownLatch merging = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        chunkedUpload.setCompletionListener(event -> {
            merging.countDown();
            try {
                assertTrue(release.await(10, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return "file-1";
        });
        InitResponse init = chunkedUpload.initializeUpload(OWNER, new InitRequest("slow.txt", 8, null, null));
        chunkedUpload.acceptChunk(OWNER, init.getUploadId(), 0, "abcd".getBytes());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ChunkResponse> last = executor.submit(
                    () -> chunkedUpload.acceptChunk(OWNER, init.getUploadId(), 1, "efgh".getBytes()));
            assertTrue(merging.await(10, TimeUnit.SECONDS));

            clock.advance(Duration.ofHours(25));
            assertEquals(0, reaper.sweep());

            release.countDown();
            assertEquals("COMPLETED", last.get(10, TimeUnit.SECONDS).getStatus());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertEquals("COMPLETED", chunkedUpload.getSessionStatus(OWNER, init.getUploadId()).getStatus());
        assertEquals(0, reaper.sweep());
    }

    @Test
    void staleCandidateOfCompletedSessionIsSkipped() {
        List<DefaultUploadSession> snapshot = new ArrayList<>();
        DefaultIUploadSessionPort stalePort = new DefaultIUploadSessionPort() {
            @Override
            public List<DefaultUploadSession> findByStatusInAndExpiresAtBefore(Collection<UploadStatus> statuses, Instant deadline) {
                return snapshot;
            }
        };
        DefaultChunkedUpload engine = new DefaultChunkedUpload(stalePort, List.of(backend), StorageMode.LOCAL,
                new InMemoryDedupIndex(), clock, Duration.ofHours(24), 4);
        InitResponse init = engine.initializeUpload(OWNER, new InitRequest("quick.txt", 4, null, null));

        DefaultUploadSession stale = new DefaultUploadSession();
        stale.setSessionId(init.getUploadId());
        stale.setOwnerId(OWNER);
        stale.setStatus(UploadStatus.UPLOADING);
        stale.setExpiresAt(clock.instant());
        snapshot.add(stale);

        engine.acceptChunk(OWNER, init.getUploadId(), 0, "wxyz".getBytes());
        clock.advance(Duration.ofHours(25));

        assertEquals(0, new ExpiryReaper(engine, clock).sweep());
        assertEquals("COMPLETED", engine.getSessionStatus(OWNER, init.getUploadId()).getStatus());
        assertEquals(0, engine.activeLockCount());
    }
}

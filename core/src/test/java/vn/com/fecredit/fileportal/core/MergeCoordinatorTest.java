package vn.com.fecredit.fileportal.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import vn.com.fecredit.fileportal.dedup.DedupIndex;
import vn.com.fecredit.fileportal.dedup.InMemoryDedupIndex;
import vn.com.fecredit.fileportal.exception.HashMismatchException;
import vn.com.fecredit.fileportal.exception.StorageBackendException;
import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.UploadStatus;
import vn.com.fecredit.fileportal.model.impl.DefaultUploadSession;
import vn.com.fecredit.fileportal.model.util.BitsetUtil;
import vn.com.fecredit.fileportal.model.util.ChecksumUtil;
import vn.com.fecredit.fileportal.storage.StagingHandle;
import vn.com.fecredit.fileportal.storage.StorageBackend;
import vn.com.fecredit.fileportal.storage.StoredObject;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MergeCoordinatorTest {

    private static final String HASH = ChecksumUtil.sha256Hex("hello world".getBytes(StandardCharsets.UTF_8));
    private static final String OTHER_HASH = ChecksumUtil.sha256Hex("something else".getBytes(StandardCharsets.UTF_8));

    @Mock
    private StorageBackend backend;

    private InMemoryDedupIndex dedupIndex;
    private MergeCoordinator coordinator;

    @BeforeEach
    void setUp() {
        dedupIndex = new InMemoryDedupIndex();
        coordinator = new MergeCoordinator(dedupIndex);
    }

    @Test
    void finalizesAndRegistersNewContent() {
        DefaultUploadSession session = completeSession(null);
        when(backend.mode()).thenReturn(StorageMode.LOCAL);
        when(backend.computeContentHash(any(), anyList())).thenReturn(Optional.of(HASH));
        when(backend.finalizeUpload(any(), anyList())).thenReturn(new StoredObject("s1", 11, HASH));

        MergeOutcome outcome = coordinator.finalizeSession(session, backend);

        assertEquals("s1", outcome.getFinalLocation());
        assertEquals(HASH, outcome.getContentHash());
        assertFalse(outcome.isDeduplicated());
        assertEquals(Optional.of("s1"), dedupIndex.lookup(HASH, StorageMode.LOCAL));
        verify(backend).finalizeUpload(argThat(h -> "s1".equals(h.getSessionId()) && "/staging/s1".equals(h.getLocation())),
                argThat(refs -> refs.size() == 2 && refs.get(0).getIndex() == 0 && refs.get(1).getIndex() == 1));
        verify(backend, never()).abort(any());
    }

    @Test
    void reusesExistingObjectWithSameHash() {
        dedupIndex.register(HASH, StorageMode.LOCAL, "earlier-object");
        DefaultUploadSession session = completeSession(null);
        when(backend.mode()).thenReturn(StorageMode.LOCAL);
        when(backend.computeContentHash(any(), anyList())).thenReturn(Optional.of(HASH));

        MergeOutcome outcome = coordinator.finalizeSession(session, backend);

        assertEquals("earlier-object", outcome.getFinalLocation());
        assertTrue(outcome.isDeduplicated());
        assertEquals(11, outcome.getSize());
        verify(backend).abort(new StagingHandle("s1", "/staging/s1"));
        verify(backend, never()).finalizeUpload(any(), anyList());
    }

    @Test
    void declaredHashMismatchAbortsWithoutFinalizing() {
        DefaultUploadSession session = completeSession(OTHER_HASH);
        when(backend.computeContentHash(any(), anyList())).thenReturn(Optional.of(HASH));

        HashMismatchException e = assertThrows(HashMismatchException.class,
                () -> coordinator.finalizeSession(session, backend));

        assertEquals(OTHER_HASH, e.getExpected());
        assertEquals(HASH, e.getActual());
        verify(backend).abort(any());
        verify(backend, never()).finalizeUpload(any(), anyList());
    }

    @Test
    void remoteBackendKeysDedupOnChunkDigestsNotDeclaredHash() {
        DefaultUploadSession session = completeSession(HASH.toUpperCase());
        when(backend.mode()).thenReturn(StorageMode.REMOTE);
        when(backend.computeContentHash(any(), anyList())).thenReturn(Optional.empty());
        when(backend.finalizeUpload(any(), anyList())).thenReturn(new StoredObject("uploads/s1", 11, null));

        MergeOutcome outcome = coordinator.finalizeSession(session, backend);

        assertNull(outcome.getContentHash());
        assertFalse(outcome.isDeduplicated());
        String key = MergeCoordinator.manifestDigest(MergeCoordinator.orderedRefs(session));
        assertEquals(Optional.of("uploads/s1"), dedupIndex.lookup(key, StorageMode.REMOTE));
        assertEquals(Optional.empty(), dedupIndex.lookup(HASH, StorageMode.REMOTE));
    }

    @Test
    void remoteSessionDeclaringAnotherFilesHashKeepsItsOwnObject() {
        dedupIndex.register(HASH, StorageMode.REMOTE, "uploads/victim-session");
        DefaultUploadSession session = completeSession(HASH);
        session.getChunkDigests().put(0, ChecksumUtil.sha256Hex("junk".getBytes(StandardCharsets.UTF_8)));
        when(backend.mode()).thenReturn(StorageMode.REMOTE);
        when(backend.computeContentHash(any(), anyList())).thenReturn(Optional.empty());
        when(backend.finalizeUpload(any(), anyList())).thenReturn(new StoredObject("uploads/s1", 11, null));

        MergeOutcome outcome = coordinator.finalizeSession(session, backend);

        assertEquals("uploads/s1", outcome.getFinalLocation());
        assertFalse(outcome.isDeduplicated());
        verify(backend).finalizeUpload(any(), anyList());
        verify(backend, never()).abort(any());
    }

    @Test
    void remoteSessionsWithIdenticalChunksShareOneObject() {
        when(backend.mode()).thenReturn(StorageMode.REMOTE);
        when(backend.computeContentHash(any(), anyList())).thenReturn(Optional.empty());
        when(backend.finalizeUpload(any(), anyList())).thenReturn(new StoredObject("uploads/s1", 11, null));
        coordinator.finalizeSession(completeSession(null), backend);

        DefaultUploadSession second = completeSession(null);
        second.setSessionId("s2");
        MergeOutcome outcome = coordinator.finalizeSession(second, backend);

        assertEquals("uploads/s1", outcome.getFinalLocation());
        assertTrue(outcome.isDeduplicated());
        verify(backend).abort(argThat(h -> "s2".equals(h.getSessionId())));
        verify(backend, times(1)).finalizeUpload(any(), anyList());
    }

    @Test
    void manifestDigestDependsOnChunkOrder() {
        DefaultUploadSession session = completeSession(null);
        String forward = MergeCoordinator.manifestDigest(MergeCoordinator.orderedRefs(session));
        String first = session.getChunkDigests().get(0);
        session.getChunkDigests().put(0, session.getChunkDigests().get(1));
        session.getChunkDigests().put(1, first);

        assertNotEquals(forward, MergeCoordinator.manifestDigest(MergeCoordinator.orderedRefs(session)));
    }

    @Test
    void loserOfRegistrationRaceDropsItsObject() {
        DedupIndex racingIndex = mock(DedupIndex.class);
        when(racingIndex.lookup(HASH, StorageMode.LOCAL)).thenReturn(Optional.empty());
        when(racingIndex.register(HASH, StorageMode.LOCAL, "s1")).thenReturn("winner");
        DefaultUploadSession session = completeSession(null);
        when(backend.mode()).thenReturn(StorageMode.LOCAL);
        when(backend.computeContentHash(any(), anyList())).thenReturn(Optional.of(HASH));
        when(backend.finalizeUpload(any(), anyList())).thenReturn(new StoredObject("s1", 11, HASH));

        MergeOutcome outcome = new MergeCoordinator(racingIndex).finalizeSession(session, backend);

        assertEquals("winner", outcome.getFinalLocation());
        assertTrue(outcome.isDeduplicated());
        verify(backend).deleteFinal("s1");
    }

    @Test
    void finalizeFailureAbortsStagingAndPropagates() {
        DefaultUploadSession session = completeSession(null);
        when(backend.mode()).thenReturn(StorageMode.LOCAL);
        when(backend.computeContentHash(any(), anyList())).thenReturn(Optional.of(HASH));
        when(backend.finalizeUpload(any(), anyList()))
                .thenThrow(new StorageBackendException("finalizeUpload", "s1", "disk full"));

        assertThrows(StorageBackendException.class, () -> coordinator.finalizeSession(session, backend));

        verify(backend).abort(any());
        verify(backend, never()).deleteFinal(any());
        assertEquals(0, dedupIndex.size());
    }

    @Test
    void assembledHashDifferentFromComputedIsRejected() {
        DefaultUploadSession session = completeSession(null);
        when(backend.mode()).thenReturn(StorageMode.LOCAL);
        when(backend.computeContentHash(any(), anyList())).thenReturn(Optional.of(HASH));
        when(backend.finalizeUpload(any(), anyList())).thenReturn(new StoredObject("s1", 11, OTHER_HASH));

        assertThrows(HashMismatchException.class, () -> coordinator.finalizeSession(session, backend));

        verify(backend).deleteFinal(eq("s1"));
        assertEquals(0, dedupIndex.size());
    }

    @Test
    void incompleteSessionIsRefused() {
        DefaultUploadSession session = completeSession(null);
        session.setChunkBitset(BitsetUtil.newBitset(2));

        assertThrows(IllegalStateException.class, () -> coordinator.finalizeSession(session, backend));
        verifyNoInteractions(backend);
    }

    private static DefaultUploadSession completeSession(String declaredHash) {
        DefaultUploadSession session = new DefaultUploadSession();
        session.setSessionId("s1");
        session.setOwnerId("alice");
        session.setTotalSize(11);
        session.setChunkSize(6);
        session.setTotalChunks(2);
        byte[] bitset = BitsetUtil.newBitset(2);
        BitsetUtil.setBit(bitset, 0);
        BitsetUtil.setBit(bitset, 1);
        session.setChunkBitset(bitset);
        session.getChunkRefs().put(0, "chunk-00000000.part");
        session.getChunkRefs().put(1, "chunk-00000001.part");
        session.getChunkDigests().put(0, ChecksumUtil.sha256Hex("hello ".getBytes(StandardCharsets.UTF_8)));
        session.getChunkDigests().put(1, ChecksumUtil.sha256Hex("world".getBytes(StandardCharsets.UTF_8)));
        session.setDeclaredHash(declaredHash);
        session.setStatus(UploadStatus.MERGING);
        session.setStorageMode(StorageMode.LOCAL);
        session.setTempLocation("/staging/s1");
        return session;
    }
}

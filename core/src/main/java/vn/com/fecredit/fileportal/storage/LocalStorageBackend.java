package vn.com.fecredit.fileportal.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.fileportal.exception.ChunkConflictException;
import vn.com.fecredit.fileportal.exception.StorageBackendException;
import vn.com.fecredit.fileportal.model.StorageMode;
import vn.com.fecredit.fileportal.model.util.ChecksumUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Filesystem backend. Each session stages its chunks as separate files under
 * {@code <stagingRoot>/<sessionId>/}; finalizing concatenates them into
 * {@code <objectRoot>/<sessionId>}.
 */
public class LocalStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalStorageBackend.class);
    private static final String CHUNK_FILE_FORMAT = "chunk-%08d.part";

    private final Path stagingRoot;
    private final Path objectRoot;

    public LocalStorageBackend(Path stagingRoot, Path objectRoot) {
        this.stagingRoot = stagingRoot.toAbsolutePath().normalize();
        this.objectRoot = objectRoot.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.stagingRoot);
            Files.createDirectories(this.objectRoot);
        } catch (IOException e) {
            throw new StorageBackendException("init", null, "Cannot create storage directories", e);
        }
    }

    @Override
    public StorageMode mode() {
        return StorageMode.LOCAL;
    }

    @Override
    public long minimumChunkSize() {
        return 1;
    }

    @Override
    public int maximumChunkCount() {
        return Integer.MAX_VALUE;
    }

    @Override
    public StagingHandle openStagingArea(String sessionId) {
        Path dir = stagingDir(sessionId);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageBackendException("openStagingArea", sessionId, "Cannot create staging directory", e);
        }
        log.debug("Opened staging directory {} for session {}", dir, sessionId);
        return new StagingHandle(sessionId, dir.toString());
    }

    @Override
    public ChunkRef writeChunk(StagingHandle handle, int index, byte[] data) {
        Path dir = Paths.get(handle.getLocation());
        if (!Files.isDirectory(dir)) {
            throw new StorageBackendException("writeChunk", handle.getSessionId(), "Staging directory is missing: " + dir);
        }
        String fileName = String.format(CHUNK_FILE_FORMAT, index);
        Path target = dir.resolve(fileName);
        String digest = ChecksumUtil.sha256Hex(data);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, fileName, ".tmp");
            Files.write(tmp, data);
            try {
                // no REPLACE_EXISTING: an existing chunk file is never overwritten
                Files.move(tmp, target);
            } catch (FileAlreadyExistsException e) {
                String existing = ChecksumUtil.sha256Hex(target);
                if (!existing.equals(digest)) {
                    throw new ChunkConflictException(handle.getSessionId(), index);
                }
                log.debug("Chunk {} of session {} already stored with identical content", index, handle.getSessionId());
            }
            return new ChunkRef(index, fileName, digest, data.length);
        } catch (IOException e) {
            throw new StorageBackendException("writeChunk", handle.getSessionId(), "Cannot write chunk " + index, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    @Override
    public Optional<String> computeContentHash(StagingHandle handle, List<ChunkRef> orderedRefs) {
        MessageDigest digest = ChecksumUtil.newDigest();
        Path dir = Paths.get(handle.getLocation());
        try (OutputStream sink = new DigestOutputStream(OutputStream.nullOutputStream(), digest)) {
            for (ChunkRef ref : orderedRefs) {
                Files.copy(dir.resolve(ref.getRef()), sink);
            }
        } catch (IOException e) {
            throw new StorageBackendException("computeContentHash", handle.getSessionId(), "Cannot read staged chunks", e);
        }
        return Optional.of(ChecksumUtil.toHex(digest.digest()));
    }

    @Override
    public StoredObject finalizeUpload(StagingHandle handle, List<ChunkRef> orderedRefs) {
        String sessionId = handle.getSessionId();
        Path dir = Paths.get(handle.getLocation());
        Path finalPath = objectPath(sessionId);
        MessageDigest digest = ChecksumUtil.newDigest();
        long size = 0;
        Path tmp = null;
        try {
            tmp = Files.createTempFile(objectRoot, sessionId, ".assembling");
            try (OutputStream out = new DigestOutputStream(Files.newOutputStream(tmp), digest)) {
                for (ChunkRef ref : orderedRefs) {
                    size += Files.copy(dir.resolve(ref.getRef()), out);
                }
            }
            Files.move(tmp, finalPath, StandardCopyOption.ATOMIC_MOVE);
            tmp = null;
        } catch (IOException e) {
            throw new StorageBackendException("finalizeUpload", sessionId, "Cannot assemble object", e);
        } finally {
            deleteQuietly(tmp);
        }
        String hash = ChecksumUtil.toHex(digest.digest());
        log.info("Assembled {} chunks ({} bytes) for session {} into {}", orderedRefs.size(), size, sessionId, finalPath);
        abort(handle);
        return new StoredObject(sessionId, size, hash);
    }

    @Override
    public void abort(StagingHandle handle) {
        Path dir = Paths.get(handle.getLocation());
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            log.debug("Removed staging directory {} for session {}", dir, handle.getSessionId());
        } catch (NoSuchFileException e) {
            log.debug("Staging directory {} already gone", dir);
        } catch (IOException | UncheckedIOException e) {
            throw new StorageBackendException("abort", handle.getSessionId(), "Cannot remove staging directory", e);
        }
    }

    @Override
    public boolean stagingExists(StagingHandle handle) {
        return Files.isDirectory(Paths.get(handle.getLocation()));
    }

    @Override
    public DownloadReference readFinal(String location) {
        Path path = objectPath(location);
        try {
            long size = Files.size(path);
            InputStream in = Files.newInputStream(path);
            return DownloadReference.ofStream(in, size);
        } catch (IOException e) {
            throw new StorageBackendException("readFinal", null, "Cannot open object " + location, e);
        }
    }

    @Override
    public void deleteFinal(String location) {
        try {
            Files.deleteIfExists(objectPath(location));
        } catch (IOException e) {
            throw new StorageBackendException("deleteFinal", null, "Cannot delete object " + location, e);
        }
    }

    @Override
    public boolean objectExists(String location) {
        return Files.isRegularFile(objectPath(location));
    }

    public Path getStagingRoot() {
        return stagingRoot;
    }

    public Path getObjectRoot() {
        return objectRoot;
    }

    private Path stagingDir(String sessionId) {
        return confine(stagingRoot, sessionId);
    }

    private Path objectPath(String location) {
        return confine(objectRoot, location);
    }

    private static Path confine(Path root, String name) {
        Path resolved = root.resolve(name).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new StorageBackendException("resolve", null, "Invalid storage name: " + name);
        }
        return resolved;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
        }
    }
}

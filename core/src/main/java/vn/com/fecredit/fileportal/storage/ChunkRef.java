package vn.com.fecredit.fileportal.storage;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Acknowledgement of a stored chunk.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ChunkRef {
    private final int index;
    /** Chunk file name (local) or part ETag (remote). */
    private final String ref;
    /** SHA-256 hex of the chunk bytes. */
    private final String digest;
    private final long size;
}

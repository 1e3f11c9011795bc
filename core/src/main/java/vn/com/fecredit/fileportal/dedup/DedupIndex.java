package vn.com.fecredit.fileportal.dedup;

import vn.com.fecredit.fileportal.model.StorageMode;

import java.util.Optional;

/**
 * Maps a content hash to the durable object already holding those bytes. Entries are
 * scoped per storage mode because a local path is meaningless to the remote store.
 */
public interface DedupIndex {

    Optional<String> lookup(String contentHash, StorageMode mode);

    /**
     * Inserts the mapping unless one already exists.
     *
     * @return the location that is registered after the call: {@code location} if this
     * call won, otherwise the location registered earlier
     */
    String register(String contentHash, StorageMode mode, String location);
}

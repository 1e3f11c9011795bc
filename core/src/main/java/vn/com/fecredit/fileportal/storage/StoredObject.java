package vn.com.fecredit.fileportal.storage;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of finalizing a staging area into a durable object.
 */
@Getter
@AllArgsConstructor
@ToString
public class StoredObject {
    private final String location;
    private final long size;
    /** Hash computed while writing the object, or {@code null} if the backend never saw the bytes. */
    private final String contentHash;
}

package vn.com.fecredit.fileportal.core;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import vn.com.fecredit.fileportal.model.StorageMode;

/**
 * Published once per session that reaches COMPLETED.
 */
@Getter
@AllArgsConstructor
@ToString
public class UploadCompletedEvent {
    private final String sessionId;
    private final String ownerId;
    private final String filename;
    private final String contentType;
    private final String finalLocation;
    private final long size;
    private final String contentHash;
    private final StorageMode storageMode;
    private final boolean deduplicated;
}

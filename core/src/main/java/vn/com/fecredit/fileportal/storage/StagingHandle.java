package vn.com.fecredit.fileportal.storage;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Identifies the staging resources of one session: a directory path for local storage,
 * a multipart upload id for remote storage.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class StagingHandle {
    private final String sessionId;
    private final String location;
}

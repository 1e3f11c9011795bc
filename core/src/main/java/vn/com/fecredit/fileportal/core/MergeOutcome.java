package vn.com.fecredit.fileportal.core;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class MergeOutcome {
    private final String finalLocation;
    /** SHA-256 hex of the content, or {@code null} when it could not be established. */
    private final String contentHash;
    private final long size;
    /** True when an existing object was reused instead of keeping this session's bytes. */
    private final boolean deduplicated;
}

package vn.com.fecredit.fileportal.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Upload session policy.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "fileportal.upload")
public class UploadProperties {

    /** Chunk size used when the client does not request one (5 MiB). */
    private int defaultChunkSize = 5 * 1024 * 1024;

    /** Lifetime of a session from creation; unfinished sessions are expired afterwards. */
    private Duration sessionTtl = Duration.ofHours(24);

    /** Delay between expiry sweeps. */
    private Duration reaperInterval = Duration.ofMinutes(5);

    /** Filename extensions accepted at init, case-insensitive. An empty list accepts any file. */
    private List<String> allowedExtensions = new ArrayList<>(
            List.of("txt", "pdf", "png", "jpg", "jpeg", "gif", "doc", "docx", "zip"));
}

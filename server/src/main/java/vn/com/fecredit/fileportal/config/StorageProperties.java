package vn.com.fecredit.fileportal.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import vn.com.fecredit.fileportal.model.StorageMode;

import java.time.Duration;

/**
 * Where finished files and in-progress chunks are kept.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "fileportal.storage")
public class StorageProperties {

    /** Backend used for new sessions. */
    private StorageMode mode = StorageMode.LOCAL;

    private final Local local = new Local();

    private final Remote remote = new Remote();

    @Getter
    @Setter
    public static class Local {
        /** Per-session chunk directories. */
        private String stagingDir = "uploads/staging";

        /** Assembled files. */
        private String objectDir = "uploads/objects";
    }

    /**
     * S3 or an S3-compatible service.
     */
    @Getter
    @Setter
    public static class Remote {
        /** Endpoint override for S3-compatible services; empty for AWS. */
        private String endpoint;

        private String region = "us-east-1";

        private String bucket;

        /** Key prefix of every object. */
        private String prefix = "uploads";

        /** Static credentials; the default AWS provider chain is used when unset. */
        private String accessKey;

        private String secretKey;

        private boolean pathStyleAccess;

        /** Validity of download links. */
        private Duration signedUrlTtl = Duration.ofHours(1);
    }
}

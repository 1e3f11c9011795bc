package vn.com.fecredit.fileportal.storage;

import lombok.Getter;

import java.io.InputStream;
import java.net.URL;
import java.time.Instant;

/**
 * How to retrieve a finished object: either an open byte stream or a time-limited URL.
 */
@Getter
public class DownloadReference {

    private final InputStream stream;
    private final long size;
    private final URL url;
    private final Instant expiresAt;

    private DownloadReference(InputStream stream, long size, URL url, Instant expiresAt) {
        this.stream = stream;
        this.size = size;
        this.url = url;
        this.expiresAt = expiresAt;
    }

    public static DownloadReference ofStream(InputStream stream, long size) {
        return new DownloadReference(stream, size, null, null);
    }

    public static DownloadReference ofSignedUrl(URL url, Instant expiresAt) {
        return new DownloadReference(null, -1, url, expiresAt);
    }

    public boolean isRedirect() {
        return url != null;
    }
}

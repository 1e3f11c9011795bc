package vn.com.fecredit.fileportal.model;

import java.time.Instant;

/**
 * Time-limited direct link to a file held in remote storage.
 */
public class DownloadLinkResponse {

    private String url;
    private Instant expiresAt;

    public DownloadLinkResponse() {
    }

    public DownloadLinkResponse(String url, Instant expiresAt) {
        this.url = url;
        this.expiresAt = expiresAt;
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
}

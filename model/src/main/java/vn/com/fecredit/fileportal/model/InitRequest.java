package vn.com.fecredit.fileportal.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

/**
 * Request object for initializing or resuming a chunked upload.
 *
 * <p>
 * A session is resumed instead of created when either:
 * <ul>
 * <li>{@code brokenUploadId} names a live session of the caller with the same size</li>
 * <li>{@code checksum} and {@code fileSize} match a live session of the caller</li>
 * </ul>
 */
public class InitRequest {

    /**
     * ID of a previous broken upload to resume, if any.
     */
    private String brokenUploadId;

    /**
     * Optional SHA-256 (hex) of the complete file. When present the merged content is
     * verified against it and it becomes the deduplication key.
     */
    @Pattern(regexp = "^[0-9a-fA-F]{64}$", message = "checksum must be a hex encoded SHA-256")
    private String checksum;

    /**
     * Total size of the file in bytes.
     */
    @Positive
    private long fileSize;

    /**
     * Optional chunk size in bytes. The server default applies when absent.
     */
    @Positive
    private Integer chunkSize;

    /**
     * Original name of the file being uploaded.
     */
    @NotBlank
    private String filename;

    private String contentType;

    public InitRequest() {
    }

    public InitRequest(String filename, long fileSize, Integer chunkSize, String checksum) {
        this.filename = filename;
        this.fileSize = fileSize;
        this.chunkSize = chunkSize;
        this.checksum = checksum;
    }

    public long getFileSize() {
        return fileSize;
    }

    public void setFileSize(long fileSize) {
        this.fileSize = fileSize;
    }

    public Integer getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(Integer chunkSize) {
        this.chunkSize = chunkSize;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    /**
     * @return the broken upload ID, or null if this is a new upload
     */
    public String getBrokenUploadId() {
        return brokenUploadId;
    }

    public void setBrokenUploadId(String brokenUploadId) {
        this.brokenUploadId = brokenUploadId;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }
}

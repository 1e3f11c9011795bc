package vn.com.fecredit.fileportal.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Response returned when an upload session is created or re-presented for resumption.
 *
 * <p>
 * Clients upload only the indices listed in {@code missingChunkNumbers}; for a fresh
 * session that is every index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InitResponse {

    /** Upload session identifier assigned by the server. */
    private String uploadId;
    /** Total number of chunks expected for the file. */
    private int totalChunks;
    /** Chunk size in bytes fixed for this session. */
    private int chunkSize;
    private long fileSize;
    private String filename;
    /** Session status name, e.g. PENDING or UPLOADING. */
    private String status;
    /** True when an existing session was re-presented instead of a new one created. */
    private boolean resumed;
    private Instant expiresAt;

    /** Bitset bytes for chunk status tracking (padding bits set). */
    private byte[] bitsetBytes;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String checksum;

    private List<Integer> missingChunkNumbers;

    /**
     * Default constructor for JSON deserialization.
     */
    public InitResponse() {
    }

    public InitResponse(String uploadId, int totalChunks, int chunkSize, long fileSize, String filename, byte[] bitsetBytes) {
        this.uploadId = uploadId;
        this.totalChunks = totalChunks;
        this.chunkSize = chunkSize;
        this.fileSize = fileSize;
        this.filename = filename;
        this.bitsetBytes = bitsetBytes;
    }

    public String getUploadId() { return uploadId; }
    public void setUploadId(String uploadId) { this.uploadId = uploadId; }
    public int getTotalChunks() { return totalChunks; }
    public void setTotalChunks(int totalChunks) { this.totalChunks = totalChunks; }
    public byte[] getBitsetBytes() { return bitsetBytes; }
    public void setBitsetBytes(byte[] bitsetBytes) { this.bitsetBytes = bitsetBytes; }
    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
    public long getFileSize() { return fileSize; }
    public void setFileSize(long fileSize) { this.fileSize = fileSize; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public boolean isResumed() { return resumed; }
    public void setResumed(boolean resumed) { this.resumed = resumed; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
    public String getChecksum() { return checksum; }
    public void setChecksum(String checksum) { this.checksum = checksum; }
    public List<Integer> getMissingChunkNumbers() { return missingChunkNumbers; }
    public void setMissingChunkNumbers(List<Integer> missingChunkNumbers) { this.missingChunkNumbers = missingChunkNumbers; }
}

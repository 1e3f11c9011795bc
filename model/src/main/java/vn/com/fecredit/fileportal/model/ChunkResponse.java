package vn.com.fecredit.fileportal.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Acknowledgement for one accepted chunk. When the chunk completed the file the status is
 * already terminal ({@code COMPLETED} or {@code FAILED}) because the merge runs in the same call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChunkResponse {

    private String uploadId;
    private int chunkNumber;
    private String status;
    private double progressPercent;
    private List<Integer> missingChunkNumbers;
    /** Set once the session is COMPLETED. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String fileId;

    public ChunkResponse() {
    }

    public ChunkResponse(String uploadId, int chunkNumber, String status, double progressPercent, List<Integer> missingChunkNumbers) {
        this.uploadId = uploadId;
        this.chunkNumber = chunkNumber;
        this.status = status;
        this.progressPercent = progressPercent;
        this.missingChunkNumbers = missingChunkNumbers;
    }

    public String getUploadId() { return uploadId; }
    public void setUploadId(String uploadId) { this.uploadId = uploadId; }
    public int getChunkNumber() { return chunkNumber; }
    public void setChunkNumber(int chunkNumber) { this.chunkNumber = chunkNumber; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public double getProgressPercent() { return progressPercent; }
    public void setProgressPercent(double progressPercent) { this.progressPercent = progressPercent; }
    public List<Integer> getMissingChunkNumbers() { return missingChunkNumbers; }
    public void setMissingChunkNumbers(List<Integer> missingChunkNumbers) { this.missingChunkNumbers = missingChunkNumbers; }
    public String getFileId() { return fileId; }
    public void setFileId(String fileId) { this.fileId = fileId; }
}

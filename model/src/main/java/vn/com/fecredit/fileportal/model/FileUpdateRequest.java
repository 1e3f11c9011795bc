package vn.com.fecredit.fileportal.model;

import jakarta.validation.constraints.Size;

/**
 * Partial update of a file record. Absent fields are left unchanged.
 */
public class FileUpdateRequest {

    @Size(max = 255)
    private String filename;

    @Size(max = 1000)
    private String description;

    public FileUpdateRequest() {
    }

    public FileUpdateRequest(String filename, String description) {
        this.filename = filename;
        this.description = description;
    }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}

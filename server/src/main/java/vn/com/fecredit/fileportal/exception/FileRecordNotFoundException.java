package vn.com.fecredit.fileportal.exception;

public class FileRecordNotFoundException extends RuntimeException {

    private final String fileId;

    public FileRecordNotFoundException(String fileId) {
        super("File not found: " + fileId);
        this.fileId = fileId;
    }

    public String getFileId() {
        return fileId;
    }
}

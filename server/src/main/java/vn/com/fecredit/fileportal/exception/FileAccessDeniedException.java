package vn.com.fecredit.fileportal.exception;

/**
 * The file exists but belongs to another account.
 */
public class FileAccessDeniedException extends RuntimeException {

    public FileAccessDeniedException(String fileId) {
        super("Access denied to file " + fileId);
    }
}

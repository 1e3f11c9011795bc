package vn.com.fecredit.fileportal.exception;

public class HashMismatchException extends UploadException {

    private final String expected;
    private final String actual;

    public HashMismatchException(String sessionId, String expected, String actual) {
        super(UploadErrorCode.HASH_MISMATCH, sessionId, "Checksum mismatch after file assembly");
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}

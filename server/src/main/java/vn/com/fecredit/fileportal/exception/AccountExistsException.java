package vn.com.fecredit.fileportal.exception;

public class AccountExistsException extends RuntimeException {

    public AccountExistsException(String username) {
        super("Username already taken: " + username);
    }

    public AccountExistsException(String username, Throwable cause) {
        super("Username already taken: " + username, cause);
    }
}
